package com.fastalert.core.suppress;

import com.fastalert.model.enums.AlertSeverity;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.UUID;

/**
 * 去重判定结果
 */
@Getter
@AllArgsConstructor
@ToString
public final class DuplicateCheck {

    /** true 表示重复且应抑制 */
    private final boolean suppressed;

    /** 窗口内首个告警的 id, 首次出现时即为自身 */
    private final UUID primaryId;

    /** 窗口内累计出现次数(含本次) */
    private final int occurrences;

    /** 升级后的级别, 未升级为 null */
    private final AlertSeverity escalatedSeverity;

    public boolean isFirstOccurrence() {
        return occurrences == 1;
    }

    public boolean isEscalated() {
        return escalatedSeverity != null;
    }
}
