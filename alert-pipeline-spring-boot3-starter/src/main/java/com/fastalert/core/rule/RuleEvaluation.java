package com.fastalert.core.rule;

import com.fastalert.model.Alert;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 规则执行明细
 */
@Getter
@AllArgsConstructor
@ToString
public final class RuleEvaluation {

    /** 应用全部命中规则后的告警, 被抑制时为 null */
    private final Alert alert;
    /** 执行 SUPPRESS 的规则 id */
    private final String suppressedBy;
    /** 按执行顺序记录的命中规则 id */
    private final List<String> matchedRules;

    public boolean isSuppressed() {
        return alert == null;
    }
}
