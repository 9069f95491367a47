package com.fastalert.core.spi.suppress;

import com.fastalert.model.Alert;
import com.fastalert.model.enums.AlertSeverity;

/**
 * 重复告警升级策略
 * 返回高于当前级别的 severity 时, 这次重复不再被抑制, 而是以升级后的级别投递合并告警
 */
@FunctionalInterface
public interface EscalationPolicy {

    EscalationPolicy NONE = (duplicate, current, occurrences) -> current;

    /**
     * @param duplicate   本次重复的告警
     * @param current     主告警当前级别
     * @param occurrences 含本次在内的出现次数
     */
    AlertSeverity escalate(Alert duplicate, AlertSeverity current, int occurrences);
}
