package com.fastalert.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 告警被抑制的原因, 用于统计分类
 */
@AllArgsConstructor
@Getter
public enum SuppressionReason {
    DISABLED("管道已关闭"),
    SEVERITY("低于最低级别"),
    DUPLICATE("重复告警"),
    RATE_LIMIT("来源限流"),
    FILTER("过滤器抑制"),
    RULE("规则抑制"),
    DEFERRAL_EXPIRED("延迟次数用尽");

    public final String desc;
}
