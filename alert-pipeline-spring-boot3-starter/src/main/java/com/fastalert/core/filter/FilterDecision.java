package com.fastalert.core.filter;

/**
 * 过滤结论
 */
public enum FilterDecision {
    ALLOW,
    SUPPRESS,
    // 以新告警替换后续评估对象
    MODIFY,
    // 暂缓, 稍后重新评估
    DEFER
}
