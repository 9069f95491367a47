package com.fastalert.model.enums;

/**
 * 系统健康等级, 由健康分推导
 */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY,
    CRITICAL;

    public static HealthStatus fromScore(double score) {
        if (score >= 80) {
            return HEALTHY;
        }
        if (score >= 60) {
            return DEGRADED;
        }
        if (score >= 30) {
            return UNHEALTHY;
        }
        return CRITICAL;
    }
}
