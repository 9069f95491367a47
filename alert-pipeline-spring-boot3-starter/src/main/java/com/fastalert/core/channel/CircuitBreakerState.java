package com.fastalert.core.channel;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

/**
 * 渠道熔断状态
 */
public enum CircuitBreakerState {
    CLOSED,
    OPEN,
    HALF_OPEN;

    static CircuitBreakerState from(CircuitBreaker.State state) {
        return switch (state) {
            case OPEN, FORCED_OPEN -> OPEN;
            case HALF_OPEN -> HALF_OPEN;
            default -> CLOSED;
        };
    }
}
