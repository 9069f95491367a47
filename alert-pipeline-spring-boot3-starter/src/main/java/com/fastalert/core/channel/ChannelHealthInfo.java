package com.fastalert.core.channel;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 渠道健康快照
 */
@Getter
@AllArgsConstructor
@ToString
public final class ChannelHealthInfo {

    private final String channel;
    private final boolean healthy;
    private final int consecutiveFailures;
    private final CircuitBreakerState circuitState;
    private final Instant lastHealthCheck;
    private final String lastMessage;
    private final ChannelMetrics.Snapshot metrics;
}
