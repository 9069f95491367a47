package com.fastalert.core.channel;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * 渠道投递计数
 * deliveries 每条告警记一次(终态), attempts 每次调用 send 记一次
 */
public class ChannelMetrics {

    private final String channel;

    private long deliveries;
    private long successes;
    private long failures;
    private long attempts;
    private long retries;
    private long timeouts;
    private long skipped;
    private long totalNanos;
    private Instant lastSuccess;
    private Instant lastFailure;

    public ChannelMetrics(String channel) {
        this.channel = channel;
    }

    public synchronized void recordAttempt(boolean timedOut) {
        attempts++;
        if (timedOut) {
            timeouts++;
        }
    }

    public synchronized void recordDelivery(boolean success, Duration duration, int retryCount, Instant at) {
        deliveries++;
        retries += retryCount;
        totalNanos += duration.toNanos();
        if (success) {
            successes++;
            lastSuccess = at;
        } else {
            failures++;
            lastFailure = at;
        }
    }

    public synchronized void recordSkipped() {
        skipped++;
    }

    public synchronized void reset() {
        deliveries = successes = failures = attempts = retries = timeouts = skipped = totalNanos = 0;
        lastSuccess = lastFailure = null;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(channel, deliveries, successes, failures, attempts, retries, timeouts, skipped,
                totalNanos, lastSuccess, lastFailure);
    }

    @Getter
    @AllArgsConstructor
    @ToString
    public static final class Snapshot {
        private final String channel;
        private final long deliveries;
        private final long successes;
        private final long failures;
        private final long attempts;
        private final long retries;
        private final long timeouts;
        private final long skipped;
        private final long totalNanos;
        private final Instant lastSuccess;
        private final Instant lastFailure;

        public double getSuccessRate() {
            return deliveries == 0 ? 0d : (double) successes / deliveries;
        }

        public double getFailureRate() {
            return deliveries == 0 ? 0d : (double) failures / deliveries;
        }

        public Duration getAverageDeliveryTime() {
            return deliveries == 0 ? Duration.ZERO : Duration.ofNanos(totalNanos / deliveries);
        }
    }
}
