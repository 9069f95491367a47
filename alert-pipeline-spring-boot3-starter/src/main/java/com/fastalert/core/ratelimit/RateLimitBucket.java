package com.fastalert.core.ratelimit;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * 单个 source 的令牌桶
 * 不变量: 0 <= availableTokens <= burstSize, alertCount + suppressedCount == 调用次数
 * 所有读写都在桶自身的锁内, 不同 source 之间互不阻塞
 */
public class RateLimitBucket {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final String source;
    private final double tokensPerMinute;
    private final int burstSize;

    private double availableTokens;
    private Instant lastRefill;
    private Instant lastAlertTime;
    private long alertCount;
    private long suppressedCount;

    RateLimitBucket(String source, double tokensPerMinute, int burstSize, Instant now) {
        this.source = source;
        this.tokensPerMinute = tokensPerMinute;
        this.burstSize = burstSize;
        // 新桶满容量
        this.availableTokens = burstSize;
        this.lastRefill = now;
    }

    /**
     * 惰性补充后尝试取一个令牌
     */
    synchronized RateLimitDecision tryConsume(Instant now) {
        refill(now);
        lastAlertTime = now;
        boolean allowed;
        if (availableTokens >= 1d) {
            availableTokens -= 1d;
            alertCount++;
            allowed = true;
        } else {
            suppressedCount++;
            allowed = false;
        }
        return new RateLimitDecision(allowed, snapshotLocked());
    }

    private void refill(Instant now) {
        // 时钟回拨不补充, 也不回退 lastRefill
        if (!now.isAfter(lastRefill)) {
            return;
        }
        double seconds = Duration.between(lastRefill, now).toNanos() / NANOS_PER_SECOND;
        double added = seconds * tokensPerMinute / 60d;
        availableTokens = Math.min(burstSize, availableTokens + added);
        lastRefill = now;
    }

    synchronized boolean isIdleSince(Instant threshold) {
        Instant last = lastAlertTime == null ? lastRefill : lastAlertTime;
        return last.isBefore(threshold);
    }

    public synchronized Snapshot snapshot() {
        return snapshotLocked();
    }

    private Snapshot snapshotLocked() {
        return new Snapshot(source, tokensPerMinute, burstSize, availableTokens,
                lastRefill, lastAlertTime, alertCount, suppressedCount);
    }

    public String getSource() {
        return source;
    }

    /**
     * 桶状态快照
     */
    @Getter
    @AllArgsConstructor
    @ToString
    public static final class Snapshot {
        private final String source;
        private final double tokensPerMinute;
        private final int burstSize;
        private final double availableTokens;
        private final Instant lastRefill;
        private final Instant lastAlertTime;
        private final long alertCount;
        private final long suppressedCount;

        public long getTotalCalls() {
            return alertCount + suppressedCount;
        }
    }
}
