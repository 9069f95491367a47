package com.fastalert.core.filter;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * 单个过滤器的计数器, 每次评估(无论成败)更新一次
 * 平均耗时与计数在同一把锁内读写
 */
public class AlertFilterMetrics {

    private final String filterName;

    private long evaluations;
    private long allowed;
    private long suppressed;
    private long modified;
    private long deferred;
    private long errors;
    private long totalNanos;
    private long maxNanos;
    private Instant lastEvaluation;

    public AlertFilterMetrics(String filterName) {
        this.filterName = filterName;
    }

    public synchronized void record(FilterDecision decision, long nanos, Instant at) {
        evaluations++;
        switch (decision) {
            case ALLOW -> allowed++;
            case SUPPRESS -> suppressed++;
            case MODIFY -> modified++;
            case DEFER -> deferred++;
        }
        addTime(nanos, at);
    }

    /**
     * 出错也计入一次评估, decision 为出错后按模式得出的结论
     */
    public synchronized void recordError(FilterDecision decision, long nanos, Instant at) {
        errors++;
        record(decision, nanos, at);
    }

    private void addTime(long nanos, Instant at) {
        totalNanos += Math.max(0, nanos);
        maxNanos = Math.max(maxNanos, nanos);
        lastEvaluation = at;
    }

    public synchronized void reset() {
        evaluations = allowed = suppressed = modified = deferred = errors = totalNanos = maxNanos = 0;
        lastEvaluation = null;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(filterName, evaluations, allowed, suppressed, modified, deferred, errors,
                totalNanos, maxNanos, lastEvaluation);
    }

    @Getter
    @AllArgsConstructor
    @ToString
    public static final class Snapshot {
        private final String filterName;
        private final long evaluations;
        private final long allowed;
        private final long suppressed;
        private final long modified;
        private final long deferred;
        private final long errors;
        private final long totalNanos;
        private final long maxNanos;
        private final Instant lastEvaluation;

        public Duration getAverageTime() {
            return evaluations == 0 ? Duration.ZERO : Duration.ofNanos(totalNanos / evaluations);
        }

        public double getSuppressionRate() {
            return evaluations == 0 ? 0d : (double) suppressed / evaluations;
        }

        public double getErrorRate() {
            return evaluations == 0 ? 0d : (double) errors / evaluations;
        }
    }
}
