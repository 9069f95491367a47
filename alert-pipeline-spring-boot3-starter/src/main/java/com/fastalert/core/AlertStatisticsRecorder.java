package com.fastalert.core;

import com.fastalert.model.enums.SuppressionReason;
import com.fastalert.model.stat.AlertStatistics;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * 管道计数器, 派生值在快照时计算
 */
final class AlertStatisticsRecorder {

    private final LongAdder raised = new LongAdder();
    private final LongAdder delivered = new LongAdder();
    private final LongAdder deliveryFailures = new LongAdder();
    private final LongAdder undeliverable = new LongAdder();
    private final LongAdder deferred = new LongAdder();
    private final LongAdder acknowledged = new LongAdder();
    private final LongAdder resolved = new LongAdder();
    private final LongAdder evaluationErrors = new LongAdder();
    private final Map<SuppressionReason, LongAdder> suppressed = new EnumMap<>(SuppressionReason.class);

    // 平均耗时需要 sum/count 一致
    private long processedCount;
    private long processedNanos;

    private volatile Instant lastAlertTime;

    AlertStatisticsRecorder() {
        for (SuppressionReason r : SuppressionReason.values()) {
            suppressed.put(r, new LongAdder());
        }
    }

    void raised(Instant at) {
        raised.increment();
        lastAlertTime = at;
    }

    void delivered() { delivered.increment(); }
    void deliveryFailed() { deliveryFailures.increment(); }
    void undeliverable() { undeliverable.increment(); }
    void deferred() { deferred.increment(); }
    void acknowledged() { acknowledged.increment(); }
    void resolved() { resolved.increment(); }
    void evaluationError() { evaluationErrors.increment(); }

    void suppressed(SuppressionReason reason) {
        suppressed.get(reason).increment();
    }

    synchronized void processed(long nanos) {
        processedCount++;
        processedNanos += nanos;
    }

    AlertStatistics snapshot(int activeAlerts) {
        long count;
        long nanos;
        synchronized (this) {
            count = processedCount;
            nanos = processedNanos;
        }
        Map<SuppressionReason, Long> byReason = new EnumMap<>(SuppressionReason.class);
        long totalSuppressed = 0;
        for (Map.Entry<SuppressionReason, LongAdder> e : suppressed.entrySet()) {
            long v = e.getValue().sum();
            byReason.put(e.getKey(), v);
            totalSuppressed += v;
        }
        return AlertStatistics.builder()
                .totalRaised(raised.sum())
                .totalDelivered(delivered.sum())
                .totalDeliveryFailures(deliveryFailures.sum())
                .totalUndeliverable(undeliverable.sum())
                .totalSuppressed(totalSuppressed)
                .suppressedByReason(byReason)
                .totalDeferred(deferred.sum())
                .totalAcknowledged(acknowledged.sum())
                .totalResolved(resolved.sum())
                .evaluationErrors(evaluationErrors.sum())
                .activeAlertCount(activeAlerts)
                .averageProcessingTime(count == 0 ? Duration.ZERO : Duration.ofNanos(nanos / count))
                .lastAlertTime(lastAlertTime)
                .build();
    }

    synchronized void reset() {
        raised.reset();
        delivered.reset();
        deliveryFailures.reset();
        undeliverable.reset();
        deferred.reset();
        acknowledged.reset();
        resolved.reset();
        evaluationErrors.reset();
        suppressed.values().forEach(LongAdder::reset);
        processedCount = 0;
        processedNanos = 0;
        lastAlertTime = null;
    }
}
