package com.fastalert.model.stat;

import com.fastalert.model.enums.SuppressionReason;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * 管道统计快照
 */
@Getter
@Builder
@ToString
public class AlertStatistics {

    private final long totalRaised;
    private final long totalDelivered;
    private final long totalDeliveryFailures;
    /** 没有符合条件渠道的告警数 */
    private final long totalUndeliverable;
    private final long totalSuppressed;
    private final Map<SuppressionReason, Long> suppressedByReason;
    private final long totalDeferred;
    private final long totalAcknowledged;
    private final long totalResolved;
    /** 管道内部异常次数(过滤/规则以外的阶段) */
    private final long evaluationErrors;
    private final int activeAlertCount;
    private final Duration averageProcessingTime;
    private final Instant lastAlertTime;

    /**
     * 已走完投递流程的告警数
     */
    public long getTotalDispatched() {
        return totalDelivered + totalDeliveryFailures + totalUndeliverable;
    }

    public double getFailureRate() {
        long n = getTotalDispatched();
        return n == 0 ? 0d : (double) (totalDeliveryFailures + totalUndeliverable) / n;
    }

    public double getErrorRate() {
        return totalRaised == 0 ? 0d : (double) evaluationErrors / totalRaised;
    }

    public long getSuppressed(SuppressionReason reason) {
        return suppressedByReason == null ? 0 : suppressedByReason.getOrDefault(reason, 0L);
    }
}
