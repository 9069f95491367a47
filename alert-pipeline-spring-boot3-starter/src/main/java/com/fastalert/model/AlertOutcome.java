package com.fastalert.model;

import com.fastalert.core.delivery.AlertDeliveryResults;
import com.fastalert.model.enums.AlertDisposition;
import com.fastalert.model.enums.SuppressionReason;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 一次 process 的结果
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class AlertOutcome {

    private final AlertDisposition disposition;
    /** 管道处理后的告警(过滤/规则修改、重复合并之后) */
    private final Alert alert;
    /** 仅 SUPPRESSED 时非空 */
    private final SuppressionReason suppressionReason;
    /** 抑制或暂缓的说明, 例如过滤器名/规则 id */
    private final String detail;
    /** 仅进入投递阶段时非空 */
    private final AlertDeliveryResults deliveryResults;
    private final Duration processingTime;

    public static AlertOutcome suppressed(Alert alert, SuppressionReason reason, String detail, Duration took) {
        return new AlertOutcome(AlertDisposition.SUPPRESSED, alert, reason, detail, null, took);
    }

    public static AlertOutcome deferred(Alert alert, String detail, Duration took) {
        return new AlertOutcome(AlertDisposition.DEFERRED, alert, null, detail, null, took);
    }

    public static AlertOutcome dispatched(Alert alert, AlertDeliveryResults results, Duration took) {
        AlertDisposition d;
        if (results.isAnySuccessful()) {
            d = AlertDisposition.DELIVERED;
        } else if (results.hasNoEligibleChannels()) {
            d = AlertDisposition.UNDELIVERABLE;
        } else {
            d = AlertDisposition.FAILED;
        }
        return new AlertOutcome(d, alert, null, null, results, took);
    }

    public boolean isDelivered() {
        return disposition == AlertDisposition.DELIVERED;
    }

    public boolean isSuppressed() {
        return disposition == AlertDisposition.SUPPRESSED;
    }
}
