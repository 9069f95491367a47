package com.fastalert.model.event;

import com.fastalert.model.Alert;
import com.fastalert.model.enums.AlertEventType;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 生命周期事件, alert 为事件发生时的快照
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class AlertEvent {

    private final AlertEventType type;
    private final Alert alert;
    /** 确认/解决人, 其余事件为空 */
    private final String actor;
    /** 抑制原因等补充说明 */
    private final String detail;
    private final Instant occurredAt;

    public static AlertEvent raised(Alert alert, Instant at) {
        return new AlertEvent(AlertEventType.RAISED, alert, null, null, at);
    }

    public static AlertEvent acknowledged(Alert alert, String by, Instant at) {
        return new AlertEvent(AlertEventType.ACKNOWLEDGED, alert, by, null, at);
    }

    public static AlertEvent resolved(Alert alert, String by, Instant at) {
        return new AlertEvent(AlertEventType.RESOLVED, alert, by, null, at);
    }

    public static AlertEvent suppressed(Alert alert, String detail, Instant at) {
        return new AlertEvent(AlertEventType.SUPPRESSED, alert, null, detail, at);
    }
}
