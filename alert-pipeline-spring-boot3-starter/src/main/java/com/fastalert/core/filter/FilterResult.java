package com.fastalert.core.filter;

import com.fastalert.model.Alert;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * 单个过滤器的评估结果
 */
@Getter
@ToString
public final class FilterResult {

    private static final FilterResult ALLOW = new FilterResult(FilterDecision.ALLOW, null, "passed");

    private final FilterDecision decision;
    /** 仅 MODIFY 时非空 */
    private final Alert modifiedAlert;
    private final String reason;

    private FilterResult(FilterDecision decision, Alert modifiedAlert, String reason) {
        this.decision = decision;
        this.modifiedAlert = modifiedAlert;
        this.reason = reason;
    }

    public static FilterResult allow() {
        return ALLOW;
    }

    public static FilterResult allow(String reason) {
        return new FilterResult(FilterDecision.ALLOW, null, reason);
    }

    public static FilterResult suppress(String reason) {
        return new FilterResult(FilterDecision.SUPPRESS, null, reason);
    }

    public static FilterResult modify(Alert modified, String reason) {
        return new FilterResult(FilterDecision.MODIFY, Objects.requireNonNull(modified, "modified"), reason);
    }

    public static FilterResult defer(String reason) {
        return new FilterResult(FilterDecision.DEFER, null, reason);
    }
}
