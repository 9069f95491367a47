package com.fastalert.core.filter.builtin;

import com.fastalert.core.filter.FilterResult;
import com.fastalert.core.filter.FilterType;
import com.fastalert.exception.AlertConfigurationException;
import com.fastalert.model.Alert;
import com.fastalert.model.ctx.FilterContext;
import com.fastalert.model.enums.AlertSeverity;

/**
 * 低于最小级别的告警直接抑制
 */
public class SeverityAlertFilter extends AbstractAlertFilter {

    private final AlertSeverity minimum;

    public SeverityAlertFilter(String name, AlertSeverity minimum, int priority) {
        super(name, priority);
        AlertConfigurationException.check(minimum != null, "minimum severity must not be null");
        this.minimum = minimum;
    }

    @Override
    public FilterType type() {
        return FilterType.SEVERITY;
    }

    @Override
    public FilterResult evaluate(Alert alert, FilterContext ctx) {
        if (alert.getSeverity().isAtLeast(minimum)) {
            return FilterResult.allow();
        }
        return FilterResult.suppress("severity " + alert.getSeverity() + " below " + minimum);
    }

    public AlertSeverity getMinimum() {
        return minimum;
    }
}
