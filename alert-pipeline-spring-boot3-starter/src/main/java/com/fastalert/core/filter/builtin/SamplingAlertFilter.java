package com.fastalert.core.filter.builtin;

import com.fastalert.core.filter.FilterResult;
import com.fastalert.core.filter.FilterType;
import com.fastalert.exception.AlertConfigurationException;
import com.fastalert.model.Alert;
import com.fastalert.model.ctx.FilterContext;
import com.fastalert.model.enums.AlertSeverity;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 按比例采样, rate 取值 [0,1]
 * 不低于 exemptFrom 的告警不参与采样
 */
public class SamplingAlertFilter extends AbstractAlertFilter {

    private final double rate;
    private final AlertSeverity exemptFrom;
    private final DoubleSupplier random;

    public SamplingAlertFilter(String name, double rate, int priority) {
        this(name, rate, AlertSeverity.CRITICAL, priority, () -> ThreadLocalRandom.current().nextDouble());
    }

    public SamplingAlertFilter(String name, double rate, AlertSeverity exemptFrom, int priority, DoubleSupplier random) {
        super(name, priority);
        AlertConfigurationException.check(rate >= 0d && rate <= 1d, "sample rate must be within [0,1]: " + rate);
        AlertConfigurationException.check(random != null, "random must not be null");
        this.rate = rate;
        this.exemptFrom = exemptFrom;
        this.random = random;
    }

    @Override
    public FilterType type() {
        return FilterType.SAMPLING;
    }

    @Override
    public boolean canHandle(Alert alert) {
        return exemptFrom == null || !alert.getSeverity().isAtLeast(exemptFrom);
    }

    @Override
    public FilterResult evaluate(Alert alert, FilterContext ctx) {
        if (rate >= 1d) {
            return FilterResult.allow();
        }
        if (rate > 0d && random.getAsDouble() < rate) {
            return FilterResult.allow("sampled");
        }
        return FilterResult.suppress("dropped by sampling rate " + rate);
    }

    public double getRate() {
        return rate;
    }
}
