package com.fastalert.core.filter.builtin;

import com.fastalert.core.spi.filter.AlertFilter;
import com.fastalert.exception.AlertConfigurationException;
import com.fastalert.model.enums.ErrorHandlingMode;

/**
 * 内置过滤器公共属性
 */
public abstract class AbstractAlertFilter implements AlertFilter {

    private final String name;
    private final int priority;
    private ErrorHandlingMode errorHandlingMode = ErrorHandlingMode.LOG_AND_CONTINUE;
    private int maxConsecutiveErrors = 5;

    protected AbstractAlertFilter(String name, int priority) {
        AlertConfigurationException.check(name != null && !name.isBlank(), "filter name must not be blank");
        this.name = name;
        this.priority = priority;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public ErrorHandlingMode errorHandlingMode() {
        return errorHandlingMode;
    }

    @Override
    public int maxConsecutiveErrors() {
        return maxConsecutiveErrors;
    }

    public AbstractAlertFilter onError(ErrorHandlingMode mode, int maxConsecutiveErrors) {
        AlertConfigurationException.check(mode != null, "errorHandlingMode must not be null");
        AlertConfigurationException.check(maxConsecutiveErrors >= 1, "maxConsecutiveErrors must be >= 1");
        this.errorHandlingMode = mode;
        this.maxConsecutiveErrors = maxConsecutiveErrors;
        return this;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + name + ", priority=" + priority + "}";
    }
}
