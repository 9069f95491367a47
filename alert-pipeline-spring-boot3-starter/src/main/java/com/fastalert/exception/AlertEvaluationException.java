package com.fastalert.exception;

/**
 * 过滤器或规则评估时抛出的异常
 */
public class AlertEvaluationException extends RuntimeException {

    private final String component;

    public AlertEvaluationException(String component, Throwable cause) {
        super("evaluation failed in " + component + ": " + cause.getMessage(), cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
