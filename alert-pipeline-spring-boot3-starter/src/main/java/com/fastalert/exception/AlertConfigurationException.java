package com.fastalert.exception;

/**
 * 非法的规则/过滤器/渠道配置, 在注册时抛出而不是在评估时
 */
public class AlertConfigurationException extends RuntimeException {

    public AlertConfigurationException(String message) {
        super(message);
    }

    public static void check(boolean condition, String message) {
        if (!condition) {
            throw new AlertConfigurationException(message);
        }
    }
}
