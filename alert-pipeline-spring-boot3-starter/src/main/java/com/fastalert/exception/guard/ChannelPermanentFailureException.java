package com.fastalert.exception.guard;

/**
 * 渠道明确告知不可重试的失败（如配置错误、目标被拒绝）
 */
public class ChannelPermanentFailureException extends RuntimeException {

    public ChannelPermanentFailureException(String message) {
        super(message);
    }

    public ChannelPermanentFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
