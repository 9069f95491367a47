package com.fastalert.exception.guard;

/**
 * 渠道限流未获许可
 */
public class ChannelRateLimitedException extends RuntimeException {

    public ChannelRateLimitedException(String channel, Throwable cause) {
        super("channel rate limited: " + channel, cause);
    }
}
