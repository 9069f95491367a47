package com.fastalert.core.channel;

import lombok.Getter;
import lombok.ToString;

/**
 * 渠道一次发送的返回
 */
@Getter
@ToString
public final class ChannelSendResult {

    private static final ChannelSendResult OK = new ChannelSendResult(true, null);

    private final boolean success;
    private final String error;

    private ChannelSendResult(boolean success, String error) {
        this.success = success;
        this.error = error;
    }

    public static ChannelSendResult success() {
        return OK;
    }

    public static ChannelSendResult failure(String error) {
        return new ChannelSendResult(false, error == null ? "unknown error" : error);
    }
}
