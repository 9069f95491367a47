package com.fastalert.core.channel;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString
public final class ChannelHealthCheck {

    private final boolean healthy;
    private final String message;

    public static ChannelHealthCheck healthy(String message) {
        return new ChannelHealthCheck(true, message);
    }

    public static ChannelHealthCheck unhealthy(String message) {
        return new ChannelHealthCheck(false, message);
    }
}
