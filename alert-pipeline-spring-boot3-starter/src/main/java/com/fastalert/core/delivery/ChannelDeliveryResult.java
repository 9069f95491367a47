package com.fastalert.core.delivery;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 单个渠道的投递终态
 */
@Getter
@AllArgsConstructor
@ToString
public final class ChannelDeliveryResult {

    private final String channel;
    private final boolean success;
    /** 首次尝试开始到终态的耗时, 含退避等待 */
    private final Duration duration;
    /** 最后一次失败原因, 成功为 null */
    private final String error;
    /** 重试次数, 不含首次 */
    private final int retryCount;

    public static ChannelDeliveryResult success(String channel, Duration duration, int retryCount) {
        return new ChannelDeliveryResult(channel, true, duration, null, retryCount);
    }

    public static ChannelDeliveryResult failure(String channel, Duration duration, String error, int retryCount) {
        return new ChannelDeliveryResult(channel, false, duration, error, retryCount);
    }
}
