package com.fastalert.core.delivery;

import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * 一条告警的扇出投递结果
 * 成功数/失败数/总耗时均由渠道结果推导, 不单独存储
 */
@Getter
@ToString
public final class AlertDeliveryResults {

    private final UUID alertId;
    private final List<ChannelDeliveryResult> channelResults;
    /** 因熔断拒绝而未调用的渠道 */
    private final List<String> skippedChannels;
    /** 扇出整体的墙钟耗时 */
    private final Duration elapsed;

    public AlertDeliveryResults(UUID alertId, List<ChannelDeliveryResult> channelResults,
                                List<String> skippedChannels, Duration elapsed) {
        this.alertId = alertId;
        this.channelResults = List.copyOf(channelResults);
        this.skippedChannels = List.copyOf(skippedChannels);
        this.elapsed = elapsed;
    }

    public static AlertDeliveryResults empty(UUID alertId) {
        return new AlertDeliveryResults(alertId, List.of(), List.of(), Duration.ZERO);
    }

    public int getTotalChannels() {
        return channelResults.size();
    }

    public int getSuccessfulDeliveries() {
        return (int) channelResults.stream().filter(ChannelDeliveryResult::isSuccess).count();
    }

    public int getFailedDeliveries() {
        return (int) channelResults.stream().filter(r -> !r.isSuccess()).count();
    }

    /**
     * 各渠道耗时之和
     */
    public Duration getTotalTime() {
        return channelResults.stream().map(ChannelDeliveryResult::getDuration).reduce(Duration.ZERO, Duration::plus);
    }

    public int getTotalRetries() {
        return channelResults.stream().mapToInt(ChannelDeliveryResult::getRetryCount).sum();
    }

    /** 零渠道时既不是全部成功也不是全部失败 */
    public boolean isAllSuccessful() {
        return !channelResults.isEmpty() && getFailedDeliveries() == 0;
    }

    public boolean isAllFailed() {
        return !channelResults.isEmpty() && getSuccessfulDeliveries() == 0;
    }

    public boolean isAnySuccessful() {
        return getSuccessfulDeliveries() > 0;
    }

    /**
     * 没有任何符合条件的渠道(含被熔断跳过的也没有)
     */
    public boolean hasNoEligibleChannels() {
        return channelResults.isEmpty() && skippedChannels.isEmpty();
    }
}
