package com.fastalert.core.spi.channel;

import com.fastalert.core.channel.ChannelHealthCheck;
import com.fastalert.core.channel.ChannelSendResult;
import com.fastalert.model.Alert;

/**
 * 告警输出渠道（控制台、文件、邮件、Webhook ...）
 */
public interface AlertChannel {

    /**
     * 渠道唯一名称, 用于路由、熔断与指标维度
     */
    String name();

    default boolean isEnabled() {
        return true;
    }

    /**
     * 未显式指定目标且告警无路由时, 以此判断是否订阅该告警
     */
    default boolean supports(Alert alert) {
        return true;
    }

    /**
     * 同步发送, 框架层负责异步、超时与重试
     * 返回失败结果或抛出异常均视为本次尝试失败, 抛出 ChannelPermanentFailureException 表示不必重试
     */
    ChannelSendResult send(Alert alert) throws Exception;

    default ChannelHealthCheck healthCheck() {
        return ChannelHealthCheck.healthy("no health check");
    }
}
