package com.fastalert.core.spi.event;

import com.fastalert.model.event.AlertEvent;

/**
 * 告警生命周期事件监听(审计、消息总线桥接等)
 */
public interface AlertEventListener {

    /**
     * 用于日志与指标维度
     */
    String name();

    /**
     * 粗粒度过滤
     */
    default boolean supports(AlertEvent event) {
        return true;
    }

    /**
     * 同步回调, 框架层负责异步派发; 抛出的异常只记录, 不影响告警处理
     */
    void onEvent(AlertEvent event) throws Exception;
}
