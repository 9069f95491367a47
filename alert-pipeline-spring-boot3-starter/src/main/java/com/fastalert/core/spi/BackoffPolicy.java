package com.fastalert.core.spi;

import com.fastalert.config.AlertPipelineProperties;

/**
 * 回退策略（计算下一次重试前的等待）
 */
public interface BackoffPolicy {

    /** 策略唯一名称（如 "fixed"、"exponential"、"myPolicy"） */
    String name();

    /**
     * 计算等待毫秒数
     * @param attempt  第几次重试, 从 1 开始
     * @param channel  渠道名称（如需按渠道区分）
     * @param props    全局配置（读取 base/min/max/jitterRatio 等）
     * @return 等待毫秒数, 不小于 0
     */
    long delayMillis(int attempt, String channel, AlertPipelineProperties props);
}
