package com.fastalert.core.channel.impl;

import com.fastalert.core.channel.ChannelHealthCheck;
import com.fastalert.core.channel.ChannelSendResult;
import com.fastalert.core.spi.channel.AlertChannel;
import com.fastalert.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志渠道, 默认启用, 也是应急模式下的兜底渠道
 */
public class LoggingAlertChannel implements AlertChannel {

    public static final String NAME = "log";

    private static final Logger log = LoggerFactory.getLogger(LoggingAlertChannel.class);

    private final String name;

    public LoggingAlertChannel() {
        this(NAME);
    }

    public LoggingAlertChannel(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ChannelSendResult send(Alert alert) {
        switch (alert.getSeverity()) {
            case CRITICAL -> log.error("[Alert-{}] source={}, tag={}, id={}, count={}, msg={}, meta={}",
                    alert.getSeverity(), alert.getSource(), alert.getTag(), alert.getId(), alert.getCount(),
                    truncate(alert.getMessage()), alert.getMetadata());
            case WARNING, HIGH -> log.warn("[Alert-{}] source={}, tag={}, id={}, count={}, msg={}",
                    alert.getSeverity(), alert.getSource(), alert.getTag(), alert.getId(), alert.getCount(),
                    truncate(alert.getMessage()));
            default -> log.info("[Alert-{}] source={}, tag={}, msg={}",
                    alert.getSeverity(), alert.getSource(), alert.getTag(), truncate(alert.getMessage()));
        }
        return ChannelSendResult.success();
    }

    @Override
    public ChannelHealthCheck healthCheck() {
        return ChannelHealthCheck.healthy("logger " + log.getName());
    }

    private String truncate(String s) {
        return s == null ? null : (s.length() > 2000 ? s.substring(0, 2000) : s);
    }
}
