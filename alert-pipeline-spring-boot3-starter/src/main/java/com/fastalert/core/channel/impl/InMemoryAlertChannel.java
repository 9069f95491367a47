package com.fastalert.core.channel.impl;

import com.fastalert.core.channel.ChannelHealthCheck;
import com.fastalert.core.channel.ChannelSendResult;
import com.fastalert.core.spi.channel.AlertChannel;
import com.fastalert.exception.AlertConfigurationException;
import com.fastalert.model.Alert;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 有界内存渠道, 超出容量丢弃最旧的告警
 */
public class InMemoryAlertChannel implements AlertChannel {

    private final String name;
    private final int capacity;
    private final Deque<Alert> buffer = new ArrayDeque<>();
    private final AtomicLong received = new AtomicLong();
    private volatile boolean enabled = true;

    public InMemoryAlertChannel(String name, int capacity) {
        AlertConfigurationException.check(capacity > 0, "in-memory channel capacity must be > 0");
        this.name = name;
        this.capacity = capacity;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public ChannelSendResult send(Alert alert) {
        synchronized (buffer) {
            if (buffer.size() >= capacity) {
                buffer.pollFirst();
            }
            buffer.addLast(alert);
        }
        received.incrementAndGet();
        return ChannelSendResult.success();
    }

    @Override
    public ChannelHealthCheck healthCheck() {
        return ChannelHealthCheck.healthy("buffered " + size() + "/" + capacity);
    }

    public List<Alert> getAlerts() {
        synchronized (buffer) {
            return new ArrayList<>(buffer);
        }
    }

    public int size() {
        synchronized (buffer) {
            return buffer.size();
        }
    }

    public long getReceived() {
        return received.get();
    }

    public void clear() {
        synchronized (buffer) {
            buffer.clear();
        }
    }
}
