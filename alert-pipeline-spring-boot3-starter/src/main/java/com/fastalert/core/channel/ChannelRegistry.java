package com.fastalert.core.channel;

import com.fastalert.core.spi.channel.AlertChannel;
import com.fastalert.exception.AlertConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 渠道注册表, 由管道持有并注入投递器
 */
public class ChannelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ChannelRegistry.class);

    private final ConcurrentHashMap<String, AlertChannel> channels = new ConcurrentHashMap<>();

    public ChannelRegistry() {
    }

    public ChannelRegistry(Collection<? extends AlertChannel> initial) {
        if (initial != null) {
            initial.forEach(this::register);
        }
    }

    public void register(AlertChannel channel) {
        AlertConfigurationException.check(channel != null, "channel must not be null");
        String name = channel.name();
        AlertConfigurationException.check(name != null && !name.isBlank(), "channel name must not be blank");
        AlertChannel prev = channels.putIfAbsent(name, channel);
        AlertConfigurationException.check(prev == null, "channel already registered: " + name);
        log.info("[Alert-Pipeline] channel registered: {} ({})", name, channel.getClass().getSimpleName());
    }

    public boolean unregister(String name) {
        boolean removed = channels.remove(name) != null;
        if (removed) {
            log.info("[Alert-Pipeline] channel unregistered: {}", name);
        }
        return removed;
    }

    public Optional<AlertChannel> get(String name) {
        return Optional.ofNullable(channels.get(name));
    }

    public List<AlertChannel> all() {
        return new ArrayList<>(channels.values());
    }

    public boolean contains(String name) {
        return channels.containsKey(name);
    }

    public int size() {
        return channels.size();
    }
}
