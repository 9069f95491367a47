package com.fastalert.core.backoff;

import com.fastalert.config.AlertPipelineProperties;
import com.fastalert.core.spi.BackoffPolicy;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 策略注册中心：
 * - 内置 fixed / exponential
 * - 解析 "spi:{name}" 映射到外部注册的 BackoffPolicy（name() 返回的名字）
 * - 渠道可通过 alert.channels.{name}.backoff 指定策略
 * - 线程安全
 */
public class BackoffRegistry implements InitializingBean {

    private static final String PREFIX_SPI = "spi:";

    private final Map<String, BackoffPolicy> policies = new ConcurrentHashMap<>(16);

    private final AlertPipelineProperties props;

    public BackoffRegistry(AlertPipelineProperties props) {
        this(props, null);
    }

    public BackoffRegistry(AlertPipelineProperties props, @Nullable List<BackoffPolicy> discovered) {
        this.props = Objects.requireNonNull(props, "props");
        if (discovered != null) {
            discovered.forEach(p -> register(p.name(), p));
        }
        // 内置策略
        policies.putIfAbsent("fixed", new FixedBackoffPolicy());
        policies.putIfAbsent("exponential", new ExponentialJitterBackoffPolicy());
    }

    /**
     * 注册或覆盖策略
     */
    public BackoffRegistry register(String name, BackoffPolicy policy) {
        policies.put(normalize(name), Objects.requireNonNull(policy, "policy"));
        return this;
    }

    /**
     * 按名称解析策略, 支持 spi:{name} 前缀, 未知名称回落到 exponential
     */
    public BackoffPolicy resolve(String strategy) {
        if (strategy == null || strategy.isBlank()) {
            return policies.get("exponential");
        }
        String s = strategy.trim();
        if (s.regionMatches(true, 0, PREFIX_SPI, 0, PREFIX_SPI.length())) {
            s = s.substring(PREFIX_SPI.length());
        }
        return policies.getOrDefault(normalize(s), policies.get("exponential"));
    }

    /**
     * 计算某渠道第 attempt 次重试前的等待, factor 来自失败决策（拥塞类失败拉大间隔）
     */
    public long delayMillis(String channel, int attempt, double factor) {
        AlertPipelineProperties.Channel c = props.getChannels().get(channel);
        String strategy = c != null && c.getBackoff() != null ? c.getBackoff() : props.getBackoff().getStrategy();
        long delay = resolve(strategy).delayMillis(attempt, channel, props);
        return factor > 0 ? Math.round(delay * factor) : delay;
    }

    /** 列出已注册策略 */
    public Set<String> names() {
        return Collections.unmodifiableSet(policies.keySet());
    }

    private static String normalize(String n) {
        return n.toLowerCase(Locale.ROOT).trim();
    }

    @Override
    public void afterPropertiesSet() {
        // 参数校验
        long min = props.backoffMinMillis(), max = props.backoffMaxMillis();
        if (max < min) {
            throw new IllegalArgumentException("alert.backoff.max must be >= alert.backoff.min");
        }
    }
}
