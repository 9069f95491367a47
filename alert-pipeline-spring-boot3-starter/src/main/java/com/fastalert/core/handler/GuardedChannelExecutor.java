package com.fastalert.core.handler;

import com.fastalert.config.AlertGuardProperties;
import com.fastalert.core.channel.ChannelSendResult;
import com.fastalert.core.spi.channel.AlertChannel;
import com.fastalert.exception.guard.ChannelBulkheadFullException;
import com.fastalert.exception.guard.ChannelRateLimitedException;
import com.fastalert.model.Alert;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;

import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 渠道发送统一入口
 * 对 channel.send(alert) 增加 RL/BH 装饰后执行; 熔断由 ChannelHealthMonitor 按投递终态管理
 */
public class GuardedChannelExecutor {

    private final AlertGuardProperties props;

    /** 全渠道共享, 限制系统级在途投递数 */
    private final Bulkhead bulkhead;

    private final ConcurrentHashMap<String, RateLimiter> rlCache = new ConcurrentHashMap<>();

    private final AtomicInteger inFlight = new AtomicInteger();

    public GuardedChannelExecutor(AlertGuardProperties props) {
        this.props = props;
        this.bulkhead = props.getBulkhead().isEnabled() ? buildBh(props.getBulkhead()) : null;
    }

    public ChannelSendResult execute(AlertChannel channel, Alert alert) throws Exception {
        String name = channel.name();
        // 组合装饰 RateLimiter → Bulkhead
        Callable<ChannelSendResult> decorated = () -> {
            inFlight.incrementAndGet();
            try {
                return channel.send(alert);
            } finally {
                inFlight.decrementAndGet();
            }
        };

        // RateLimit最外层限流, 抑制单渠道突发
        AlertGuardProperties.RlConfig rlCfg = props.rateLimiterFor(name);
        if (rlCfg.isEnabled()) {
            RateLimiter rl = rlCache.computeIfAbsent(name, k -> buildRl(name, rlCfg));
            decorated = RateLimiter.decorateCallable(rl, decorated);
        }

        // Bulkhead 限制全局并发
        if (bulkhead != null) {
            decorated = Bulkhead.decorateCallable(bulkhead, decorated);
        }

        try {
            return decorated.call();
        } catch (BulkheadFullException full) {
            // 并发满 → 可重试但应延后
            throw new ChannelBulkheadFullException(full);
        } catch (RequestNotPermitted rnp) {
            // 限流未获许可 → 可重试但延后
            throw new ChannelRateLimitedException(name, rnp);
        }
    }

    public int getInFlight() {
        return inFlight.get();
    }

    /**
     * 并发上限, 未启用 bulkhead 时返回 0
     */
    public int getCapacity() {
        return bulkhead == null ? 0 : bulkhead.getBulkheadConfig().getMaxConcurrentCalls();
    }

    private RateLimiter buildRl(String channel, AlertGuardProperties.RlConfig r) {
        RateLimiterConfig cfg = RateLimiterConfig.custom()
                .limitForPeriod(r.getLimitForPeriod())
                .limitRefreshPeriod(r.getLimitRefreshPeriod())
                .timeoutDuration(r.getTimeoutDuration())
                .build();
        return RateLimiter.of("rl:" + channel, cfg);
    }

    private static Bulkhead buildBh(AlertGuardProperties.BhConfig b) {
        BulkheadConfig cfg = BulkheadConfig.custom()
                .maxConcurrentCalls(b.getMaxConcurrentCalls())
                .maxWaitDuration(b.getMaxWaitDuration())
                .fairCallHandlingStrategyEnabled(true)
                .build();
        return Bulkhead.of("bh:delivery", cfg);
    }
}
