package com.fastalert.core.channel;

import com.fastalert.config.AlertGuardProperties;
import com.fastalert.core.spi.channel.AlertChannel;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.internal.CircuitBreakerStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 渠道健康与熔断
 * 每个渠道一个 resilience4j CircuitBreaker: 大小为 F 的计数窗口 + 100% 失败率, 即连续 F 次失败熔断;
 * 半开只放行一次试探, 成功闭合、失败重新打开
 * 熔断按投递终态计一次, 不按尝试次数
 */
public class ChannelHealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(ChannelHealthMonitor.class);

    private final AlertGuardProperties props;

    private final Clock clock;

    private final ConcurrentHashMap<String, ChannelState> states = new ConcurrentHashMap<>();

    public ChannelHealthMonitor(AlertGuardProperties props) {
        this(props, Clock.systemUTC());
    }

    public ChannelHealthMonitor(AlertGuardProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    /**
     * 申请一次投递许可, OPEN 未到冷却期或半开试探已在进行中时返回 false
     * 获得许可后必须以 onSuccess/onFailure/release 之一结束
     */
    public boolean tryAcquire(String channel) {
        return acquire(channel).isPermitted();
    }

    /**
     * 同 tryAcquire, 另外区分半开试探
     * 半开只有一个许可, 拿到许可时仍处于 HALF_OPEN 即为那次试探
     */
    public ChannelPermit acquire(String channel) {
        ChannelState s = state(channel);
        if (s.breaker == null) {
            return ChannelPermit.GRANTED;
        }
        if (!s.breaker.tryAcquirePermission()) {
            s.metrics.recordSkipped();
            log.debug("[Circuit] channel={} not permitted, state={}", channel, s.breaker.getState());
            return ChannelPermit.DENIED;
        }
        return s.breaker.getState() == CircuitBreaker.State.HALF_OPEN ? ChannelPermit.TRIAL : ChannelPermit.GRANTED;
    }

    /**
     * 获得许可但未实际调用渠道时归还
     */
    public void release(String channel) {
        ChannelState s = state(channel);
        if (s.breaker != null) {
            s.breaker.releasePermission();
        }
    }

    public void onSuccess(String channel, Duration elapsed) {
        ChannelState s = state(channel);
        if (s.breaker != null) {
            s.breaker.onSuccess(elapsed.toNanos(), TimeUnit.NANOSECONDS);
        }
        s.consecutiveFailures.set(0);
        s.healthy = true;
        s.lastMessage = "delivered";
    }

    public void onFailure(String channel, Duration elapsed, Throwable error) {
        ChannelState s = state(channel);
        if (s.breaker != null) {
            s.breaker.onError(elapsed.toNanos(), TimeUnit.NANOSECONDS, error);
        }
        int n = s.consecutiveFailures.incrementAndGet();
        s.healthy = false;
        s.lastMessage = error == null ? "failed" : String.valueOf(error.getMessage());
        log.debug("[Circuit] channel={} failure #{}: {}", channel, n, s.lastMessage);
    }

    /**
     * 主动探测渠道
     * CLOSED 时只刷新健康信息; OPEN/HALF_OPEN 时需拿到半开许可, 探测结果作为那一次试探计入熔断
     */
    public ChannelHealthInfo runHealthCheck(AlertChannel channel) {
        String name = channel.name();
        ChannelState s = state(name);
        boolean trial = false;
        if (s.breaker != null && CircuitBreakerState.from(s.breaker.getState()) != CircuitBreakerState.CLOSED) {
            if (!s.breaker.tryAcquirePermission()) {
                return snapshot(name, s);
            }
            trial = true;
        }
        long start = System.nanoTime();
        ChannelHealthCheck check;
        try {
            check = channel.healthCheck();
            if (check == null) {
                check = ChannelHealthCheck.unhealthy("no health check result");
            }
        } catch (Exception e) {
            log.warn("[Circuit] channel={} health check failed", name, e);
            check = ChannelHealthCheck.unhealthy(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        s.lastHealthCheck = clock.instant();
        s.lastMessage = check.getMessage();
        if (trial) {
            if (check.isHealthy()) {
                onSuccess(name, elapsed);
                s.lastMessage = check.getMessage();
            } else {
                onFailure(name, elapsed, new IllegalStateException(check.getMessage()));
            }
        } else {
            s.healthy = check.isHealthy();
        }
        return snapshot(name, s);
    }

    public CircuitBreakerState getState(String channel) {
        ChannelState s = states.get(channel);
        return s == null || s.breaker == null ? CircuitBreakerState.CLOSED : CircuitBreakerState.from(s.breaker.getState());
    }

    public ChannelHealthInfo getHealth(String channel) {
        return snapshot(channel, state(channel));
    }

    public List<ChannelHealthInfo> getAllHealth() {
        List<ChannelHealthInfo> out = new ArrayList<>(states.size());
        states.forEach((name, s) -> out.add(snapshot(name, s)));
        return out;
    }

    public ChannelMetrics metrics(String channel) {
        return state(channel).metrics;
    }

    /**
     * 手动复位到 CLOSED
     */
    public void reset(String channel) {
        ChannelState s = state(channel);
        if (s.breaker != null) {
            s.breaker.reset();
        }
        s.consecutiveFailures.set(0);
        s.healthy = true;
        log.info("[Circuit] channel={} reset", channel);
    }

    public void resetMetrics() {
        states.values().forEach(s -> s.metrics.reset());
    }

    public void remove(String channel) {
        states.remove(channel);
    }

    private ChannelHealthInfo snapshot(String name, ChannelState s) {
        CircuitBreakerState cs = s.breaker == null ? CircuitBreakerState.CLOSED : CircuitBreakerState.from(s.breaker.getState());
        return new ChannelHealthInfo(name, s.healthy && cs == CircuitBreakerState.CLOSED, s.consecutiveFailures.get(), cs,
                s.lastHealthCheck, s.lastMessage, s.metrics.snapshot());
    }

    private ChannelState state(String channel) {
        return states.computeIfAbsent(channel, this::newState);
    }

    private ChannelState newState(String channel) {
        AlertGuardProperties.CbConfig c = props.circuitBreakerFor(channel);
        CircuitBreaker cb = c.isEnabled() ? buildCb(channel, c) : null;
        return new ChannelState(channel, cb);
    }

    private CircuitBreaker buildCb(String channel, AlertGuardProperties.CbConfig c) {
        int threshold = Math.max(1, c.getFailureThreshold());
        CircuitBreakerConfig cfg = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100f)
                // 慢调用不参与熔断, 超时已作为失败计入
                .slowCallRateThreshold(100f)
                .slowCallDurationThreshold(Duration.ofDays(1))
                .waitDurationInOpenState(c.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .recordExceptions(Throwable.class)
                .build();
        // 冷却期按注入的时钟计算
        CircuitBreaker cb = new CircuitBreakerStateMachine("cb:" + channel, cfg, clock);
        cb.getEventPublisher().onStateTransition(ev ->
                log.warn("[Circuit] channel={} {} -> {}", channel,
                        ev.getStateTransition().getFromState(), ev.getStateTransition().getToState()));
        return cb;
    }

    private static final class ChannelState {
        private final CircuitBreaker breaker;
        private final ChannelMetrics metrics;
        private final AtomicInteger consecutiveFailures = new AtomicInteger();
        private volatile boolean healthy = true;
        private volatile Instant lastHealthCheck;
        private volatile String lastMessage;

        ChannelState(String channel, CircuitBreaker breaker) {
            this.breaker = breaker;
            this.metrics = new ChannelMetrics(channel);
        }
    }
}
