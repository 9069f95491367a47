package com.fastalert.core.delivery;

import com.fastalert.config.AlertPipelineProperties;
import com.fastalert.core.backoff.BackoffRegistry;
import com.fastalert.core.channel.ChannelHealthMonitor;
import com.fastalert.core.channel.ChannelPermit;
import com.fastalert.core.channel.ChannelRegistry;
import com.fastalert.core.channel.ChannelSendResult;
import com.fastalert.core.handler.GuardedChannelExecutor;
import com.fastalert.core.metric.AlertMetrics;
import com.fastalert.core.spi.channel.AlertChannel;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.exception.guard.ChannelBulkheadFullException;
import com.fastalert.exception.guard.ChannelSendFailedException;
import com.fastalert.model.Alert;
import com.fastalert.model.ctx.DeliveryContext;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 扇出投递
 * 每个符合条件的渠道独立执行: 熔断许可 → 投递线程池(RL/BH 装饰) → 时间轮超时 → 失败判定 → 时间轮退避重试
 * 熔断按渠道投递终态计一次, 半开试探不重试; 不同渠道并行, 同一渠道的重试按尝试顺序串行
 */
public class DeliveryOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DeliveryOrchestrator.class);

    private final ChannelRegistry registry;
    private final ChannelHealthMonitor monitor;
    private final GuardedChannelExecutor guard;
    private final BackoffRegistry backoff;
    private final FailureDecider decider;
    private final AlertPipelineProperties props;
    private final ExecutorService executor;
    private final HashedWheelTimer timer;
    private final AlertMetrics metrics;
    private final Clock clock;

    /** 已排入时间轮、尚未开始的重试 */
    private final Set<ChannelDelivery> pendingRetries = ConcurrentHashMap.newKeySet();

    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public DeliveryOrchestrator(ChannelRegistry registry,
                                ChannelHealthMonitor monitor,
                                GuardedChannelExecutor guard,
                                BackoffRegistry backoff,
                                FailureDecider decider,
                                AlertPipelineProperties props,
                                ExecutorService executor,
                                HashedWheelTimer timer,
                                AlertMetrics metrics,
                                Clock clock) {
        this.registry = registry;
        this.monitor = monitor;
        this.guard = guard;
        this.backoff = backoff;
        this.decider = decider;
        this.props = props;
        this.executor = executor;
        this.timer = timer;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * 同步投递, 渠道失败只体现在结果里, 不抛异常
     */
    public AlertDeliveryResults deliver(Alert alert, Collection<String> targets) {
        try {
            return deliverAsync(alert, targets).join();
        } catch (CompletionException e) {
            log.error("[Delivery] alert={} orchestration error", alert.getId(), e.getCause());
            return AlertDeliveryResults.empty(alert.getId());
        }
    }

    /**
     * @param targets 显式目标渠道, 为空时使用告警路由, 再为空时使用 supports() 订阅的渠道
     */
    public CompletableFuture<AlertDeliveryResults> deliverAsync(Alert alert, Collection<String> targets) {
        long start = System.nanoTime();
        List<AlertChannel> eligible = eligibleChannels(alert, targets);
        List<String> skipped = new ArrayList<>();
        List<CompletableFuture<ChannelDeliveryResult>> futures = new ArrayList<>(eligible.size());

        for (AlertChannel ch : eligible) {
            String name = ch.name();
            // OPEN 或半开试探已被占用 → 直接跳过, 不调用渠道
            ChannelPermit permit = monitor.acquire(name);
            if (!permit.isPermitted()) {
                skipped.add(name);
                metrics.incChannelSkipped(name);
                continue;
            }
            ChannelDelivery d = new ChannelDelivery(alert, ch, permit == ChannelPermit.TRIAL);
            futures.add(d.result);
            d.attempt();
        }

        if (eligible.isEmpty()) {
            log.warn("[Delivery] alert={} source={} has no eligible channel", alert.getId(), alert.getSource());
        }

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> {
                    List<ChannelDeliveryResult> results = new ArrayList<>(futures.size());
                    futures.forEach(f -> results.add(f.join()));
                    long nanos = System.nanoTime() - start;
                    metrics.recordDeliveryNanos(nanos);
                    return new AlertDeliveryResults(alert.getId(), results, skipped, Duration.ofNanos(nanos));
                });
    }

    /**
     * 启用的渠道中: 显式目标 > 告警路由 > supports()
     */
    List<AlertChannel> eligibleChannels(Alert alert, Collection<String> targets) {
        List<AlertChannel> out = new ArrayList<>();
        Collection<String> wanted = targets != null && !targets.isEmpty() ? targets
                : (alert.getRoutes().isEmpty() ? null : alert.getRoutes());
        if (wanted != null) {
            for (String name : wanted) {
                AlertChannel ch = registry.get(name).orElse(null);
                if (ch == null) {
                    log.debug("[Delivery] alert={} target channel {} not registered", alert.getId(), name);
                    continue;
                }
                if (isEnabled(ch) && !out.contains(ch)) {
                    out.add(ch);
                }
            }
            return out;
        }
        for (AlertChannel ch : registry.all()) {
            if (isEnabled(ch) && supports(ch, alert)) {
                out.add(ch);
            }
        }
        return out;
    }

    private boolean isEnabled(AlertChannel ch) {
        AlertPipelineProperties.Channel c = props.getChannels().get(ch.name());
        return (c == null || c.isEnabled()) && ch.isEnabled();
    }

    private static boolean supports(AlertChannel ch, Alert alert) {
        try {
            return ch.supports(alert);
        } catch (RuntimeException e) {
            log.warn("[Delivery] channel={} supports() failed, excluded", ch.name(), e);
            return false;
        }
    }

    /**
     * 停止新的重试, 已排队未开始的重试直接以失败结束
     */
    public int shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return 0;
        }
        int failed = 0;
        for (ChannelDelivery d : new ArrayList<>(pendingRetries)) {
            if (d.cancelPendingRetry()) {
                failed++;
            }
        }
        log.info("[Delivery] shutdown, {} pending retries failed", failed);
        return failed;
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    public int getPendingRetries() {
        return pendingRetries.size();
    }

    public int getInFlight() {
        return guard.getInFlight();
    }

    /**
     * 资源占用: 在途投递 / 并发上限
     */
    public double getResourceUsage() {
        int cap = guard.getCapacity();
        if (cap <= 0) {
            cap = Math.max(1, props.getDelivery().getExecutor().getMaxPoolSize());
        }
        return Math.min(1d, (double) guard.getInFlight() / cap);
    }

    private long timeoutMillis(String channel) {
        AlertPipelineProperties.Channel c = props.getChannels().get(channel);
        Duration t = c != null && c.getTimeout() != null ? c.getTimeout() : props.getDelivery().getDefaultTimeout();
        return Math.max(1, t.toMillis());
    }

    private int maxRetries(String channel) {
        AlertPipelineProperties.Channel c = props.getChannels().get(channel);
        return c != null && c.getMaxRetries() != null ? c.getMaxRetries() : props.getDelivery().getDefaultMaxRetries();
    }

    /**
     * 单个渠道的一次投递(含重试)
     */
    private final class ChannelDelivery {
        private final Alert alert;
        private final AlertChannel channel;
        private final String name;
        private final int maxRetries;
        private final long timeoutMs;
        private final long startNanos = System.nanoTime();
        private final CompletableFuture<ChannelDeliveryResult> result = new CompletableFuture<>();
        private final AtomicBoolean finished = new AtomicBoolean(false);
        private volatile int attempt;
        private volatile Timeout retryTimeout;

        ChannelDelivery(Alert alert, AlertChannel channel, boolean trial) {
            this.alert = alert;
            this.channel = channel;
            this.name = channel.name();
            // 半开试探只发一次, 结果直接决定闭合或重新打开
            this.maxRetries = trial ? 0 : Math.max(0, maxRetries(name));
            this.timeoutMs = timeoutMillis(name);
        }

        void attempt() {
            if (attempt > 0 && shuttingDown.get()) {
                finish(false, new IllegalStateException("delivery shutting down"));
                return;
            }
            attempt++;
            AtomicBoolean done = new AtomicBoolean(false);
            Future<?> running;
            try {
                running = executor.submit(() -> run(done));
            } catch (RejectedExecutionException rex) {
                // 投递线程池已满/已关闭, 与并发满同等对待
                onAttemptFailure(new ChannelBulkheadFullException(rex), false);
                return;
            }
            try {
                timer.newTimeout(t -> {
                    if (done.compareAndSet(false, true)) {
                        running.cancel(true);
                        onAttemptFailure(new TimeoutException("channel " + name + " timed out after " + timeoutMs + "ms"), true);
                    }
                }, timeoutMs, TimeUnit.MILLISECONDS);
            } catch (IllegalStateException | RejectedExecutionException stopped) {
                // 时间轮已停止, 不再有超时保护
                log.debug("[Delivery] channel={} timeout not scheduled: {}", name, stopped.getMessage());
            }
        }

        private void run(AtomicBoolean done) {
            try {
                ChannelSendResult r = guard.execute(channel, alert);
                if (r == null || !r.isSuccess()) {
                    throw new ChannelSendFailedException(name, r == null ? "null result" : r.getError());
                }
                if (done.compareAndSet(false, true)) {
                    monitor.metrics(name).recordAttempt(false);
                    finish(true, null);
                }
            } catch (Throwable ex) {
                if (done.compareAndSet(false, true)) {
                    onAttemptFailure(ex, false);
                } else {
                    log.debug("[Delivery] channel={} late failure after timeout ignored: {}", name, ex.toString());
                }
            }
        }

        private void onAttemptFailure(Throwable ex, boolean timedOut) {
            monitor.metrics(name).recordAttempt(timedOut);
            DeliveryContext ctx = DeliveryContext.builder()
                    .alertId(alert.getId())
                    .channel(name)
                    .attempt(attempt)
                    .maxRetries(maxRetries)
                    .err(ex.getMessage())
                    .build();
            FailureDecider.Decision decision = decider.decide(ex, ctx);
            int retriesDone = attempt - 1;
            if (!decision.isRetry() || retriesDone >= maxRetries || shuttingDown.get()) {
                log.warn("[Delivery] channel={} alert={} gave up after {} attempt(s), decision={}, err={}",
                        name, alert.getId(), attempt, decision, ex.toString());
                finish(false, ex);
                return;
            }
            long delay = backoff.delayMillis(name, retriesDone + 1, decision.getBackoffFactor());
            log.info("[Delivery] channel={} alert={} attempt {} failed ({}), retry in {} ms",
                    name, alert.getId(), attempt, decision, delay);
            pendingRetries.add(this);
            try {
                retryTimeout = timer.newTimeout(t -> {
                    if (pendingRetries.remove(this)) {
                        attempt();
                    }
                }, delay, TimeUnit.MILLISECONDS);
            } catch (IllegalStateException | RejectedExecutionException stopped) {
                pendingRetries.remove(this);
                finish(false, ex);
            }
        }

        boolean cancelPendingRetry() {
            if (!pendingRetries.remove(this)) {
                return false;
            }
            Timeout t = retryTimeout;
            if (t != null) {
                t.cancel();
            }
            finish(false, new IllegalStateException("delivery shutting down"));
            return true;
        }

        private void finish(boolean success, Throwable error) {
            if (!finished.compareAndSet(false, true)) {
                return;
            }
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            int retryCount = Math.max(0, attempt - 1);
            try {
                if (success) {
                    monitor.onSuccess(name, elapsed);
                } else {
                    monitor.onFailure(name, elapsed, error);
                }
                monitor.metrics(name).recordDelivery(success, elapsed, retryCount, clock.instant());
                metrics.recordChannel(name, success);
                metrics.recordRetries(retryCount);
            } catch (RuntimeException e) {
                log.error("[Delivery] channel={} bookkeeping failed", name, e);
            } finally {
                result.complete(success
                        ? ChannelDeliveryResult.success(name, elapsed, retryCount)
                        : ChannelDeliveryResult.failure(name, elapsed, describe(error), retryCount));
            }
        }

        private String describe(Throwable error) {
            if (error == null) {
                return "unknown error";
            }
            return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        }
    }
}
