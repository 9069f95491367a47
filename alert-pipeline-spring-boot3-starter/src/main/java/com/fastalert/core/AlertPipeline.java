package com.fastalert.core;

import com.fastalert.config.AlertGuardProperties;
import com.fastalert.config.AlertPipelineProperties;
import com.fastalert.core.backoff.BackoffRegistry;
import com.fastalert.core.channel.ChannelHealthInfo;
import com.fastalert.core.channel.ChannelHealthMonitor;
import com.fastalert.core.channel.ChannelRegistry;
import com.fastalert.core.delivery.AlertDeliveryResults;
import com.fastalert.core.delivery.DeliveryOrchestrator;
import com.fastalert.core.event.AlertEventPublisher;
import com.fastalert.core.failure.RouterFailureDecider;
import com.fastalert.core.filter.FilterChain;
import com.fastalert.core.filter.FilterChainResult;
import com.fastalert.core.handler.GuardedChannelExecutor;
import com.fastalert.core.health.SystemHealthMonitor;
import com.fastalert.core.metric.AlertMetrics;
import com.fastalert.core.ratelimit.RateLimitDecision;
import com.fastalert.core.ratelimit.TokenBucketRateLimiter;
import com.fastalert.core.rule.AlertRule;
import com.fastalert.core.rule.RuleEngine;
import com.fastalert.core.rule.RuleEvaluation;
import com.fastalert.core.spi.BackoffPolicy;
import com.fastalert.core.spi.channel.AlertChannel;
import com.fastalert.core.spi.event.AlertEventListener;
import com.fastalert.core.spi.failure.FailureCaseHandler;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.core.spi.filter.AlertFilter;
import com.fastalert.core.spi.suppress.EscalationPolicy;
import com.fastalert.core.suppress.DuplicateCheck;
import com.fastalert.core.suppress.DuplicateSuppressor;
import com.fastalert.model.Alert;
import com.fastalert.model.AlertOutcome;
import com.fastalert.model.ctx.FilterContext;
import com.fastalert.model.ctx.RuleContext;
import com.fastalert.model.enums.AlertSeverity;
import com.fastalert.model.enums.AlertState;
import com.fastalert.model.enums.SuppressionReason;
import com.fastalert.model.event.AlertEvent;
import com.fastalert.model.stat.AlertStatistics;
import com.fastalert.model.stat.AlertSystemHealthReport;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 告警管道入口
 * raise → 最低级别 → (应急模式下 CRITICAL 跳过过滤与规则) → 去重 → 限流 → 过滤链 → 规则 → 扇出投递 → 统计/系统健康
 * 投递之前的阶段在调用线程同步执行, 投递在投递线程池异步执行
 */
public class AlertPipeline {

    private static final Logger log = LoggerFactory.getLogger(AlertPipeline.class);

    private final AlertPipelineProperties props;
    private final Clock clock;
    private final ChannelRegistry channels;
    private final ChannelHealthMonitor channelHealth;
    private final DeliveryOrchestrator orchestrator;
    private final DuplicateSuppressor duplicates;
    private final TokenBucketRateLimiter rateLimiter;
    private final FilterChain filterChain;
    private final RuleEngine ruleEngine;
    private final SystemHealthMonitor systemHealth;
    private final AlertMetrics metrics;
    private final AlertEventPublisher events;

    /** 投递线程池与时间轮, 由 shutdown 统一关闭 */
    private final ExecutorService deliveryExecutor;
    private final HashedWheelTimer timer;

    private final AlertStatisticsRecorder stats = new AlertStatisticsRecorder();

    /** 未解决的告警 */
    private final ConcurrentHashMap<UUID, Alert> activeAlerts = new ConcurrentHashMap<>();

    /** 首次进入活跃集合的顺序, 超出上限时从队头淘汰 */
    private final ConcurrentLinkedQueue<UUID> activeOrder = new ConcurrentLinkedQueue<>();

    /** 有界历史, 超出上限丢弃最旧 */
    private final Deque<Alert> history = new ArrayDeque<>();

    /** 被 DEFER 的告警, 由维护任务重新评估 */
    private final BlockingQueue<Deferred> deferred;

    /** source 级最低级别 */
    private final ConcurrentHashMap<String, AlertSeverity> sourceMinimum = new ConcurrentHashMap<>();

    private volatile AlertSeverity minimumSeverity;

    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public AlertPipeline(AlertPipelineProperties props,
                         Clock clock,
                         ChannelRegistry channels,
                         ChannelHealthMonitor channelHealth,
                         DeliveryOrchestrator orchestrator,
                         DuplicateSuppressor duplicates,
                         TokenBucketRateLimiter rateLimiter,
                         FilterChain filterChain,
                         RuleEngine ruleEngine,
                         SystemHealthMonitor systemHealth,
                         AlertMetrics metrics,
                         AlertEventPublisher events,
                         ExecutorService deliveryExecutor,
                         HashedWheelTimer timer) {
        this.props = props;
        this.clock = clock;
        this.channels = channels;
        this.channelHealth = channelHealth;
        this.orchestrator = orchestrator;
        this.duplicates = duplicates;
        this.rateLimiter = rateLimiter;
        this.filterChain = filterChain;
        this.ruleEngine = ruleEngine;
        this.systemHealth = systemHealth;
        this.metrics = metrics;
        this.events = events;
        this.deliveryExecutor = deliveryExecutor;
        this.timer = timer;
        this.minimumSeverity = props.getMinimumSeverity() == null ? AlertSeverity.LOW : props.getMinimumSeverity();
        this.deferred = new LinkedBlockingQueue<>(props.getFilter().getDeferredCapacity());
    }

    public static Builder builder() {
        return new Builder();
    }

    /* ========== 提交 ========== */

    /**
     * 发出即忘
     */
    public void raiseAlert(String message, AlertSeverity severity, String source) {
        raiseAlert(message, severity, source, null, null);
    }

    public void raiseAlert(String message, AlertSeverity severity, String source, String tag, String correlationId) {
        Alert alert = Alert.builder()
                .message(message)
                .severity(severity)
                .source(source)
                .tag(tag)
                .correlationId(correlationId)
                .timestamp(clock.instant())
                .build();
        processAsync(alert).whenComplete((o, ex) -> {
            if (ex != null) {
                log.error("[Alert-Pipeline] alert={} processing failed", alert.getId(), ex);
            }
        });
    }

    /**
     * 同步处理, 等待投递结束
     */
    public AlertOutcome process(Alert alert) {
        try {
            return processAsync(alert).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw e;
        }
    }

    public CompletableFuture<AlertOutcome> processAsync(Alert alert) {
        Objects.requireNonNull(alert, "alert");
        long start = System.nanoTime();
        Instant now = clock.instant();

        if (!props.isEnabled()) {
            return CompletableFuture.completedFuture(suppressed(alert, SuppressionReason.DISABLED, "pipeline disabled", start));
        }
        if (shutdown.get()) {
            log.warn("[Alert-Pipeline] shutting down, alert={} dropped", alert.getId());
            return CompletableFuture.completedFuture(suppressed(alert, SuppressionReason.DISABLED, "pipeline shut down", start));
        }
        stats.raised(now);
        metrics.incRaised();

        AlertSeverity floor = minimumSeverityFor(alert.getSource());
        if (!alert.getSeverity().isAtLeast(floor)) {
            return CompletableFuture.completedFuture(
                    suppressed(alert, SuppressionReason.SEVERITY, "below " + floor, start));
        }

        boolean bypass = systemHealth.isEmergencyMode() && alert.getSeverity() == AlertSeverity.CRITICAL;
        Alert current = alert;

        // 去重
        if (props.getDuplicate().isEnabled()) {
            try {
                DuplicateCheck dc = duplicates.check(current, now);
                if (dc.isSuppressed()) {
                    consolidate(dc);
                    return CompletableFuture.completedFuture(
                            suppressed(alert, SuppressionReason.DUPLICATE, "duplicate of " + dc.getPrimaryId(), start));
                }
                if (dc.isEscalated()) {
                    current = escalate(current, dc);
                }
            } catch (RuntimeException e) {
                stageError("duplicate", alert, e);
            }
        }

        // 限流
        if (props.getRateLimit().isEnabled()) {
            try {
                RateLimitDecision rl = rateLimiter.tryAcquire(current.getSource(), now);
                if (!rl.isAllowed()) {
                    return CompletableFuture.completedFuture(
                            suppressed(current, SuppressionReason.RATE_LIMIT, "source " + current.getSource() + " rate limited", start));
                }
            } catch (RuntimeException e) {
                stageError("rate-limit", alert, e);
            }
        }

        return continueFromFilters(current, bypass, 0, start);
    }

    /**
     * 过滤 → 规则 → 投递, 延迟重评估也从这里进入
     */
    private CompletableFuture<AlertOutcome> continueFromFilters(Alert alert, boolean bypass, int deferrals, long start) {
        Instant now = clock.instant();
        Alert current = alert;
        boolean emergency = systemHealth.isEmergencyMode();

        if (!bypass) {
            try {
                FilterContext fctx = FilterContext.builder()
                        .correlationId(current.getCorrelationId())
                        .evaluatedAt(now)
                        .emergencyMode(emergency)
                        .deferralCount(deferrals)
                        .build();
                FilterChainResult fr = filterChain.evaluate(current, fctx);
                if (fr.isSuppressed()) {
                    return CompletableFuture.completedFuture(
                            suppressed(fr.getAlert(), SuppressionReason.FILTER, fr.getDecidedBy(), start));
                }
                if (fr.isDeferred()) {
                    return CompletableFuture.completedFuture(defer(fr.getAlert(), deferrals, fr.getDecidedBy(), start));
                }
                current = fr.getAlert();
            } catch (RuntimeException e) {
                stageError("filter", alert, e);
            }

            try {
                RuleContext rctx = RuleContext.builder()
                        .evaluatedAt(now)
                        .correlationId(current.getCorrelationId())
                        .emergencyMode(emergency)
                        .build();
                RuleEvaluation re = ruleEngine.evaluate(current, rctx);
                if (re.isSuppressed()) {
                    return CompletableFuture.completedFuture(
                            suppressed(current, SuppressionReason.RULE, re.getSuppressedBy(), start));
                }
                current = re.getAlert();
            } catch (RuntimeException e) {
                stageError("rule", alert, e);
            }
        }

        Alert tracked = current;
        track(tracked);
        appendHistory(tracked);
        fire(AlertEvent.raised(tracked, now));

        List<String> targets = emergency ? props.getEmergency().getChannels() : null;
        return orchestrator.deliverAsync(tracked, targets)
                .thenApply(results -> dispatched(tracked, results, start));
    }

    /* ========== 结果归档 ========== */

    /**
     * 被抑制的告警不进入活跃集合, 结果中的告警为 SUPPRESSED
     */
    private AlertOutcome suppressed(Alert alert, SuppressionReason reason, String detail, long start) {
        Instant now = clock.instant();
        Alert s = alert.getState().canTransitionTo(AlertState.SUPPRESSED) ? alert.suppress(now) : alert;
        stats.suppressed(reason);
        metrics.incSuppressed(reason.name());
        log.debug("[Alert-Pipeline] alert={} suppressed, reason={}, detail={}", s.getId(), reason, detail);
        fire(AlertEvent.suppressed(s, reason.name() + ": " + detail, now));
        return AlertOutcome.suppressed(s, reason, detail, took(start));
    }

    private AlertOutcome defer(Alert alert, int deferrals, String by, long start) {
        int max = props.getFilter().getMaxDeferrals();
        if (deferrals >= max || !deferred.offer(new Deferred(alert, deferrals))) {
            log.info("[Alert-Pipeline] alert={} deferral dropped after {} re-evaluation(s), by={}",
                    alert.getId(), deferrals, by);
            return suppressed(alert, SuppressionReason.DEFERRAL_EXPIRED, by, start);
        }
        if (deferrals == 0) {
            stats.deferred();
            metrics.incDeferred();
        }
        return AlertOutcome.deferred(alert, by, took(start));
    }

    private AlertOutcome dispatched(Alert alert, AlertDeliveryResults results, long start) {
        AlertOutcome outcome = AlertOutcome.dispatched(alert, results, took(start));
        switch (outcome.getDisposition()) {
            case DELIVERED -> {
                stats.delivered();
                metrics.incDelivered();
            }
            case UNDELIVERABLE -> {
                stats.undeliverable();
                metrics.incUndeliverable();
                log.warn("[Alert-Pipeline] alert={} source={} undeliverable, no eligible channel",
                        alert.getId(), alert.getSource());
            }
            default -> {
                stats.deliveryFailed();
                metrics.incDeliveryFailed();
                log.warn("[Alert-Pipeline] alert={} failed on all channels, skipped={}",
                        alert.getId(), results.getSkippedChannels());
            }
        }
        if (systemHealth.recordPipelineResult(results.isAnySuccessful())) {
            metrics.incEmergency();
        }
        long nanos = outcome.getProcessingTime().toNanos();
        stats.processed(nanos);
        metrics.recordProcessNanos(nanos);
        return outcome;
    }

    private Duration took(long start) {
        return Duration.ofNanos(System.nanoTime() - start);
    }

    private void stageError(String stage, Alert alert, RuntimeException e) {
        // 出错放行, 告警不能因为管道自身问题丢失
        stats.evaluationError();
        metrics.incEvaluationError();
        log.error("[Alert-Pipeline] stage={} alert={} failed, continue", stage, alert.getId(), e);
    }

    /**
     * 重复告警: 主告警 count 追平窗口内出现次数
     */
    private void consolidate(DuplicateCheck dc) {
        activeAlerts.computeIfPresent(dc.getPrimaryId(),
                (id, a) -> a.incrementCount(Math.max(0, dc.getOccurrences() - a.getCount())));
    }

    /**
     * 升级: 以合并后的主告警(升级后级别)继续处理
     */
    private Alert escalate(Alert duplicate, DuplicateCheck dc) {
        Alert primary = activeAlerts.get(dc.getPrimaryId());
        Alert base = primary != null && primary.getState() == AlertState.ACTIVE
                ? primary
                : duplicate.toBuilder().id(dc.getPrimaryId()).build();
        return base.incrementCount(Math.max(0, dc.getOccurrences() - base.getCount()))
                .withSeverity(dc.getEscalatedSeverity());
    }

    /**
     * 写入活跃集合, 超出 alert.active.max-size 时按进入顺序淘汰最旧
     */
    private void track(Alert alert) {
        if (activeAlerts.put(alert.getId(), alert) == null) {
            activeOrder.offer(alert.getId());
        }
        int max = props.getActive().getMaxSize();
        int dropped = 0;
        while (activeAlerts.size() > max) {
            UUID oldest = activeOrder.poll();
            if (oldest == null) {
                break;
            }
            if (activeAlerts.remove(oldest) != null) {
                dropped++;
            }
        }
        if (dropped > 0) {
            log.warn("[Alert-Pipeline] active set over {}, {} oldest unresolved alert(s) dropped", max, dropped);
        }
    }

    private void fire(AlertEvent event) {
        if (props.getEvents().isEnabled()) {
            events.publish(event);
        }
    }

    private void appendHistory(Alert alert) {
        int max = props.getHistory().getMaxSize();
        synchronized (history) {
            history.addLast(alert);
            while (history.size() > max) {
                history.pollFirst();
            }
        }
    }

    /* ========== 生命周期 ========== */

    public boolean acknowledge(UUID alertId, String by) {
        Alert[] acked = new Alert[1];
        Instant now = clock.instant();
        activeAlerts.computeIfPresent(alertId, (id, a) -> {
            if (!a.getState().canTransitionTo(AlertState.ACKNOWLEDGED)) {
                return a;
            }
            acked[0] = a.acknowledge(by, now);
            return acked[0];
        });
        if (acked[0] == null) {
            return false;
        }
        stats.acknowledged();
        log.info("[Alert-Pipeline] alert={} acknowledged by {}", alertId, by);
        fire(AlertEvent.acknowledged(acked[0], by, now));
        return true;
    }

    /**
     * 解决后移出活跃集合, 写入历史
     */
    public boolean resolve(UUID alertId, String by) {
        Alert[] resolved = new Alert[1];
        Instant now = clock.instant();
        activeAlerts.computeIfPresent(alertId, (id, a) -> {
            if (!a.getState().canTransitionTo(AlertState.RESOLVED)) {
                return a;
            }
            resolved[0] = a.resolve(by, now);
            return null;
        });
        if (resolved[0] == null) {
            return false;
        }
        activeOrder.remove(alertId);
        stats.resolved();
        appendHistory(resolved[0]);
        log.info("[Alert-Pipeline] alert={} resolved by {}", alertId, by);
        fire(AlertEvent.resolved(resolved[0], by, now));
        return true;
    }

    public Optional<Alert> getAlert(UUID alertId) {
        return Optional.ofNullable(activeAlerts.get(alertId));
    }

    public List<Alert> getActiveAlerts() {
        return new ArrayList<>(activeAlerts.values());
    }

    /**
     * 最近一段时间内的历史(按 timestamp)
     */
    public List<Alert> getAlertHistory(Duration period) {
        Instant cutoff = clock.instant().minus(period);
        List<Alert> out = new ArrayList<>();
        synchronized (history) {
            for (Alert a : history) {
                if (!a.getTimestamp().isBefore(cutoff)) {
                    out.add(a);
                }
            }
        }
        return out;
    }

    /* ========== 配置 ========== */

    public void setMinimumSeverity(AlertSeverity severity) {
        this.minimumSeverity = Objects.requireNonNull(severity, "severity");
    }

    public void setMinimumSeverity(String source, AlertSeverity severity) {
        sourceMinimum.put(Objects.requireNonNull(source, "source"), Objects.requireNonNull(severity, "severity"));
    }

    public AlertSeverity minimumSeverityFor(String source) {
        return sourceMinimum.getOrDefault(source, minimumSeverity);
    }

    public void registerChannel(AlertChannel channel) {
        channels.register(channel);
        log.info("[Alert-Pipeline] channel {} registered", channel.name());
    }

    public boolean unregisterChannel(String name) {
        boolean removed = channels.unregister(name);
        if (removed) {
            channelHealth.remove(name);
        }
        return removed;
    }

    public void addFilter(AlertFilter filter) {
        filterChain.register(filter);
    }

    public boolean removeFilter(String name) {
        return filterChain.unregister(name);
    }

    public void addRule(AlertRule rule) {
        ruleEngine.addRule(rule);
    }

    public boolean removeRule(String ruleId) {
        return ruleEngine.removeRule(ruleId);
    }

    public void addEventListener(AlertEventListener listener) {
        events.addListener(listener);
    }

    public boolean removeEventListener(String name) {
        return events.removeListener(name);
    }

    /* ========== 统计与健康 ========== */

    public AlertStatistics getStatistics() {
        return stats.snapshot(activeAlerts.size());
    }

    public void resetStatistics() {
        stats.reset();
        filterChain.resetMetrics();
        ruleEngine.resetStatistics();
        channelHealth.resetMetrics();
    }

    public List<ChannelHealthInfo> getChannelHealth() {
        List<ChannelHealthInfo> out = new ArrayList<>();
        for (AlertChannel ch : channels.all()) {
            out.add(channelHealth.getHealth(ch.name()));
        }
        return out;
    }

    public AlertSystemHealthReport getSystemHealthReport() {
        return systemHealth.buildReport(getStatistics(), getChannelHealth(), orchestrator.getResourceUsage());
    }

    public boolean enableEmergencyMode(String reason) {
        boolean on = systemHealth.enableEmergencyMode(reason);
        if (on) {
            metrics.incEmergency();
        }
        return on;
    }

    public boolean disableEmergencyMode() {
        return systemHealth.disableEmergencyMode();
    }

    public boolean isEmergencyModeActive() {
        return systemHealth.isEmergencyMode();
    }

    /* ========== 维护 ========== */

    /**
     * 去重清理、空闲桶回收、规则窗口清理、过期活跃告警移出、延迟告警重评估
     */
    public void performMaintenance() {
        Instant now = clock.instant();
        int swept = duplicates.sweep(now);
        int evicted = rateLimiter.evictIdle(now);
        ruleEngine.sweep(now);
        int expired = expireActive(now);
        int redone = reevaluateDeferred();
        if (swept + evicted + expired + redone > 0) {
            log.debug("[Alert-Pipeline] maintenance: duplicates swept={}, buckets evicted={}, active expired={}, deferred re-evaluated={}",
                    swept, evicted, expired, redone);
        }
    }

    /**
     * 移出 timestamp 早于 now - alert.active.max-age 的未解决告警
     */
    private int expireActive(Instant now) {
        Instant cutoff = now.minus(props.getActive().getMaxAge());
        int before = activeAlerts.size();
        activeAlerts.values().removeIf(a -> a.getTimestamp().isBefore(cutoff));
        int expired = Math.max(0, before - activeAlerts.size());
        if (expired > 0) {
            activeOrder.removeIf(id -> !activeAlerts.containsKey(id));
            log.info("[Alert-Pipeline] {} unresolved alert(s) older than {} dropped from active set",
                    expired, props.getActive().getMaxAge());
        }
        return expired;
    }

    private int reevaluateDeferred() {
        List<Deferred> batch = new ArrayList<>(deferred.size());
        deferred.drainTo(batch);
        for (Deferred d : batch) {
            long start = System.nanoTime();
            continueFromFilters(d.alert, false, d.deferrals + 1, start)
                    .whenComplete((o, ex) -> {
                        if (ex != null) {
                            log.error("[Alert-Pipeline] deferred alert={} re-evaluation failed", d.alert.getId(), ex);
                        }
                    });
        }
        return batch.size();
    }

    public int getDeferredCount() {
        return deferred.size();
    }

    /**
     * 依次探测已注册渠道
     */
    public List<ChannelHealthInfo> runHealthChecks() {
        List<ChannelHealthInfo> out = new ArrayList<>();
        for (AlertChannel ch : channels.all()) {
            out.add(channelHealth.runHealthCheck(ch));
        }
        return out;
    }

    /**
     * 停止接收, 未开始的重试以失败结束, 等待在途投递后关闭线程池与时间轮
     */
    public void shutdown(Duration await) {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        log.info("[Alert-Pipeline] shutting down ...");
        orchestrator.shutdown();
        deliveryExecutor.shutdown();
        try {
            if (!deliveryExecutor.awaitTermination(await.toMillis(), TimeUnit.MILLISECONDS)) {
                deliveryExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            deliveryExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        timer.stop().forEach(t -> log.debug("[Alert-Pipeline] timeout cancelled on stop: {}", t));
        events.shutdown(await.toMillis());
        log.info("[Alert-Pipeline] shut down");
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    public AlertPipelineProperties getProperties() {
        return props;
    }

    public AlertMetrics getMetrics() {
        return metrics;
    }

    public FilterChain getFilterChain() {
        return filterChain;
    }

    public RuleEngine getRuleEngine() {
        return ruleEngine;
    }

    public ChannelHealthMonitor getChannelHealthMonitor() {
        return channelHealth;
    }

    public TokenBucketRateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public DuplicateSuppressor getDuplicateSuppressor() {
        return duplicates;
    }

    public AlertEventPublisher getEventPublisher() {
        return events;
    }

    private static final class Deferred {
        private final Alert alert;
        private final int deferrals;

        Deferred(Alert alert, int deferrals) {
            this.alert = alert;
            this.deferrals = deferrals;
        }
    }

    /**
     * 脱离 Spring 使用时的装配入口, 自建投递线程池与时间轮
     */
    public static final class Builder {
        private AlertPipelineProperties properties = new AlertPipelineProperties();
        private AlertGuardProperties guardProperties = new AlertGuardProperties();
        private Clock clock = Clock.systemUTC();
        private MeterRegistry meterRegistry;
        private EscalationPolicy escalationPolicy = EscalationPolicy.NONE;
        private FailureDecider failureDecider;
        private final List<AlertChannel> channelList = new ArrayList<>();
        private final List<AlertFilter> filters = new ArrayList<>();
        private final List<AlertRule> rules = new ArrayList<>();
        private final List<BackoffPolicy> backoffPolicies = new ArrayList<>();
        private final List<FailureCaseHandler<?>> failureHandlers = new ArrayList<>();
        private final List<AlertEventListener> eventListeners = new ArrayList<>();

        private Builder() {}

        public Builder properties(AlertPipelineProperties properties) { this.properties = properties; return this; }
        public Builder guardProperties(AlertGuardProperties guardProperties) { this.guardProperties = guardProperties; return this; }
        public Builder clock(Clock clock) { this.clock = clock; return this; }
        public Builder meterRegistry(MeterRegistry meterRegistry) { this.meterRegistry = meterRegistry; return this; }
        public Builder escalationPolicy(EscalationPolicy policy) { this.escalationPolicy = policy; return this; }
        public Builder failureDecider(FailureDecider decider) { this.failureDecider = decider; return this; }
        public Builder channel(AlertChannel channel) { this.channelList.add(channel); return this; }
        public Builder channels(Collection<? extends AlertChannel> channels) { this.channelList.addAll(channels); return this; }
        public Builder filter(AlertFilter filter) { this.filters.add(filter); return this; }
        public Builder rule(AlertRule rule) { this.rules.add(rule); return this; }
        public Builder backoffPolicy(BackoffPolicy policy) { this.backoffPolicies.add(policy); return this; }
        public Builder failureHandler(FailureCaseHandler<?> handler) { this.failureHandlers.add(handler); return this; }
        public Builder eventListener(AlertEventListener listener) { this.eventListeners.add(listener); return this; }

        public AlertPipeline build() {
            AlertPipelineProperties p = Objects.requireNonNull(properties, "properties");
            p.validate();

            AlertPipelineProperties.Exec exec = p.getDelivery().getExecutor();
            ExecutorService executor = new ThreadPoolExecutor(
                    exec.getCorePoolSize(),
                    exec.getMaxPoolSize(),
                    exec.getKeepAlive().toSeconds(),
                    TimeUnit.SECONDS,
                    new LinkedBlockingDeque<>(exec.getQueueCapacity()),
                    new NamedThreadFactory("alert-delivery-exec"),
                    exec.getRejectedHandler().toHandler());
            HashedWheelTimer wheel = new HashedWheelTimer(
                    new NamedThreadFactory("alert-wheel-timer"),
                    p.getWheel().getTickDuration().toMillis(),
                    TimeUnit.MILLISECONDS,
                    p.getWheel().getTicksPerWheel(),
                    false,
                    p.getWheel().getMaxPendingTimeouts());

            ChannelRegistry registry = new ChannelRegistry(channelList);
            ChannelHealthMonitor monitor = new ChannelHealthMonitor(guardProperties, clock);
            BackoffRegistry backoff = new BackoffRegistry(p, backoffPolicies);
            FailureDecider decider = failureDecider != null ? failureDecider : RouterFailureDecider.withDefaults(failureHandlers);
            AlertMetrics metrics = AlertMetrics.create(meterRegistry != null ? meterRegistry : new SimpleMeterRegistry());
            DeliveryOrchestrator orchestrator = new DeliveryOrchestrator(registry, monitor,
                    new GuardedChannelExecutor(guardProperties), backoff, decider, p, executor, wheel, metrics, clock);

            FilterChain chain = new FilterChain(p.getFilter().isCollectAllResults());
            filters.forEach(chain::register);
            RuleEngine engine = new RuleEngine();
            rules.forEach(engine::addRule);

            return new AlertPipeline(p, clock, registry, monitor, orchestrator,
                    new DuplicateSuppressor(p.getDuplicate().getWindow(), escalationPolicy),
                    new TokenBucketRateLimiter(p.getRateLimit()),
                    chain, engine, new SystemHealthMonitor(p, clock), metrics,
                    AlertEventPublisher.create(p.getEvents(), eventListeners, metrics), executor, wheel);
        }
    }
}
