package com.fastalert.config;

import com.fastalert.exception.AlertConfigurationException;
import com.fastalert.model.enums.AlertSeverity;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 告警管道配置（绑定前缀：alert）
 *
 * YAML 示例：
 * alert:
 *   enabled: true
 *   minimum-severity: LOW
 *   history:
 *     max-size: 1000
 *   active:
 *     max-size: 10000
 *     max-age: 24h
 *   duplicate:
 *     enabled: true
 *     window: 1m
 *   rate-limit:
 *     enabled: true
 *     tokens-per-minute: 60
 *     burst-size: 10
 *     idle-eviction: 10m
 *     per-source:
 *       db: { tokens-per-minute: 10, burst-size: 3 }
 *   filter:
 *     collect-all-results: false
 *     max-deferrals: 3
 *     deferred-capacity: 1000
 *   delivery:
 *     default-timeout: 5s
 *     default-max-retries: 2
 *     executor:
 *       core-pool-size: 8
 *       max-pool-size: 32
 *       queue-capacity: 1000
 *       keep-alive: 60s
 *       rejected-handler: CALLER_RUNS
 *   backoff:
 *     strategy: exponential
 *     base: 200ms
 *     min: 100ms
 *     max: 5s
 *     jitter-ratio: 0.2
 *   channels:
 *     webhook: { timeout: 2s, max-retries: 3, backoff: fixed }
 *   emergency:
 *     failure-threshold: 10
 *     channels: [log]
 *   health:
 *     check-interval: 30s
 *     maintenance-interval: 1m
 *     latency-budget: 100ms
 *   wheel:
 *     tick-duration: 10ms
 *     ticks-per-wheel: 512
 *   events:
 *     enabled: true
 *     async: true
 *     pool-size: 2
 *     queue-capacity: 1024
 *   shutdown:
 *     await: 30s
 */
@ConfigurationProperties(prefix = "alert")
public class AlertPipelineProperties {

    /** 总开关, 关闭后 raise 直接丢弃 */
    private boolean enabled = true;

    /** 全局最低级别 */
    private AlertSeverity minimumSeverity = AlertSeverity.LOW;

    private History history = new History();

    private Active active = new Active();

    private Duplicate duplicate = new Duplicate();

    private RateLimit rateLimit = new RateLimit();

    private Filter filter = new Filter();

    private Delivery delivery = new Delivery();

    private Backoff backoff = new Backoff();

    /** 按渠道名覆盖投递参数 */
    private Map<String, Channel> channels = new LinkedHashMap<>();

    private Emergency emergency = new Emergency();

    private Health health = new Health();

    private Wheel wheel = new Wheel();

    private Events events = new Events();

    private Shutdown shutdown = new Shutdown();

    // ----------------- 嵌套配置对象 -----------------

    public static class History {
        /** 历史缓冲上限 */
        private int maxSize = 1000;

        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }
    }

    /**
     * 未解决告警集合的上限, 超出按首次进入顺序淘汰最旧
     */
    public static class Active {
        private int maxSize = 10_000;

        /** 超过该时长仍未解决的告警在维护时移出 */
        private Duration maxAge = Duration.ofHours(24);

        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }
        public Duration getMaxAge() { return maxAge; }
        public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }
    }

    public static class Duplicate {
        private boolean enabled = true;

        /** 去重窗口, 以首次出现时间为起点 */
        private Duration window = Duration.ofMinutes(1);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
    }

    public static class RateLimit {
        private boolean enabled = true;

        /** 每分钟补充令牌数 */
        private double tokensPerMinute = 60;

        /** 桶容量 */
        private int burstSize = 10;

        /** 空闲多久的桶可被回收 */
        private Duration idleEviction = Duration.ofMinutes(10);

        /** 按 source 覆盖 */
        private Map<String, Bucket> perSource = new LinkedHashMap<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public double getTokensPerMinute() { return tokensPerMinute; }
        public void setTokensPerMinute(double tokensPerMinute) { this.tokensPerMinute = tokensPerMinute; }
        public int getBurstSize() { return burstSize; }
        public void setBurstSize(int burstSize) { this.burstSize = burstSize; }
        public Duration getIdleEviction() { return idleEviction; }
        public void setIdleEviction(Duration idleEviction) { this.idleEviction = idleEviction; }
        public Map<String, Bucket> getPerSource() { return perSource; }
        public void setPerSource(Map<String, Bucket> perSource) { this.perSource = perSource; }

        public static class Bucket {
            private double tokensPerMinute = 60;
            private int burstSize = 10;

            public Bucket() {
            }

            public Bucket(double tokensPerMinute, int burstSize) {
                this.tokensPerMinute = tokensPerMinute;
                this.burstSize = burstSize;
            }

            public double getTokensPerMinute() { return tokensPerMinute; }
            public void setTokensPerMinute(double tokensPerMinute) { this.tokensPerMinute = tokensPerMinute; }
            public int getBurstSize() { return burstSize; }
            public void setBurstSize(int burstSize) { this.burstSize = burstSize; }
        }
    }

    public static class Filter {
        /** 遇到 Suppress 后是否继续评估剩余过滤器(仅为指标) */
        private boolean collectAllResults = false;

        /** 被 Defer 的告警最多重新评估几次 */
        private int maxDeferrals = 3;

        /** 延迟队列容量 */
        private int deferredCapacity = 1000;

        public boolean isCollectAllResults() { return collectAllResults; }
        public void setCollectAllResults(boolean collectAllResults) { this.collectAllResults = collectAllResults; }
        public int getMaxDeferrals() { return maxDeferrals; }
        public void setMaxDeferrals(int maxDeferrals) { this.maxDeferrals = maxDeferrals; }
        public int getDeferredCapacity() { return deferredCapacity; }
        public void setDeferredCapacity(int deferredCapacity) { this.deferredCapacity = deferredCapacity; }
    }

    public static class Delivery {
        /** 单次投递超时 */
        private Duration defaultTimeout = Duration.ofSeconds(5);

        /** 默认最大重试次数(不含首次) */
        private int defaultMaxRetries = 2;

        private Exec executor = new Exec();

        public Duration getDefaultTimeout() { return defaultTimeout; }
        public void setDefaultTimeout(Duration defaultTimeout) { this.defaultTimeout = defaultTimeout; }
        public int getDefaultMaxRetries() { return defaultMaxRetries; }
        public void setDefaultMaxRetries(int defaultMaxRetries) { this.defaultMaxRetries = defaultMaxRetries; }
        public Exec getExecutor() { return executor; }
        public void setExecutor(Exec executor) { this.executor = executor; }
    }

    public static class Exec {
        private int corePoolSize = 8;

        private int maxPoolSize = 32;

        /** 任务队列容量 */
        private int queueCapacity = 1000;

        /** 线程空闲存活时间 */
        private Duration keepAlive = Duration.ofSeconds(60);

        /** 拒绝策略：ABORT | CALLER_RUNS | DISCARD | DISCARD_OLDEST */
        private RejectedHandlerPolicy rejectedHandler = RejectedHandlerPolicy.CALLER_RUNS;

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public Duration getKeepAlive() { return keepAlive; }
        public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }
        public RejectedHandlerPolicy getRejectedHandler() { return rejectedHandler; }
        public void setRejectedHandler(RejectedHandlerPolicy rejectedHandler) { this.rejectedHandler = rejectedHandler; }
    }

    public static class Backoff {
        /** 策略：fixed | exponential | spi:{name} */
        private String strategy = "exponential";

        /** 基础间隔（指数退避的 base） */
        private Duration base = Duration.ofMillis(200);

        /** 最小间隔 */
        private Duration min = Duration.ofMillis(100);

        /** 最大间隔 */
        private Duration max = Duration.ofSeconds(5);

        /** 抖动比例（0~1），例如 0.2 表示 ±20% */
        private double jitterRatio = 0.2;

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
        public Duration getBase() { return base; }
        public void setBase(Duration base) { this.base = base; }
        public Duration getMin() { return min; }
        public void setMin(Duration min) { this.min = min; }
        public Duration getMax() { return max; }
        public void setMax(Duration max) { this.max = max; }
        public double getJitterRatio() { return jitterRatio; }
        public void setJitterRatio(double jitterRatio) { this.jitterRatio = jitterRatio; }
    }

    public static class Channel {
        private boolean enabled = true;

        /** 为空则使用 delivery.default-timeout */
        private Duration timeout;

        /** 为空则使用 delivery.default-max-retries */
        private Integer maxRetries;

        /** 为空则使用 backoff.strategy */
        private String backoff;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public Integer getMaxRetries() { return maxRetries; }
        public void setMaxRetries(Integer maxRetries) { this.maxRetries = maxRetries; }
        public String getBackoff() { return backoff; }
        public void setBackoff(String backoff) { this.backoff = backoff; }
    }

    public static class Emergency {
        /** 连续管道级失败达到该值自动进入应急模式, <=0 关闭自动触发 */
        private int failureThreshold = 10;

        /** 应急模式下仅投递这些渠道, 为空则不限制 */
        private List<String> channels = new ArrayList<>(List.of("log"));

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
        public List<String> getChannels() { return channels; }
        public void setChannels(List<String> channels) { this.channels = channels; }
    }

    public static class Health {
        /** 渠道健康探测周期 */
        private Duration checkInterval = Duration.ofSeconds(30);

        /** 维护(去重清理/空闲桶回收/延迟重评估)周期 */
        private Duration maintenanceInterval = Duration.ofMinutes(1);

        /** 单条告警处理耗时预算, 超出按比例扣分 */
        private Duration latencyBudget = Duration.ofMillis(100);

        public Duration getCheckInterval() { return checkInterval; }
        public void setCheckInterval(Duration checkInterval) { this.checkInterval = checkInterval; }
        public Duration getMaintenanceInterval() { return maintenanceInterval; }
        public void setMaintenanceInterval(Duration maintenanceInterval) { this.maintenanceInterval = maintenanceInterval; }
        public Duration getLatencyBudget() { return latencyBudget; }
        public void setLatencyBudget(Duration latencyBudget) { this.latencyBudget = latencyBudget; }
    }

    public static class Wheel {
        /** 时间轮刻度, 决定超时与退避的精度 */
        private Duration tickDuration = Duration.ofMillis(10);

        /** 槽位数量（2^n 较佳） */
        private int ticksPerWheel = 512;

        /** 允许挂起的最大 timeout 数量（Netty 参数） */
        private long maxPendingTimeouts = 100_000;

        public Duration getTickDuration() { return tickDuration; }
        public void setTickDuration(Duration tickDuration) { this.tickDuration = tickDuration; }
        public int getTicksPerWheel() { return ticksPerWheel; }
        public void setTicksPerWheel(int ticksPerWheel) { this.ticksPerWheel = ticksPerWheel; }
        public long getMaxPendingTimeouts() { return maxPendingTimeouts; }
        public void setMaxPendingTimeouts(long maxPendingTimeouts) { this.maxPendingTimeouts = maxPendingTimeouts; }
    }

    /**
     * 告警生命周期事件(raised/acknowledged/resolved/suppressed)派发
     */
    public static class Events {
        private boolean enabled = true;

        /** false 时在调用线程同步派发 */
        private boolean async = true;

        private int poolSize = 2;

        private int queueCapacity = 1024;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public boolean isAsync() { return async; }
        public void setAsync(boolean async) { this.async = async; }
        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }

    public static class Shutdown {
        /** 优雅停机等待时长 */
        private Duration await = Duration.ofSeconds(30);

        public Duration getAwait() { return await; }
        public void setAwait(Duration await) { this.await = await; }
    }

    // ----------------- 公共枚举/工具 -----------------

    /** 线程池拒绝策略枚举（YAML 中大小写均可） */
    public enum RejectedHandlerPolicy {
        ABORT, CALLER_RUNS, DISCARD, DISCARD_OLDEST;

        public static RejectedHandlerPolicy from(String v) {
            return RejectedHandlerPolicy.valueOf(v.trim().toUpperCase(Locale.ROOT));
        }
        public RejectedExecutionHandler toHandler() {
            return switch (this) {
                case ABORT -> new ThreadPoolExecutor.AbortPolicy();
                case CALLER_RUNS -> new ThreadPoolExecutor.CallerRunsPolicy();
                case DISCARD -> new ThreadPoolExecutor.DiscardPolicy();
                case DISCARD_OLDEST -> new ThreadPoolExecutor.DiscardOldestPolicy();
            };
        }
    }

    /**
     * 参数校验, 非法配置在启动期拒绝
     */
    public void validate() {
        AlertConfigurationException.check(history.getMaxSize() > 0, "alert.history.max-size must be > 0");
        AlertConfigurationException.check(active.getMaxSize() > 0, "alert.active.max-size must be > 0");
        AlertConfigurationException.check(isPositive(active.getMaxAge()), "alert.active.max-age must be > 0");
        AlertConfigurationException.check(events.getPoolSize() > 0, "alert.events.pool-size must be > 0");
        AlertConfigurationException.check(events.getQueueCapacity() > 0, "alert.events.queue-capacity must be > 0");
        AlertConfigurationException.check(isPositive(duplicate.getWindow()), "alert.duplicate.window must be > 0");
        validateBucket("alert.rate-limit", rateLimit.getTokensPerMinute(), rateLimit.getBurstSize());
        rateLimit.getPerSource().forEach((source, b) ->
                validateBucket("alert.rate-limit.per-source." + source, b.getTokensPerMinute(), b.getBurstSize()));
        AlertConfigurationException.check(filter.getMaxDeferrals() >= 0, "alert.filter.max-deferrals must be >= 0");
        AlertConfigurationException.check(filter.getDeferredCapacity() > 0, "alert.filter.deferred-capacity must be > 0");
        AlertConfigurationException.check(isPositive(delivery.getDefaultTimeout()), "alert.delivery.default-timeout must be > 0");
        AlertConfigurationException.check(delivery.getDefaultMaxRetries() >= 0, "alert.delivery.default-max-retries must be >= 0");
        AlertConfigurationException.check(backoffMaxMillis() >= backoffMinMillis(), "alert.backoff.max must be >= alert.backoff.min");
        AlertConfigurationException.check(backoff.getJitterRatio() >= 0 && backoff.getJitterRatio() < 1,
                "alert.backoff.jitter-ratio must be in [0,1)");
        channels.forEach((name, c) -> {
            AlertConfigurationException.check(c.getTimeout() == null || isPositive(c.getTimeout()),
                    "alert.channels." + name + ".timeout must be > 0");
            AlertConfigurationException.check(c.getMaxRetries() == null || c.getMaxRetries() >= 0,
                    "alert.channels." + name + ".max-retries must be >= 0");
        });
    }

    private static void validateBucket(String prefix, double tokensPerMinute, int burstSize) {
        AlertConfigurationException.check(tokensPerMinute >= 0, prefix + ".tokens-per-minute must be >= 0");
        AlertConfigurationException.check(burstSize >= 1, prefix + ".burst-size must be >= 1");
    }

    private static boolean isPositive(Duration d) {
        return d != null && !d.isNegative() && !d.isZero();
    }

    // ----------------- getters/setters 顶层 -----------------

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public AlertSeverity getMinimumSeverity() { return minimumSeverity; }
    public void setMinimumSeverity(AlertSeverity minimumSeverity) { this.minimumSeverity = minimumSeverity; }

    public History getHistory() { return history; }
    public void setHistory(History history) { this.history = history; }

    public Active getActive() { return active; }
    public void setActive(Active active) { this.active = active; }

    public Duplicate getDuplicate() { return duplicate; }
    public void setDuplicate(Duplicate duplicate) { this.duplicate = duplicate; }

    public RateLimit getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimit rateLimit) { this.rateLimit = rateLimit; }

    public Filter getFilter() { return filter; }
    public void setFilter(Filter filter) { this.filter = filter; }

    public Delivery getDelivery() { return delivery; }
    public void setDelivery(Delivery delivery) { this.delivery = delivery; }

    public Backoff getBackoff() { return backoff; }
    public void setBackoff(Backoff backoff) { this.backoff = backoff; }

    public Map<String, Channel> getChannels() { return channels; }
    public void setChannels(Map<String, Channel> channels) { this.channels = channels; }

    public Emergency getEmergency() { return emergency; }
    public void setEmergency(Emergency emergency) { this.emergency = emergency; }

    public Health getHealth() { return health; }
    public void setHealth(Health health) { this.health = health; }

    public Wheel getWheel() { return wheel; }
    public void setWheel(Wheel wheel) { this.wheel = wheel; }

    public Events getEvents() { return events; }
    public void setEvents(Events events) { this.events = events; }

    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }

    // ----------------- 便捷换算 -----------------

    /** 退避：基础/最小/最大毫秒 */
    public long backoffBaseMillis() { return backoff.getBase().toMillis(); }
    public long backoffMinMillis() { return backoff.getMin().toMillis(); }
    public long backoffMaxMillis() { return backoff.getMax().toMillis(); }
}
