package com.fastalert.core.ratelimit;

import com.fastalert.config.AlertPipelineProperties;
import com.fastalert.exception.AlertConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按 source 的令牌桶限流
 * 桶在首次出现时创建, 每次调用时惰性补充, 空闲过久的桶由维护任务回收
 */
public class TokenBucketRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    private final ConcurrentHashMap<String, RateLimitBucket> buckets = new ConcurrentHashMap<>();

    /** source 级别覆盖 */
    private final ConcurrentHashMap<String, BucketConfig> overrides = new ConcurrentHashMap<>();

    private volatile BucketConfig defaults;

    private final Duration idleEviction;

    public TokenBucketRateLimiter(double tokensPerMinute, int burstSize, Duration idleEviction) {
        this.defaults = BucketConfig.validated("default", tokensPerMinute, burstSize);
        this.idleEviction = Objects.requireNonNull(idleEviction, "idleEviction");
    }

    public TokenBucketRateLimiter(AlertPipelineProperties.RateLimit props) {
        this(props.getTokensPerMinute(), props.getBurstSize(), props.getIdleEviction());
        props.getPerSource().forEach((source, b) -> configureSource(source, b.getTokensPerMinute(), b.getBurstSize()));
    }

    /**
     * 取令牌, 不足 1 个则拒绝
     */
    public RateLimitDecision tryAcquire(String source, Instant now) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(now, "now");
        RateLimitBucket bucket = buckets.computeIfAbsent(source, s -> newBucket(s, now));
        RateLimitDecision decision = bucket.tryConsume(now);
        if (!decision.isAllowed() && log.isDebugEnabled()) {
            log.debug("[Rate-Limit] source={} denied, tokens={}, suppressed={}",
                    source, decision.getBucket().getAvailableTokens(), decision.getBucket().getSuppressedCount());
        }
        return decision;
    }

    /**
     * 覆盖某个 source 的速率, 已存在的桶按新参数重建
     */
    public void configureSource(String source, double tokensPerMinute, int burstSize) {
        overrides.put(source, BucketConfig.validated(source, tokensPerMinute, burstSize));
        buckets.remove(source);
    }

    public void configureDefault(double tokensPerMinute, int burstSize) {
        this.defaults = BucketConfig.validated("default", tokensPerMinute, burstSize);
    }

    public Optional<RateLimitBucket.Snapshot> getBucket(String source) {
        RateLimitBucket b = buckets.get(source);
        return b == null ? Optional.empty() : Optional.of(b.snapshot());
    }

    public List<RateLimitBucket.Snapshot> getBuckets() {
        List<RateLimitBucket.Snapshot> out = new ArrayList<>(buckets.size());
        buckets.values().forEach(b -> out.add(b.snapshot()));
        return out;
    }

    /**
     * 回收空闲桶, 返回回收数量
     */
    public int evictIdle(Instant now) {
        Instant threshold = now.minus(idleEviction);
        int removed = 0;
        for (Map.Entry<String, RateLimitBucket> e : buckets.entrySet()) {
            if (e.getValue().isIdleSince(threshold) && buckets.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("[Rate-Limit] evicted {} idle buckets", removed);
        }
        return removed;
    }

    public void reset() {
        buckets.clear();
    }

    private RateLimitBucket newBucket(String source, Instant now) {
        BucketConfig c = overrides.getOrDefault(source, defaults);
        return new RateLimitBucket(source, c.tokensPerMinute, c.burstSize, now);
    }

    private static final class BucketConfig {
        private final double tokensPerMinute;
        private final int burstSize;

        private BucketConfig(double tokensPerMinute, int burstSize) {
            this.tokensPerMinute = tokensPerMinute;
            this.burstSize = burstSize;
        }

        static BucketConfig validated(String key, double tokensPerMinute, int burstSize) {
            AlertConfigurationException.check(tokensPerMinute >= 0 && !Double.isNaN(tokensPerMinute),
                    "rate limit [" + key + "] tokensPerMinute must be >= 0");
            AlertConfigurationException.check(burstSize >= 1, "rate limit [" + key + "] burstSize must be >= 1");
            return new BucketConfig(tokensPerMinute, burstSize);
        }
    }
}
