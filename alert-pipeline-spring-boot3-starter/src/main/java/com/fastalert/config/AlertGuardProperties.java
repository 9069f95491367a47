package com.fastalert.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * alert:
 *   guard:
 *     circuit-breaker:
 *       enabled: true
 *       failure-threshold: 3
 *       wait-duration-in-open-state: 30s
 *     bulkhead:
 *       max-concurrent-calls: 64
 *       max-wait-duration: 500ms
 *     rate-limiter:
 *       enabled: false
 *       limit-for-period: 50
 *       limit-refresh-period: 1s
 *       timeout-duration: 0ms
 *     cb-per-channel:
 *       webhook: { failure-threshold: 5, wait-duration-in-open-state: 1m }
 *     rl-per-channel:
 *       sms: { enabled: true, limit-for-period: 10, limit-refresh-period: 1m }
 */
@Data
@ConfigurationProperties(prefix = "alert.guard")
public class AlertGuardProperties {

    /** 默认配置（可被渠道名覆盖） */
    private CbConfig circuitBreaker = new CbConfig();
    private BhConfig bulkhead = new BhConfig();
    private RlConfig rateLimiter = new RlConfig();

    /** 按渠道覆盖 */
    private Map<String, CbConfig> cbPerChannel = new LinkedHashMap<>();
    private Map<String, RlConfig> rlPerChannel = new LinkedHashMap<>();

    @Data
    public static class CbConfig {
        private boolean enabled = true;
        // 连续失败次数达到该值即熔断
        private int failureThreshold = 3;
        // 熔断后进入半开前的冷却时间
        private Duration waitDurationInOpenState = Duration.ofSeconds(30);
    }

    /**
     * 全渠道共享, 即系统级最大在途投递数
     */
    @Data
    public static class BhConfig {
        private boolean enabled = true;
        private int maxConcurrentCalls = 64;
        // 0=非阻塞
        private Duration maxWaitDuration = Duration.ofMillis(500);
    }

    @Data
    public static class RlConfig {
        private boolean enabled = false;
        // 每个窗口许可数
        private int limitForPeriod = 50;
        private Duration limitRefreshPeriod = Duration.ofSeconds(1);
        // 获取许可最大等待
        private Duration timeoutDuration = Duration.ZERO;
    }

    public CbConfig circuitBreakerFor(String channel) {
        CbConfig c = cbPerChannel == null ? null : cbPerChannel.get(channel);
        return c == null ? circuitBreaker : c;
    }

    public RlConfig rateLimiterFor(String channel) {
        RlConfig r = rlPerChannel == null ? null : rlPerChannel.get(channel);
        return r == null ? rateLimiter : r;
    }
}
