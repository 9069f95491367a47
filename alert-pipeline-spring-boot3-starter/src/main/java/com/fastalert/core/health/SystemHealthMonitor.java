package com.fastalert.core.health;

import com.fastalert.config.AlertPipelineProperties;
import com.fastalert.core.channel.ChannelHealthInfo;
import com.fastalert.model.enums.HealthStatus;
import com.fastalert.model.stat.AlertStatistics;
import com.fastalert.model.stat.AlertSystemHealthReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 系统级健康与应急模式
 * 连续 N 条告警无任何渠道成功时自动进入应急模式, 任意一次成功清零; 退出应急模式只能手动
 */
public class SystemHealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(SystemHealthMonitor.class);

    private final AlertPipelineProperties props;

    private final Clock clock;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    private final Object modeLock = new Object();

    private volatile boolean emergencyMode;

    private volatile String emergencyReason;

    private volatile Instant emergencySince;

    public SystemHealthMonitor(AlertPipelineProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    /**
     * 记录一次管道级投递结果
     *
     * @return 本次调用是否触发了应急模式
     */
    public boolean recordPipelineResult(boolean anySuccess) {
        if (anySuccess) {
            consecutiveFailures.set(0);
            return false;
        }
        int n = consecutiveFailures.incrementAndGet();
        int threshold = props.getEmergency().getFailureThreshold();
        if (threshold > 0 && n >= threshold && !emergencyMode) {
            return enableEmergencyMode(n + " consecutive pipeline failures");
        }
        return false;
    }

    /**
     * @return 是否由关闭切换为开启
     */
    public boolean enableEmergencyMode(String reason) {
        synchronized (modeLock) {
            if (emergencyMode) {
                return false;
            }
            emergencyReason = reason;
            emergencySince = clock.instant();
            emergencyMode = true;
        }
        log.error("[Alert-Pipeline] EMERGENCY MODE ON, reason={}", reason);
        return true;
    }

    public boolean disableEmergencyMode() {
        synchronized (modeLock) {
            if (!emergencyMode) {
                return false;
            }
            emergencyMode = false;
            emergencyReason = null;
            emergencySince = null;
        }
        consecutiveFailures.set(0);
        log.warn("[Alert-Pipeline] emergency mode off");
        return true;
    }

    public boolean isEmergencyMode() {
        return emergencyMode;
    }

    public String getEmergencyReason() {
        return emergencyReason;
    }

    public Instant getEmergencySince() {
        return emergencySince;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    /**
     * 健康分 = 100 - 40*失败率 - 20*错误率 - 延迟扣分(<=20) - 资源扣分(<=10) - 应急扣分(10), 截断到 [0,100]
     */
    public AlertSystemHealthReport buildReport(AlertStatistics stats, List<ChannelHealthInfo> channels, double resourceUsage) {
        double failureRate = stats.getFailureRate();
        double errorRate = stats.getErrorRate();
        Duration avg = stats.getAverageProcessingTime() == null ? Duration.ZERO : stats.getAverageProcessingTime();
        double usage = Math.max(0d, Math.min(1d, resourceUsage));
        boolean emergency = emergencyMode;

        double score = 100d
                - 40d * failureRate
                - 20d * errorRate
                - latencyPenalty(avg)
                - 10d * usage
                - (emergency ? 10d : 0d);
        score = Math.max(0d, Math.min(100d, score));

        List<String> issues = new ArrayList<>();
        if (failureRate > 0.1) {
            issues.add(String.format("delivery failure rate %.1f%%", failureRate * 100));
        }
        if (errorRate > 0.05) {
            issues.add(String.format("evaluation error rate %.1f%%", errorRate * 100));
        }
        if (avg.compareTo(props.getHealth().getLatencyBudget()) > 0) {
            issues.add("average processing time " + avg.toMillis() + "ms exceeds budget "
                    + props.getHealth().getLatencyBudget().toMillis() + "ms");
        }
        if (usage > 0.8) {
            issues.add(String.format("delivery concurrency at %.0f%%", usage * 100));
        }
        if (emergency) {
            issues.add("emergency mode active: " + emergencyReason);
        }
        for (ChannelHealthInfo ch : channels) {
            if (!ch.isHealthy()) {
                issues.add("channel " + ch.getChannel() + " unhealthy, circuit=" + ch.getCircuitState());
            }
        }

        return AlertSystemHealthReport.builder()
                .score(score)
                .status(HealthStatus.fromScore(score))
                .failureRate(failureRate)
                .errorRate(errorRate)
                .averageProcessingTime(avg)
                .resourceUsage(usage)
                .emergencyMode(emergency)
                .emergencyReason(emergency ? emergencyReason : null)
                .channels(List.copyOf(channels))
                .issues(List.copyOf(issues))
                .generatedAt(clock.instant())
                .build();
    }

    private double latencyPenalty(Duration avg) {
        long budget = props.getHealth().getLatencyBudget().toNanos();
        if (budget <= 0 || avg.toNanos() <= budget) {
            return 0d;
        }
        return Math.min(20d, 20d * ((double) avg.toNanos() / budget - 1d));
    }
}
