package com.fastalert.model.stat;

import com.fastalert.core.channel.ChannelHealthInfo;
import com.fastalert.model.enums.HealthStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 系统健康报告, score 取值 0~100
 */
@Getter
@Builder
@ToString
public class AlertSystemHealthReport {

    private final double score;
    private final HealthStatus status;
    private final double failureRate;
    private final double errorRate;
    private final Duration averageProcessingTime;
    private final double resourceUsage;
    private final boolean emergencyMode;
    private final String emergencyReason;
    private final List<ChannelHealthInfo> channels;
    private final List<String> issues;
    private final Instant generatedAt;
}
