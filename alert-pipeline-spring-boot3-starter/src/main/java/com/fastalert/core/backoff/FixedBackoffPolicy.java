package com.fastalert.core.backoff;

import com.fastalert.config.AlertPipelineProperties;
import com.fastalert.core.spi.BackoffPolicy;

import java.util.concurrent.ThreadLocalRandom;

/**
 * 固定间隔策略（可选小幅抖动）
 */
public class FixedBackoffPolicy implements BackoffPolicy {
    @Override
    public String name() {
        return "fixed";
    }

    @Override
    public long delayMillis(int attempt, String channel, AlertPipelineProperties props) {
        long base = props.backoffBaseMillis(), min = props.backoffMinMillis(), max = props.backoffMaxMillis();
        double jr = props.getBackoff().getJitterRatio();

        long delay = base;
        if (jr > 0) {
            delay += Math.round(ThreadLocalRandom.current().nextDouble(-jr, jr) * delay);
        }
        return Math.max(0, Math.max(min, Math.min(delay, max)));
    }
}
