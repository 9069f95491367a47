package com.fastalert.core.backoff;

import com.fastalert.config.AlertPipelineProperties;
import com.fastalert.core.spi.BackoffPolicy;

import java.util.concurrent.ThreadLocalRandom;

public class ExponentialJitterBackoffPolicy implements BackoffPolicy {
    @Override
    public String name() {
        return "exponential";
    }

    @Override
    public long delayMillis(int attempt, String channel, AlertPipelineProperties props) {
        long base = props.backoffBaseMillis(), min = props.backoffMinMillis(), max = props.backoffMaxMillis();
        double jr = props.getBackoff().getJitterRatio();

        // 第1次重试 -> base, 第2次 -> base * 2 ...
        double pow = Math.pow(2.0, Math.max(0, attempt - 1));
        long ideal = (long) Math.min((double) Long.MAX_VALUE, base * pow);

        long jittered = ideal;
        if (jr > 0) {
            long jitter = Math.round(ThreadLocalRandom.current().nextDouble(-jr, jr) * ideal);
            jittered = ideal + jitter;
        }
        return Math.max(0, Math.max(min, Math.min(jittered, max)));
    }
}
