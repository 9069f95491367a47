package com.fastalert.core;

import com.fastalert.config.AlertGuardProperties;
import com.fastalert.config.AlertPipelineProperties;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public class AlertPipelineLifecycle implements SmartLifecycle {

    Logger log = LoggerFactory.getLogger(AlertPipelineLifecycle.class);

    private final AlertPipeline pipeline;

    private final AlertPipelineProperties props;

    private final AlertGuardProperties guardProps;

    /** 为 false 时不启动后台任务, 维护与探测由调用方自行触发 */
    private final boolean sweepsEnabled;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile ScheduledExecutorService scheduler;

    public AlertPipelineLifecycle(AlertPipeline pipeline, AlertPipelineProperties props,
                                  AlertGuardProperties guardProps, boolean sweepsEnabled) {
        this.pipeline = pipeline;
        this.props = props;
        this.guardProps = guardProps;
        this.sweepsEnabled = sweepsEnabled;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            log.info("┌────────────────────────────────────────────────────────────┐");
            log.info("│ AlertPipeline starting...                                  │");
            log.info("├────────────────────────────────────────────────────────────┤");
            log.info("│ enabled               : {}", props.isEnabled());
            log.info("│ minimumSeverity       : {}", props.getMinimumSeverity());
            log.info("│ duplicate.window      : {} ms", props.getDuplicate().getWindow().toMillis());
            log.info("│ rateLimit             : {} /min, burst {}", props.getRateLimit().getTokensPerMinute(),
                    props.getRateLimit().getBurstSize());
            log.info("│ delivery.timeout      : {} ms", props.getDelivery().getDefaultTimeout().toMillis());
            log.info("│ delivery.maxRetries   : {}", props.getDelivery().getDefaultMaxRetries());
            log.info("│ delivery.exec.core    : {}", props.getDelivery().getExecutor().getCorePoolSize());
            log.info("│ delivery.exec.max     : {}", props.getDelivery().getExecutor().getMaxPoolSize());
            log.info("│ backoff.strategy      : {}", props.getBackoff().getStrategy());
            log.info("│ cb.failureThreshold   : {}", guardProps.getCircuitBreaker().getFailureThreshold());
            log.info("│ cb.openDuration       : {} ms", guardProps.getCircuitBreaker().getWaitDurationInOpenState().toMillis());
            log.info("│ bulkhead.maxCalls     : {}", guardProps.getBulkhead().getMaxConcurrentCalls());
            log.info("│ emergency.threshold   : {}", props.getEmergency().getFailureThreshold());
            log.info("│ sweeps.enabled        : {}", sweepsEnabled);
            log.info("└────────────────────────────────────────────────────────────┘");
        } catch (Throwable t) {
            log.warn("[Alert-Pipeline] failed to render startup banner: {}", t.toString());
        }
        if (!sweepsEnabled) {
            log.info("[Alert-Pipeline] started without background sweeps");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("alert-sweep-scheduler"));
        long maintenance = Math.max(1, props.getHealth().getMaintenanceInterval().toMillis());
        long check = Math.max(1, props.getHealth().getCheckInterval().toMillis());
        scheduler.scheduleWithFixedDelay(() -> sweep("maintenance", pipeline::performMaintenance),
                maintenance, maintenance, TimeUnit.MILLISECONDS);
        scheduler.scheduleWithFixedDelay(() -> sweep("health-check", pipeline::runHealthChecks),
                check, check, TimeUnit.MILLISECONDS);
        log.info("[Alert-Pipeline] started: maintenance every {} ms, health check every {} ms", maintenance, check);
    }

    private void sweep(String name, Runnable task) {
        // 异常不能逃逸, 否则后续周期被取消
        try {
            task.run();
        } catch (Throwable t) {
            log.error("[Alert-Pipeline] {} sweep failed", name, t);
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[Alert-Pipeline] stop skipped: already stopped");
            return;
        }
        log.info("[Alert-Pipeline] stopping...");
        try {
            ScheduledExecutorService s = scheduler;
            if (s != null) {
                s.shutdownNow();
            }
            pipeline.shutdown(props.getShutdown().getAwait());
        } finally {
            log.info("[Alert-Pipeline] stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override public boolean isAutoStartup() { return true; }

    public boolean isSweepsEnabled() { return sweepsEnabled; }
}
