package com.fastalert.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

public final class AlertMetrics {
    private final MeterRegistry reg;
    private final Counter raised;
    private final Counter delivered;
    private final Counter deliveryFailed;
    private final Counter undeliverable;
    private final Counter deferred;
    private final Counter emergency;
    private final Counter evalErr;
    private final DistributionSummary retries;
    private final Timer processTimer;
    private final Timer deliveryTimer;

    private AlertMetrics(MeterRegistry reg) {
        this.reg = reg;
        this.raised = Counter.builder("alert.raised").description("alerts raised").register(reg);
        this.delivered = Counter.builder("alert.delivered").description("alerts delivered to at least one channel").register(reg);
        this.deliveryFailed = Counter.builder("alert.delivery.failed").description("alerts failed on every channel").register(reg);
        this.undeliverable = Counter.builder("alert.undeliverable").description("alerts without eligible channel").register(reg);
        this.deferred = Counter.builder("alert.deferred").description("alerts deferred by filters").register(reg);
        this.emergency = Counter.builder("alert.emergency.activated").description("emergency mode activations").register(reg);
        this.evalErr = Counter.builder("alert.evaluation.error").description("pipeline stage errors").register(reg);
        this.retries = DistributionSummary.builder("alert.delivery.retries")
                .description("retries per channel delivery").baseUnit("times").register(reg);
        this.processTimer = Timer.builder("alert.process.time").description("raise to disposition").register(reg);
        this.deliveryTimer = Timer.builder("alert.delivery.time").description("fan-out wall time").register(reg);
    }

    public static AlertMetrics create(MeterRegistry reg) { return new AlertMetrics(reg); }

    public void incRaised() { raised.increment(); }
    public void incDelivered() { delivered.increment(); }
    public void incDeliveryFailed() { deliveryFailed.increment(); }
    public void incUndeliverable() { undeliverable.increment(); }
    public void incDeferred() { deferred.increment(); }
    public void incEmergency() { emergency.increment(); }
    public void incEvaluationError() { evalErr.increment(); }
    public void incSuppressed(String reason) {
        Counter.builder("alert.suppressed").description("alerts suppressed").tag("reason", reason).register(reg).increment();
    }
    public void recordChannel(String channel, boolean success) {
        Counter.builder("alert.channel.delivery").description("channel deliveries")
                .tag("channel", channel).tag("result", success ? "success" : "failure").register(reg).increment();
    }
    public void incChannelSkipped(String channel) {
        Counter.builder("alert.channel.skipped").description("channel skipped by open circuit")
                .tag("channel", channel).register(reg).increment();
    }
    public void incEventDispatched(String type) {
        Counter.builder("alert.event.dispatched").description("lifecycle events handed to listeners")
                .tag("type", type).register(reg).increment();
    }
    public void incEventFailed(String listener) {
        Counter.builder("alert.event.failed").description("lifecycle event listener failures")
                .tag("listener", listener).register(reg).increment();
    }
    public void recordRetries(int n) { retries.record(n); }
    public void recordProcessNanos(long nanos) { processTimer.record(nanos, TimeUnit.NANOSECONDS); }
    public void recordDeliveryNanos(long nanos) { deliveryTimer.record(nanos, TimeUnit.NANOSECONDS); }

    public MeterRegistry getRegistry() { return reg; }
}
