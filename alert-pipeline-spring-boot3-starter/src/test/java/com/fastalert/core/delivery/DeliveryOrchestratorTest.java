package com.fastalert.core.delivery;

import com.fastalert.config.AlertGuardProperties;
import com.fastalert.config.AlertPipelineProperties;
import com.fastalert.core.backoff.BackoffRegistry;
import com.fastalert.core.channel.ChannelHealthMonitor;
import com.fastalert.core.channel.ChannelRegistry;
import com.fastalert.core.channel.ChannelSendResult;
import com.fastalert.core.channel.CircuitBreakerState;
import com.fastalert.core.failure.RouterFailureDecider;
import com.fastalert.core.handler.GuardedChannelExecutor;
import com.fastalert.core.metric.AlertMetrics;
import com.fastalert.core.spi.channel.AlertChannel;
import com.fastalert.core.support.MutableClock;
import com.fastalert.exception.guard.ChannelPermanentFailureException;
import com.fastalert.model.Alert;
import com.fastalert.model.enums.AlertSeverity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.netty.util.HashedWheelTimer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class DeliveryOrchestratorTest {

    private AlertPipelineProperties props;
    private AlertGuardProperties guardProps;
    private ChannelRegistry registry;
    private MutableClock clock;
    private ChannelHealthMonitor monitor;
    private SimpleMeterRegistry meterRegistry;
    private ExecutorService executor;
    private HashedWheelTimer timer;
    private DeliveryOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        props = new AlertPipelineProperties();
        props.getDelivery().setDefaultTimeout(Duration.ofSeconds(2));
        props.getDelivery().setDefaultMaxRetries(2);
        props.getBackoff().setBase(Duration.ofMillis(10));
        props.getBackoff().setMin(Duration.ZERO);
        props.getBackoff().setMax(Duration.ofMillis(50));
        props.getBackoff().setJitterRatio(0);

        guardProps = new AlertGuardProperties();
        guardProps.getCircuitBreaker().setFailureThreshold(3);
        guardProps.getCircuitBreaker().setWaitDurationInOpenState(Duration.ofMinutes(5));

        registry = new ChannelRegistry();
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        monitor = new ChannelHealthMonitor(guardProps, clock);
        meterRegistry = new SimpleMeterRegistry();
        executor = Executors.newFixedThreadPool(8);
        timer = new HashedWheelTimer(5, TimeUnit.MILLISECONDS);
        orchestrator = new DeliveryOrchestrator(registry, monitor, new GuardedChannelExecutor(guardProps),
                new BackoffRegistry(props), RouterFailureDecider.withDefaults(null), props, executor, timer,
                AlertMetrics.create(meterRegistry), clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        timer.stop();
    }

    private static Alert alert() {
        return Alert.of("payment gateway down", AlertSeverity.CRITICAL, "payments");
    }

    private void overrideChannel(String name, Duration timeout, Integer maxRetries) {
        AlertPipelineProperties.Channel c = new AlertPipelineProperties.Channel();
        c.setTimeout(timeout);
        c.setMaxRetries(maxRetries);
        props.getChannels().put(name, c);
    }

    @Test
    void fanOutAggregatesPerChannelResults() {
        registry.register(ScriptedChannel.ok("mail"));
        registry.register(ScriptedChannel.failing("hook"));
        overrideChannel("hook", null, 0);

        AlertDeliveryResults r = orchestrator.deliver(alert(), null);

        assertThat(r.getTotalChannels()).isEqualTo(2);
        assertThat(r.getSuccessfulDeliveries()).isEqualTo(1);
        assertThat(r.getFailedDeliveries()).isEqualTo(1);
        assertThat(r.getSuccessfulDeliveries() + r.getFailedDeliveries()).isEqualTo(r.getTotalChannels());
        assertThat(r.isAnySuccessful()).isTrue();
        assertThat(r.isAllSuccessful()).isFalse();
        assertThat(r.isAllFailed()).isFalse();
        assertThat(r.getTotalTime()).isEqualTo(r.getChannelResults().stream()
                .map(ChannelDeliveryResult::getDuration).reduce(Duration.ZERO, Duration::plus));
        ChannelDeliveryResult hook = r.getChannelResults().stream()
                .filter(c -> c.getChannel().equals("hook")).findFirst().orElseThrow();
        assertThat(hook.getError()).contains("hook unavailable");
        assertThat(meterRegistry.get("alert.channel.delivery").tag("channel", "mail").tag("result", "success")
                .counter().count()).isEqualTo(1d);
    }

    @Test
    void transientFailuresAreRetriedUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();
        registry.register(new ScriptedChannel("hook", calls, n ->
                n < 3 ? ChannelSendResult.failure("503") : ChannelSendResult.success()));

        AlertDeliveryResults r = orchestrator.deliver(alert(), null);

        assertThat(r.isAllSuccessful()).isTrue();
        assertThat(r.getTotalRetries()).isEqualTo(2);
        assertThat(calls.get()).isEqualTo(3);
        assertThat(monitor.metrics("hook").snapshot().getAttempts()).isEqualTo(3);
        assertThat(monitor.metrics("hook").snapshot().getDeliveries()).isEqualTo(1);
    }

    @Test
    void retriesStopAtMaxRetries() {
        ScriptedChannel hook = ScriptedChannel.failing("hook");
        registry.register(hook);

        AlertDeliveryResults r = orchestrator.deliver(alert(), null);

        assertThat(r.isAllFailed()).isTrue();
        assertThat(r.getChannelResults().get(0).getRetryCount()).isEqualTo(2);
        assertThat(hook.calls.get()).isEqualTo(3);
    }

    @Test
    void permanentFailureIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        registry.register(new ScriptedChannel("sms", calls, n -> {
            throw new ChannelPermanentFailureException("invalid recipient");
        }));

        AlertDeliveryResults r = orchestrator.deliver(alert(), null);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(r.getChannelResults().get(0).getRetryCount()).isZero();
        assertThat(r.getChannelResults().get(0).getError()).isEqualTo("invalid recipient");
    }

    @Test
    void slowChannelTimesOut() {
        registry.register(new ScriptedChannel("slow", new AtomicInteger(), n -> {
            Thread.sleep(5_000);
            return ChannelSendResult.success();
        }));
        overrideChannel("slow", Duration.ofMillis(100), 0);

        AlertDeliveryResults r = orchestrator.deliver(alert(), null);

        ChannelDeliveryResult slow = r.getChannelResults().get(0);
        assertThat(slow.isSuccess()).isFalse();
        assertThat(slow.getError()).contains("timed out");
        assertThat(slow.getDuration()).isLessThan(Duration.ofSeconds(5));
        assertThat(monitor.metrics("slow").snapshot().getTimeouts()).isEqualTo(1);
    }

    @Test
    void breakerIsChargedOncePerDelivery() {
        registry.register(ScriptedChannel.failing("hook"));

        orchestrator.deliver(alert(), null);
        assertThat(monitor.getState("hook")).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(monitor.getHealth("hook").getConsecutiveFailures()).isEqualTo(1);

        orchestrator.deliver(alert(), null);
        orchestrator.deliver(alert(), null);
        assertThat(monitor.getState("hook")).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void openBreakerSkipsChannelWithoutCallingIt() {
        AlertGuardProperties.CbConfig strict = new AlertGuardProperties.CbConfig();
        strict.setFailureThreshold(1);
        strict.setWaitDurationInOpenState(Duration.ofMinutes(5));
        guardProps.getCbPerChannel().put("hook", strict);
        ScriptedChannel hook = ScriptedChannel.failing("hook");
        registry.register(hook);
        registry.register(ScriptedChannel.ok("mail"));
        overrideChannel("hook", null, 0);

        orchestrator.deliver(alert(), null);
        assertThat(monitor.getState("hook")).isEqualTo(CircuitBreakerState.OPEN);

        AlertDeliveryResults r = orchestrator.deliver(alert(), null);

        assertThat(hook.calls.get()).isEqualTo(1);
        assertThat(r.getSkippedChannels()).containsExactly("hook");
        assertThat(r.getChannelResults()).extracting(ChannelDeliveryResult::getChannel).containsExactly("mail");
        assertThat(r.hasNoEligibleChannels()).isFalse();
        assertThat(monitor.metrics("hook").snapshot().getSkipped()).isEqualTo(1);
    }

    private static ScriptedChannel switchable(String name, AtomicBoolean up) {
        return new ScriptedChannel(name, new AtomicInteger(), n ->
                up.get() ? ChannelSendResult.success() : ChannelSendResult.failure(name + " unavailable"));
    }

    private void openBreaker(ScriptedChannel channel) {
        for (int i = 0; i < 3; i++) {
            assertThat(orchestrator.deliver(alert(), null).isAllFailed()).isTrue();
        }
        assertThat(monitor.getState(channel.name())).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(channel.calls.get()).isEqualTo(9);
        clock.advance(Duration.ofMinutes(5).plusMillis(1));
    }

    @Test
    void halfOpenTrialSendsOnceAndClosesOnSuccess() {
        AtomicBoolean up = new AtomicBoolean(false);
        ScriptedChannel hook = switchable("hook", up);
        registry.register(hook);
        openBreaker(hook);
        up.set(true);

        AlertDeliveryResults r = orchestrator.deliver(alert(), null);

        assertThat(r.isAllSuccessful()).isTrue();
        assertThat(r.getChannelResults().get(0).getRetryCount()).isZero();
        assertThat(hook.calls.get()).isEqualTo(10);
        assertThat(monitor.getState("hook")).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void failedHalfOpenTrialIsNotRetriedAndReopens() {
        AtomicBoolean up = new AtomicBoolean(false);
        ScriptedChannel hook = switchable("hook", up);
        registry.register(hook);
        openBreaker(hook);

        AlertDeliveryResults r = orchestrator.deliver(alert(), null);

        assertThat(r.isAllFailed()).isTrue();
        assertThat(r.getChannelResults().get(0).getRetryCount()).isZero();
        assertThat(hook.calls.get()).isEqualTo(10);
        assertThat(monitor.getState("hook")).isEqualTo(CircuitBreakerState.OPEN);

        AlertDeliveryResults skipped = orchestrator.deliver(alert(), null);
        assertThat(skipped.getSkippedChannels()).containsExactly("hook");
        assertThat(hook.calls.get()).isEqualTo(10);
    }

    @Test
    void bulkheadCapsConcurrentSendsAcrossDeliveries() throws Exception {
        guardProps.getBulkhead().setMaxConcurrentCalls(2);
        guardProps.getBulkhead().setMaxWaitDuration(Duration.ofSeconds(5));
        GuardedChannelExecutor guard = new GuardedChannelExecutor(guardProps);
        orchestrator = new DeliveryOrchestrator(registry, monitor, guard,
                new BackoffRegistry(props), RouterFailureDecider.withDefaults(null), props, executor, timer,
                AlertMetrics.create(meterRegistry), clock);

        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        ScriptedChannel blocking = new ScriptedChannel("blocking", new AtomicInteger(), n -> {
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                release.await(5, TimeUnit.SECONDS);
            } finally {
                inFlight.decrementAndGet();
            }
            return ChannelSendResult.success();
        });
        registry.register(blocking);
        overrideChannel("blocking", Duration.ofSeconds(5), 0);

        List<CompletableFuture<AlertDeliveryResults>> futures = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            futures.add(orchestrator.deliverAsync(alert(), null));
        }

        await().atMost(Duration.ofSeconds(2)).until(() -> blocking.calls.get() == 2);
        // 两个许可占满后其余投递只能等待
        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1)).until(() -> blocking.calls.get() == 2);
        assertThat(guard.getInFlight()).isEqualTo(2);
        assertThat(guard.getCapacity()).isEqualTo(2);

        release.countDown();
        for (CompletableFuture<AlertDeliveryResults> f : futures) {
            assertThat(f.get(5, TimeUnit.SECONDS).isAllSuccessful()).isTrue();
        }

        assertThat(blocking.calls.get()).isEqualTo(6);
        assertThat(peak.get()).isEqualTo(2);
        assertThat(guard.getInFlight()).isZero();
    }

    @Test
    void noEligibleChannelsYieldsEmptyResults() {
        AlertDeliveryResults r = orchestrator.deliver(alert(), null);

        assertThat(r.getTotalChannels()).isZero();
        assertThat(r.hasNoEligibleChannels()).isTrue();
        assertThat(r.isAllSuccessful()).isFalse();
        assertThat(r.isAllFailed()).isFalse();
        assertThat(r.isAnySuccessful()).isFalse();
    }

    @Test
    void targetsRoutesAndSubscriptionsSelectChannels() {
        ScriptedChannel a = ScriptedChannel.ok("a");
        ScriptedChannel b = ScriptedChannel.ok("b");
        ScriptedChannel picky = new ScriptedChannel("picky", new AtomicInteger(), n -> ChannelSendResult.success()) {
            @Override
            public boolean supports(Alert alert) {
                return alert.getSeverity() == AlertSeverity.LOW;
            }
        };
        registry.register(a);
        registry.register(b);
        registry.register(picky);

        assertThat(orchestrator.deliver(alert(), List.of("b", "missing")).getChannelResults())
                .extracting(ChannelDeliveryResult::getChannel).containsExactly("b");

        Alert routed = alert().withRoute("a");
        assertThat(orchestrator.deliver(routed, null).getChannelResults())
                .extracting(ChannelDeliveryResult::getChannel).containsExactly("a");

        AlertPipelineProperties.Channel off = new AlertPipelineProperties.Channel();
        off.setEnabled(false);
        props.getChannels().put("b", off);
        assertThat(orchestrator.deliver(alert(), null).getChannelResults())
                .extracting(ChannelDeliveryResult::getChannel).containsExactly("a");
        assertThat(picky.calls.get()).isZero();
    }

    @Test
    void shutdownFailsPendingRetries() {
        props.getBackoff().setBase(Duration.ofSeconds(10));
        props.getBackoff().setMax(Duration.ofSeconds(20));
        registry.register(ScriptedChannel.failing("hook"));

        CompletableFuture<AlertDeliveryResults> future = orchestrator.deliverAsync(alert(), null);
        await().atMost(Duration.ofSeconds(2)).until(() -> orchestrator.getPendingRetries() == 1);

        assertThat(orchestrator.shutdown()).isEqualTo(1);

        AlertDeliveryResults r = future.join();
        assertThat(r.getChannelResults().get(0).isSuccess()).isFalse();
        assertThat(r.getChannelResults().get(0).getError()).isEqualTo("delivery shutting down");
        assertThat(orchestrator.isShuttingDown()).isTrue();
        assertThat(orchestrator.getPendingRetries()).isZero();
    }

    @FunctionalInterface
    interface Script {
        ChannelSendResult send(int call) throws Exception;
    }

    static class ScriptedChannel implements AlertChannel {
        private final String name;
        final AtomicInteger calls;
        private final Script script;

        ScriptedChannel(String name, AtomicInteger calls, Script script) {
            this.name = name;
            this.calls = calls;
            this.script = script;
        }

        static ScriptedChannel ok(String name) {
            return new ScriptedChannel(name, new AtomicInteger(), n -> ChannelSendResult.success());
        }

        static ScriptedChannel failing(String name) {
            return new ScriptedChannel(name, new AtomicInteger(), n -> ChannelSendResult.failure(name + " unavailable"));
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public ChannelSendResult send(Alert alert) throws Exception {
            return script.send(calls.incrementAndGet());
        }
    }
}
