package com.fastalert.autoconfig;

import com.fastalert.annotation.EnableAlertPipeline;
import com.fastalert.config.AlertGuardProperties;
import com.fastalert.config.AlertPipelineProperties;
import com.fastalert.core.AlertPipeline;
import com.fastalert.core.AlertPipelineLifecycle;
import com.fastalert.core.channel.ChannelRegistry;
import com.fastalert.core.channel.impl.InMemoryAlertChannel;
import com.fastalert.core.channel.impl.LoggingAlertChannel;
import com.fastalert.core.event.AlertEventPublisher;
import com.fastalert.core.filter.builtin.SeverityAlertFilter;
import com.fastalert.core.rule.AlertRule;
import com.fastalert.core.rule.RuleType;
import com.fastalert.core.spi.event.AlertEventListener;
import com.fastalert.model.Alert;
import com.fastalert.model.AlertOutcome;
import com.fastalert.model.enums.AlertDisposition;
import com.fastalert.model.enums.AlertEventType;
import com.fastalert.model.enums.AlertSeverity;
import com.fastalert.model.enums.SuppressionReason;
import com.fastalert.model.event.AlertEvent;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class AlertPipelineAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    AlertGuardAutoConfiguration.class,
                    AlertMetricsAutoConfiguration.class,
                    FailureDeciderAutoConfiguration.class,
                    AlertPipelineAutoConfiguration.class));

    @Test
    void defaultContextDeliversToLoggingChannel() {
        runner.run(ctx -> {
            assertThat(ctx).hasNotFailed();
            assertThat(ctx).hasSingleBean(AlertPipeline.class);
            assertThat(ctx).hasSingleBean(AlertPipelineLifecycle.class);
            assertThat(ctx.getBean(ChannelRegistry.class).contains(LoggingAlertChannel.NAME)).isTrue();
            assertThat(ctx.getBean(AlertPipelineLifecycle.class).isSweepsEnabled()).isTrue();

            AlertPipeline pipeline = ctx.getBean(AlertPipeline.class);
            AlertOutcome o = pipeline.process(Alert.builder()
                    .message("boot ok").severity(AlertSeverity.HIGH).source("app").build());
            assertThat(o.getDisposition()).isEqualTo(AlertDisposition.DELIVERED);
        });
    }

    @Test
    void propertiesAreBound() {
        runner.withPropertyValues(
                "alert.minimum-severity=HIGH",
                "alert.duplicate.window=2m",
                "alert.channels.sms.max-retries=1",
                "alert.guard.circuit-breaker.failure-threshold=5",
                "alert.guard.cb-per-channel.webhook.wait-duration-in-open-state=1m",
                "alert.active.max-size=500",
                "alert.active.max-age=2h",
                "alert.events.pool-size=4"
        ).run(ctx -> {
            AlertPipelineProperties props = ctx.getBean(AlertPipelineProperties.class);
            assertThat(props.getMinimumSeverity()).isEqualTo(AlertSeverity.HIGH);
            assertThat(props.getDuplicate().getWindow()).isEqualTo(Duration.ofMinutes(2));
            assertThat(props.getChannels().get("sms").getMaxRetries()).isEqualTo(1);
            assertThat(props.getActive().getMaxSize()).isEqualTo(500);
            assertThat(props.getActive().getMaxAge()).isEqualTo(Duration.ofHours(2));
            assertThat(props.getEvents().getPoolSize()).isEqualTo(4);

            AlertGuardProperties guard = ctx.getBean(AlertGuardProperties.class);
            assertThat(guard.getCircuitBreaker().getFailureThreshold()).isEqualTo(5);
            assertThat(guard.getCbPerChannel().get("webhook").getWaitDurationInOpenState())
                    .isEqualTo(Duration.ofMinutes(1));

            AlertPipeline pipeline = ctx.getBean(AlertPipeline.class);
            AlertOutcome o = pipeline.process(Alert.builder()
                    .message("minor").severity(AlertSeverity.MEDIUM).source("app").build());
            assertThat(o.getSuppressionReason()).isEqualTo(SuppressionReason.SEVERITY);
        });
    }

    @Test
    void userComponentsAreRegistered() {
        runner.withUserConfiguration(UserComponents.class).run(ctx -> {
            ChannelRegistry registry = ctx.getBean(ChannelRegistry.class);
            assertThat(registry.contains("mem")).isTrue();
            assertThat(registry.contains(LoggingAlertChannel.NAME)).isTrue();

            AlertPipeline pipeline = ctx.getBean(AlertPipeline.class);
            assertThat(pipeline.getFilterChain().getFilterNames()).contains("min-medium");
            assertThat(pipeline.getRuleEngine().getRules()).extracting(AlertRule::getId).contains("mute-canary");

            AlertOutcome muted = pipeline.process(Alert.builder()
                    .message("canary flap").severity(AlertSeverity.HIGH).source("canary-1").build());
            assertThat(muted.getSuppressionReason()).isEqualTo(SuppressionReason.RULE);

            AlertOutcome delivered = pipeline.process(Alert.builder()
                    .message("db down").severity(AlertSeverity.CRITICAL).source("db").build());
            assertThat(delivered.isDelivered()).isTrue();
            assertThat(ctx.getBean("memChannel", InMemoryAlertChannel.class).getReceived()).isEqualTo(1);
        });
    }

    @Test
    void eventListenerBeansReceiveLifecycleEvents() {
        runner.withUserConfiguration(AuditListener.class)
                .withPropertyValues("alert.events.async=false")
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(AlertEventPublisher.class);
                    assertThat(ctx.getBean(AlertEventPublisher.class).getListeners())
                            .extracting(AlertEventListener::name).containsExactly("audit");

                    AlertPipeline pipeline = ctx.getBean(AlertPipeline.class);
                    UUID id = pipeline.process(Alert.builder()
                            .message("disk full").severity(AlertSeverity.HIGH).source("node-1").build()).getAlert().getId();
                    pipeline.acknowledge(id, "alice");
                    pipeline.resolve(id, "alice");

                    List<AlertEvent> seen = ctx.getBean(AuditListener.class).seen;
                    assertThat(seen).extracting(AlertEvent::getType).containsExactly(
                            AlertEventType.RAISED, AlertEventType.ACKNOWLEDGED, AlertEventType.RESOLVED);
                });
    }

    @Test
    void annotationCanTurnOffBackgroundSweeps() {
        runner.withUserConfiguration(NoSweeps.class).run(ctx ->
                assertThat(ctx.getBean(AlertPipelineLifecycle.class).isSweepsEnabled()).isFalse());
    }

    @Test
    void invalidConfigurationFailsStartup() {
        runner.withPropertyValues("alert.history.max-size=0")
                .run(ctx -> assertThat(ctx).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    static class UserComponents {

        @Bean
        InMemoryAlertChannel memChannel() {
            return new InMemoryAlertChannel("mem", 16);
        }

        @Bean
        SeverityAlertFilter minMediumFilter() {
            return new SeverityAlertFilter("min-medium", AlertSeverity.MEDIUM, 10);
        }

        @Bean
        AlertRule muteCanaryRule() {
            return AlertRule.builder("mute-canary", RuleType.SUPPRESSION).id("mute-canary").source("canary-*").build();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class AuditListener implements AlertEventListener {

        final List<AlertEvent> seen = new CopyOnWriteArrayList<>();

        @Override
        public String name() {
            return "audit";
        }

        @Override
        public void onEvent(AlertEvent event) {
            seen.add(event);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @EnableAlertPipeline(false)
    static class NoSweeps {
    }
}
