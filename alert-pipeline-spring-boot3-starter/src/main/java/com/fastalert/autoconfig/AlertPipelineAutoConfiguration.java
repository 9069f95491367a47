package com.fastalert.autoconfig;

import com.fastalert.annotation.EnableAlertPipeline;
import com.fastalert.config.AlertGuardProperties;
import com.fastalert.config.AlertPipelineProperties;
import com.fastalert.core.AlertPipeline;
import com.fastalert.core.AlertPipelineLifecycle;
import com.fastalert.core.backoff.BackoffRegistry;
import com.fastalert.core.channel.ChannelHealthMonitor;
import com.fastalert.core.channel.ChannelRegistry;
import com.fastalert.core.channel.impl.LoggingAlertChannel;
import com.fastalert.core.delivery.DeliveryOrchestrator;
import com.fastalert.core.event.AlertEventPublisher;
import com.fastalert.core.filter.FilterChain;
import com.fastalert.core.handler.GuardedChannelExecutor;
import com.fastalert.core.health.SystemHealthMonitor;
import com.fastalert.core.metric.AlertMetrics;
import com.fastalert.core.ratelimit.TokenBucketRateLimiter;
import com.fastalert.core.rule.AlertRule;
import com.fastalert.core.rule.RuleEngine;
import com.fastalert.core.spi.BackoffPolicy;
import com.fastalert.core.spi.channel.AlertChannel;
import com.fastalert.core.spi.event.AlertEventListener;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.core.spi.filter.AlertFilter;
import com.fastalert.core.spi.suppress.EscalationPolicy;
import com.fastalert.core.suppress.DuplicateSuppressor;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 告警管道及其组件
 */
@AutoConfiguration(after = {
        AlertGuardAutoConfiguration.class,
        AlertMetricsAutoConfiguration.class,
        FailureDeciderAutoConfiguration.class
})
@EnableConfigurationProperties({
        AlertPipelineProperties.class
})
public class AlertPipelineAutoConfiguration {

    /**
     * 时间轮, 负责投递超时与退避重试
     */
    @Bean
    public HashedWheelTimer alertWheelTimer(AlertPipelineProperties props) {
        return new HashedWheelTimer(
                new NamedThreadFactory("alert-wheel-timer"),
                props.getWheel().getTickDuration().toMillis(),
                TimeUnit.MILLISECONDS,
                props.getWheel().getTicksPerWheel(),
                false,
                props.getWheel().getMaxPendingTimeouts()
        );
    }

    /**
     * 投递线程池
     */
    @Bean("alertDeliveryExecutor")
    public ExecutorService alertDeliveryExecutor(AlertPipelineProperties props) {
        AlertPipelineProperties.Exec exec = props.getDelivery().getExecutor();
        return new ThreadPoolExecutor(
                exec.getCorePoolSize(),
                exec.getMaxPoolSize(),
                exec.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new LinkedBlockingDeque<>(exec.getQueueCapacity()),
                new NamedThreadFactory("alert-delivery-exec"),
                exec.getRejectedHandler().toHandler()
        );
    }

    /**
     * 默认渠道 log
     */
    @Bean
    @ConditionalOnMissingBean(LoggingAlertChannel.class)
    public LoggingAlertChannel loggingAlertChannel() {
        return new LoggingAlertChannel();
    }

    @Bean
    @ConditionalOnMissingBean
    public ChannelRegistry channelRegistry(@Autowired(required = false) List<AlertChannel> channels) {
        return new ChannelRegistry(channels == null ? List.of() : channels);
    }

    /**
     * 策略注册中心
     */
    @Bean
    public BackoffRegistry alertBackoffRegistry(AlertPipelineProperties props,
                                                @Autowired(required = false) List<BackoffPolicy> discoveredPolicies) {
        return new BackoffRegistry(props, discoveredPolicies);
    }

    @Bean
    @ConditionalOnMissingBean
    public DuplicateSuppressor duplicateSuppressor(AlertPipelineProperties props,
                                                   @Autowired(required = false) EscalationPolicy escalationPolicy) {
        return new DuplicateSuppressor(props.getDuplicate().getWindow(), escalationPolicy);
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenBucketRateLimiter tokenBucketRateLimiter(AlertPipelineProperties props) {
        return new TokenBucketRateLimiter(props.getRateLimit());
    }

    @Bean
    @ConditionalOnMissingBean
    public FilterChain filterChain(AlertPipelineProperties props,
                                   @Autowired(required = false) List<AlertFilter> filters) {
        FilterChain chain = new FilterChain(props.getFilter().isCollectAllResults());
        if (filters != null) {
            filters.forEach(chain::register);
        }
        return chain;
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleEngine ruleEngine(@Autowired(required = false) List<AlertRule> rules) {
        RuleEngine engine = new RuleEngine();
        if (rules != null) {
            rules.forEach(engine::addRule);
        }
        return engine;
    }

    @Bean
    @ConditionalOnMissingBean
    public SystemHealthMonitor systemHealthMonitor(AlertPipelineProperties props,
                                                   @Autowired(required = false) Clock clock) {
        return new SystemHealthMonitor(props, clock == null ? Clock.systemUTC() : clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeliveryOrchestrator deliveryOrchestrator(ChannelRegistry registry,
                                                     ChannelHealthMonitor monitor,
                                                     GuardedChannelExecutor guard,
                                                     @Qualifier("alertBackoffRegistry") BackoffRegistry backoff,
                                                     FailureDecider failureDecider,
                                                     AlertPipelineProperties props,
                                                     @Qualifier("alertDeliveryExecutor") ExecutorService executor,
                                                     @Qualifier("alertWheelTimer") HashedWheelTimer timer,
                                                     AlertMetrics metrics,
                                                     @Autowired(required = false) Clock clock) {
        return new DeliveryOrchestrator(registry, monitor, guard, backoff, failureDecider, props,
                executor, timer, metrics, clock == null ? Clock.systemUTC() : clock);
    }

    /**
     * 生命周期事件派发, 收集容器内全部 AlertEventListener
     */
    @Bean
    @ConditionalOnMissingBean
    public AlertEventPublisher alertEventPublisher(AlertPipelineProperties props,
                                                   AlertMetrics metrics,
                                                   @Autowired(required = false) List<AlertEventListener> listeners) {
        return AlertEventPublisher.create(props.getEvents(), listeners == null ? List.of() : listeners, metrics);
    }

    /**
     * 告警管道
     */
    @Bean
    @ConditionalOnMissingBean
    public AlertPipeline alertPipeline(AlertPipelineProperties props,
                                       ChannelRegistry registry,
                                       ChannelHealthMonitor monitor,
                                       DeliveryOrchestrator orchestrator,
                                       DuplicateSuppressor duplicates,
                                       TokenBucketRateLimiter rateLimiter,
                                       FilterChain filterChain,
                                       RuleEngine ruleEngine,
                                       SystemHealthMonitor systemHealth,
                                       AlertMetrics metrics,
                                       AlertEventPublisher events,
                                       @Qualifier("alertDeliveryExecutor") ExecutorService executor,
                                       @Qualifier("alertWheelTimer") HashedWheelTimer timer,
                                       @Autowired(required = false) Clock clock) {
        props.validate();
        return new AlertPipeline(props, clock == null ? Clock.systemUTC() : clock, registry, monitor, orchestrator,
                duplicates, rateLimiter, filterChain, ruleEngine, systemHealth, metrics, events, executor, timer);
    }

    /**
     * 管道生命周期, 启动横幅与后台维护任务
     */
    @Bean
    public AlertPipelineLifecycle alertPipelineLifecycle(AlertPipeline pipeline,
                                                         AlertPipelineProperties props,
                                                         AlertGuardProperties guardProps,
                                                         ApplicationContext applicationContext) {
        EnableAlertPipeline enableAlertPipeline = findEnableAlertPipeline(applicationContext);
        boolean sweeps = enableAlertPipeline == null || enableAlertPipeline.value();
        return new AlertPipelineLifecycle(pipeline, props, guardProps, sweeps);
    }

    private EnableAlertPipeline findEnableAlertPipeline(ListableBeanFactory factory) {
        String[] names = factory.getBeanDefinitionNames();
        for (String n : names) {
            Class<?> type = factory.getType(n);
            if (type == null) continue;
            EnableAlertPipeline an = type.getAnnotation(EnableAlertPipeline.class);
            if (an != null) return an;
        }
        return null;
    }
}
