package com.fastalert.autoconfig;

import com.fastalert.core.failure.RouterFailureDecider;
import com.fastalert.core.failure.decider.*;
import com.fastalert.core.spi.failure.FailureCaseHandler;
import com.fastalert.core.spi.failure.FailureDecider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.util.List;

@AutoConfiguration
public class FailureDeciderAutoConfiguration {

    // 默认内置一组决策器（用户可通过 Bean 覆盖/新增）
    @Bean
    @ConditionalOnMissingBean(TimeoutHandler.class)
    public TimeoutHandler timeoutHandler() { return new TimeoutHandler(); }

    @Bean
    @ConditionalOnMissingBean(BulkheadFullHandler.class)
    public BulkheadFullHandler bulkheadFullHandler() { return new BulkheadFullHandler(); }

    @Bean
    @ConditionalOnMissingBean(RateLimitedHandler.class)
    public RateLimitedHandler rateLimitedHandler() { return new RateLimitedHandler(); }

    @Bean
    @ConditionalOnMissingBean(PermanentFailureHandler.class)
    public PermanentFailureHandler permanentFailureHandler() { return new PermanentFailureHandler(); }

    @Bean
    @ConditionalOnMissingBean(InterruptedHandler.class)
    public InterruptedHandler interruptedHandler() { return new InterruptedHandler(); }

    @Bean
    @ConditionalOnMissingBean(SendFailedHandler.class)
    public SendFailedHandler sendFailedHandler() { return new SendFailedHandler(); }

    // Router 决策器, 把所有 FailureCaseHandler 注入
    @Bean
    @ConditionalOnMissingBean(FailureDecider.class)
    public FailureDecider failureDecider(List<FailureCaseHandler<?>> handlers) {
        return new RouterFailureDecider(handlers);
    }
}
