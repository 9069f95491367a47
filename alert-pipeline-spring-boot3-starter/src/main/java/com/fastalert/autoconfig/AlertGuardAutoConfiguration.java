package com.fastalert.autoconfig;

import com.fastalert.config.AlertGuardProperties;
import com.fastalert.core.channel.ChannelHealthMonitor;
import com.fastalert.core.handler.GuardedChannelExecutor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@AutoConfiguration
@EnableConfigurationProperties({
        AlertGuardProperties.class
})
public class AlertGuardAutoConfiguration {

    /**
     * 渠道发送统一入口
     */
    @Bean
    @ConditionalOnMissingBean
    public GuardedChannelExecutor guardedChannelExecutor(AlertGuardProperties props) {
        return new GuardedChannelExecutor(props);
    }

    /**
     * 渠道熔断与健康
     */
    @Bean
    @ConditionalOnMissingBean
    public ChannelHealthMonitor channelHealthMonitor(AlertGuardProperties props,
                                                     @Autowired(required = false) Clock clock) {
        return new ChannelHealthMonitor(props, clock == null ? Clock.systemUTC() : clock);
    }
}
