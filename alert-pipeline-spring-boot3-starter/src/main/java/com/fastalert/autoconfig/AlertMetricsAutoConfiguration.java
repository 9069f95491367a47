package com.fastalert.autoconfig;

import com.fastalert.core.metric.AlertMeterRegistryProvider;
import com.fastalert.core.metric.AlertMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.context.annotation.Bean;

import java.util.List;

@AutoConfiguration
public class AlertMetricsAutoConfiguration {

    @Bean
    public AlertMeterRegistryProvider alertMeterRegistryProvider(
            @Autowired(required = false) List<MeterRegistry> discovered) {
        return new AlertMeterRegistryProvider(discovered);
    }

    @Bean
    public AlertMetrics alertMetrics(AlertMeterRegistryProvider provider) {
        return AlertMetrics.create(provider.getRegistry());
    }
}
