package com.buildflow.agencyapi.config;

import com.buildflow.observability.MetricFactory;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ObservabilityConfiguration {

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ServiceProperties serviceProperties) {
        return new MetricFactory(registry, serviceProperties.name());
    }
}
