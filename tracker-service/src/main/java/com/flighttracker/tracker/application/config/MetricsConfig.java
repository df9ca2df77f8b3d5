package com.flighttracker.tracker.application.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter trackersCreatedCounter(MeterRegistry registry) {
        return Counter.builder("trackers.created")
                .description("Total trackers created")
                .register(registry);
    }

    @Bean
    public Counter trackersRemovedCounter(MeterRegistry registry) {
        return Counter.builder("trackers.removed")
                .description("Total trackers removed by their owner")
                .register(registry);
    }

    @Bean
    public Counter pollCyclesCounter(MeterRegistry registry) {
        return Counter.builder("poll.cycles")
                .description("Completed poll cycles")
                .register(registry);
    }

    @Bean
    public Counter providerQueryFailuresCounter(MeterRegistry registry) {
        return Counter.builder("provider.queries.failed")
                .description("Provider queries that failed after retries")
                .register(registry);
    }

    @Bean
    public Counter alertsSentCounter(MeterRegistry registry) {
        return Counter.builder("alerts.sent")
                .description("Price alerts delivered")
                .register(registry);
    }

    @Bean
    public Counter alertsFailedCounter(MeterRegistry registry) {
        return Counter.builder("alerts.failed")
                .description("Price alerts whose delivery failed")
                .register(registry);
    }
}
