package com.flighttracker.tracker.application.config;

import com.flighttracker.tracker.domain.evaluation.PriceEvaluator;
import com.flighttracker.tracker.domain.notification.AlertNotifier;
import com.flighttracker.tracker.domain.polling.PollingPolicy;
import com.flighttracker.tracker.domain.polling.TrackerPoller;
import com.flighttracker.tracker.domain.quote.FlightQueryClient;
import com.flighttracker.tracker.domain.quote.RetryPolicy;
import com.flighttracker.tracker.domain.sampling.DateSampler;
import com.flighttracker.tracker.domain.tracker.TrackerLimits;
import com.flighttracker.tracker.domain.tracker.TrackerRepository;
import java.time.Clock;
import java.time.ZoneId;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties(TrackerProperties.class)
public class TrackerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PollingPolicy pollingPolicy(TrackerProperties properties) {
        var polling = properties.polling();
        return PollingPolicy.builder()
                .interval(polling.interval())
                .samplingBudget(polling.samplingBudget())
                .requestSpacing(polling.requestSpacing())
                .cooldown(properties.notification().cooldown())
                .zone(ZoneId.of(properties.timeZone()))
                .build();
    }

    @Bean
    public RetryPolicy retryPolicy(TrackerProperties properties) {
        var retry = properties.provider().retry();
        return RetryPolicy.builder()
                .maxAttempts(retry.maxAttempts())
                .initialDelay(retry.initialDelay())
                .multiplier(retry.multiplier())
                .maxDelay(retry.maxDelay())
                .build();
    }

    @Bean
    public TrackerLimits trackerLimits(TrackerProperties properties) {
        var limits = properties.limits();
        return TrackerLimits.builder()
                .maxTrackersPerOwner(limits.maxTrackersPerOwner())
                .maxDays(limits.maxDays())
                .maxAdults(limits.maxAdults())
                .build();
    }

    /**
     * Fixed-size pool for per-tracker fan-out. Its size caps concurrent provider queries;
     * extra trackers wait in the queue.
     */
    @Bean
    public ThreadPoolTaskExecutor pollWorkerPool(TrackerProperties properties) {
        var polling = properties.polling();
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(polling.workers());
        executor.setMaxPoolSize(polling.workers());
        executor.setThreadNamePrefix("poll-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationMillis(polling.shutdownTimeout().toMillis());
        return executor;
    }

    @Bean
    public TrackerPoller trackerPoller(
            TrackerRepository trackerRepository,
            DateSampler dateSampler,
            FlightQueryClient flightQueryClient,
            PriceEvaluator priceEvaluator,
            AlertNotifier alertNotifier,
            PollingPolicy pollingPolicy,
            Clock clock,
            ThreadPoolTaskExecutor pollWorkerPool) {
        return new TrackerPoller(
                trackerRepository,
                dateSampler,
                flightQueryClient,
                priceEvaluator,
                alertNotifier,
                pollingPolicy,
                clock,
                pollWorkerPool);
    }
}
