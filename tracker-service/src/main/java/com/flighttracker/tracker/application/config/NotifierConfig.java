package com.flighttracker.tracker.application.config;

import com.flighttracker.tracker.domain.notification.AlertNotifier;
import com.flighttracker.tracker.infrastructure.notification.LoggingAlertNotifier;
import com.flighttracker.tracker.infrastructure.notification.WebhookAlertNotifier;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Slf4j
@Configuration
public class NotifierConfig {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    @Bean
    @ConditionalOnExpression("!'${tracker.notifier.webhook-url:}'.isBlank()")
    public AlertNotifier webhookAlertNotifier(TrackerProperties properties) {
        var notifier = properties.notifier();
        var timeout = notifier.timeout() != null ? notifier.timeout() : DEFAULT_TIMEOUT;
        var restClient = RestClient.builder()
                .baseUrl(notifier.webhookUrl())
                .requestFactory(ProviderConfig.requestFactory(timeout, timeout))
                .build();
        log.info("Price alerts will be posted to the configured webhook");
        return new WebhookAlertNotifier(restClient);
    }

    @Bean
    @ConditionalOnMissingBean(AlertNotifier.class)
    public AlertNotifier loggingAlertNotifier() {
        log.info("No webhook configured, price alerts will only be logged");
        return new LoggingAlertNotifier();
    }
}
