package com.flighttracker.tracker.infrastructure.notification;

import com.flighttracker.common.json.JacksonConfig;
import com.flighttracker.tracker.domain.evaluation.PriceAlert;
import com.flighttracker.tracker.domain.exceptions.DeliveryException;
import com.flighttracker.tracker.domain.notification.AlertNotifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Posts each alert as JSON to a webhook. Any 2xx counts as delivered.
 */
@Slf4j
public class WebhookAlertNotifier implements AlertNotifier {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public WebhookAlertNotifier(RestClient restClient) {
        this(restClient, JacksonConfig.createObjectMapper());
    }

    WebhookAlertNotifier(RestClient restClient, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public void send(PriceAlert alert) {
        try {
            var payload = objectMapper.writeValueAsString(alert);
            restClient.post()
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .toBodilessEntity();
            log.debug("Webhook accepted alert for tracker {}", alert.trackerId());
        } catch (RestClientResponseException e) {
            throw DeliveryException.rejected(alert.trackerId(), e.getStatusCode().value());
        } catch (RestClientException | JacksonException e) {
            throw DeliveryException.of(alert.trackerId(), e);
        }
    }
}
