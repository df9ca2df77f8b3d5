package com.flighttracker.tracker.infrastructure.provider;

import com.flighttracker.common.flight.PriceLevel;
import com.flighttracker.common.json.JacksonConfig;
import com.flighttracker.tracker.domain.exceptions.ProviderException;
import com.flighttracker.tracker.domain.quote.FlightQuery;
import com.flighttracker.tracker.domain.quote.FlightQuoteProvider;
import com.flighttracker.tracker.domain.quote.FlightSearchResult;
import com.flighttracker.tracker.domain.quote.Itinerary;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Flight-search provider over HTTP. Timeouts come from the {@link RestClient}'s request
 * factory; failures are classified so the query client only retries transient ones.
 */
@Slf4j
public class HttpFlightQuoteProvider implements FlightQuoteProvider {

    static final String SEARCH_PATH = "/v1/flights";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public HttpFlightQuoteProvider(RestClient restClient) {
        this.restClient = restClient;
        this.objectMapper = JacksonConfig.createObjectMapper();
    }

    @Override
    public FlightSearchResult search(FlightQuery query) {
        String body;
        try {
            body = restClient.get()
                    .uri(builder -> {
                        builder.path(SEARCH_PATH)
                                .queryParam("from", query.origin())
                                .queryParam("to", query.destination())
                                .queryParam("date", query.date())
                                .queryParam("trip", query.isRoundTrip() ? "round-trip" : "one-way")
                                .queryParam("adults", query.adults())
                                .queryParam("seat", query.seatClass().wireName());
                        if (query.isRoundTrip()) {
                            builder.queryParam("return_date", query.returnDate());
                        }
                        if (query.maxStops() != null) {
                            builder.queryParam("max_stops", query.maxStops());
                        }
                        return builder.build();
                    })
                    .retrieve()
                    .body(String.class);
        } catch (ResourceAccessException e) {
            throw ProviderException.transientFailure("Provider unreachable for " + query + ": " + e.getMessage(), e);
        } catch (RestClientResponseException e) {
            throw classify(query, e);
        } catch (RestClientException e) {
            throw ProviderException.permanentFailure("Provider call failed for " + query + ": " + e.getMessage(), e);
        }

        if (body == null || body.isBlank()) {
            return FlightSearchResult.empty();
        }
        return toResult(query, parse(query, body));
    }

    private ProviderSearchResponse parse(FlightQuery query, String body) {
        try {
            return objectMapper.readValue(body, ProviderSearchResponse.class);
        } catch (JacksonException e) {
            throw ProviderException.permanentFailure("Malformed provider response for " + query, e);
        }
    }

    private static FlightSearchResult toResult(FlightQuery query, ProviderSearchResponse response) {
        var flights = response.flights() != null ? response.flights() : List.<ProviderSearchResponse.ProviderFlight>of();
        var itineraries = new ArrayList<Itinerary>(flights.size());
        for (var flight : flights) {
            var price = PriceParser.parse(flight.price());
            if (price.isEmpty()) {
                log.debug("Skipping itinerary without a usable price for {}: {}", query, flight.price());
                continue;
            }
            itineraries.add(Itinerary.builder()
                    .price(price.get())
                    .stops(flight.stopCount())
                    .carrier(flight.name())
                    .duration(flight.duration())
                    .departure(flight.departure())
                    .arrival(flight.arrival())
                    .build());
        }
        return new FlightSearchResult(itineraries, PriceLevel.fromProvider(response.currentPrice()));
    }

    private static ProviderException classify(FlightQuery query, RestClientResponseException e) {
        var status = e.getStatusCode();
        var message = "Provider returned " + status.value() + " for " + query;
        if (status.is5xxServerError() || status.value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return ProviderException.transientFailure(message, e);
        }
        return ProviderException.permanentFailure(message, e);
    }
}
