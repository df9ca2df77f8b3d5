package com.flighttracker.tracker.domain.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flighttracker.common.flight.PriceLevel;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Builder(toBuilder = true)
public record PriceAlert(
        @JsonProperty("tracker_id") String trackerId,
        @JsonProperty("owner_id") String ownerId,
        @JsonProperty("channel_id") String channelId,
        String origin,
        String destination,
        LocalDate date,
        BigDecimal price,
        @JsonProperty("threshold_price") BigDecimal thresholdPrice,
        Integer stops,
        String carrier,
        @JsonProperty("price_level") PriceLevel priceLevel,
        @JsonProperty("detected_at") Instant detectedAt) {}
