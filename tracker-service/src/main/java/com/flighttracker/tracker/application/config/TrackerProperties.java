package com.flighttracker.tracker.application.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tracker")
public record TrackerProperties(
        @NotBlank String timeZone,
        @NotNull @Valid Polling polling,
        @NotNull @Valid Notification notification,
        @NotNull @Valid Limits limits,
        @NotNull @Valid Provider provider,
        @Valid Notifier notifier
) {

    public record Polling(
            boolean enabled,
            @NotNull Duration tick,
            @NotNull Duration initialDelay,
            @NotNull Duration interval,
            @Min(1) int workers,
            @Min(1) int samplingBudget,
            @NotNull Duration requestSpacing,
            @NotNull Duration shutdownTimeout
    ) {}

    public record Notification(@NotNull Duration cooldown) {}

    public record Limits(@Min(1) int maxTrackersPerOwner, @Min(1) int maxDays, @Min(1) int maxAdults) {}

    public record Provider(
            @NotBlank String baseUrl,
            @NotNull Duration connectTimeout,
            @NotNull Duration readTimeout,
            @NotNull @Valid Retry retry
    ) {}

    public record Retry(
            @Min(1) int maxAttempts,
            @NotNull Duration initialDelay,
            @DecimalMin("1.0") double multiplier,
            @NotNull Duration maxDelay
    ) {}

    public record Notifier(String webhookUrl, Duration timeout) {}
}
