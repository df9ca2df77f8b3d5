package com.flighttracker.tracker.application.config;

import com.flighttracker.tracker.domain.quote.FlightQuoteProvider;
import com.flighttracker.tracker.infrastructure.provider.HttpFlightQuoteProvider;
import java.net.http.HttpClient;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class ProviderConfig {

    @Bean
    public FlightQuoteProvider flightQuoteProvider(TrackerProperties properties) {
        var provider = properties.provider();
        var restClient = RestClient.builder()
                .baseUrl(provider.baseUrl())
                .requestFactory(requestFactory(provider.connectTimeout(), provider.readTimeout()))
                .build();
        return new HttpFlightQuoteProvider(restClient);
    }

    static JdkClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        var httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        var factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(readTimeout);
        return factory;
    }
}
