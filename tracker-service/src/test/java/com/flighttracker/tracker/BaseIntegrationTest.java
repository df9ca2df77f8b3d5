package com.flighttracker.tracker;

import com.flighttracker.tracker.domain.quote.FlightQuoteProvider;
import com.flighttracker.tracker.infrastructure.db.tracker.TrackerJpaRepository;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Full application context against in-memory H2 with the Flyway schema. The flight
 * provider is mocked; polling is disabled in the test profile.
 */
@SpringBootTest
@AutoConfigureMockMvc
public abstract class BaseIntegrationTest {

    @MockitoBean
    protected FlightQuoteProvider flightQuoteProvider;

    @Autowired
    protected TrackerJpaRepository trackerJpaRepository;

    @BeforeEach
    void cleanDatabase() {
        trackerJpaRepository.deleteAll();
    }
}
