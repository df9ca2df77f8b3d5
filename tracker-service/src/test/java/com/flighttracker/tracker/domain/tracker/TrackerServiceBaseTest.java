package com.flighttracker.tracker.domain.tracker;

import io.micrometer.core.instrument.Counter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.ZoneOffset;

import static com.flighttracker.tracker.test.fixtures.TrackerFixtures.NOW;
import static com.flighttracker.tracker.test.fixtures.TrackerFixtures.someLimits;
import static com.flighttracker.tracker.test.fixtures.TrackerFixtures.somePollingPolicy;

@ExtendWith(MockitoExtension.class)
public abstract class TrackerServiceBaseTest {

    @Mock
    TrackerRepository trackerRepository;

    @Mock
    Counter trackersCreatedCounter;

    @Mock
    Counter trackersRemovedCounter;

    TrackerService trackerService;

    @BeforeEach
    void setUpService() {
        trackerService = new TrackerService(
                trackerRepository,
                someLimits(),
                somePollingPolicy(),
                Clock.fixed(NOW, ZoneOffset.UTC),
                trackersCreatedCounter,
                trackersRemovedCounter);
    }
}
