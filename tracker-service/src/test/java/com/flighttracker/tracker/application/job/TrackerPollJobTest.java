package com.flighttracker.tracker.application.job;

import com.flighttracker.tracker.domain.polling.PollCycleReport;
import com.flighttracker.tracker.domain.polling.TrackerPoller;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
class TrackerPollJobTest {

    private static final Instant STARTED_AT = Instant.parse("2026-11-01T12:00:00Z");

    @Mock
    TrackerPoller trackerPoller;

    SimpleMeterRegistry registry;
    TrackerPollJob job;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        job = new TrackerPollJob(
                trackerPoller,
                registry.counter("poll.cycles"),
                registry.counter("provider.queries.failed"),
                registry.counter("alerts.sent"),
                registry.counter("alerts.failed"));
    }

    @Test
    void shouldCountCycleOutcomes() {
        given(trackerPoller.runCycle()).willReturn(PollCycleReport.builder()
                .startedAt(STARTED_AT)
                .due(3)
                .checked(3)
                .failedQueries(5)
                .alertsSent(2)
                .alertsFailed(1)
                .build());

        job.poll();

        assertThat(registry.counter("poll.cycles").count()).isEqualTo(1.0);
        assertThat(registry.counter("provider.queries.failed").count()).isEqualTo(5.0);
        assertThat(registry.counter("alerts.sent").count()).isEqualTo(2.0);
        assertThat(registry.counter("alerts.failed").count()).isEqualTo(1.0);
    }

    @Test
    void shouldNotCountSkippedCycle() {
        given(trackerPoller.runCycle()).willReturn(PollCycleReport.skipped(STARTED_AT));

        job.poll();

        assertThat(registry.counter("poll.cycles").count()).isZero();
    }

    @Test
    void shouldSurviveStoreOutage() {
        given(trackerPoller.runCycle()).willThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatCode(job::poll).doesNotThrowAnyException();
        assertThat(registry.counter("poll.cycles").count()).isZero();
    }

    @Test
    void shouldSurviveTransactionThatCannotStart() {
        given(trackerPoller.runCycle()).willThrow(new CannotCreateTransactionException("Could not open JPA EntityManager"));

        assertThatCode(job::poll).doesNotThrowAnyException();
        assertThat(registry.counter("poll.cycles").count()).isZero();
    }
}
