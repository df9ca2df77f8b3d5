package com.flighttracker.tracker.domain.polling;

import lombok.Builder;

import java.time.Instant;
import java.util.Collection;

@Builder(toBuilder = true)
public record PollCycleReport(
        Instant startedAt,
        int due,
        int checked,
        int stale,
        int removed,
        int failedQueries,
        int alertsSent,
        int alertsFailed,
        int persistenceFailures,
        int failed,
        boolean skipped
) {

    public static PollCycleReport skipped(Instant startedAt) {
        return PollCycleReport.builder().startedAt(startedAt).skipped(true).build();
    }

    public static PollCycleReport of(Instant startedAt, int due, Collection<TrackerOutcome> outcomes) {
        var report = PollCycleReport.builder().startedAt(startedAt).due(due);
        int checked = 0;
        int stale = 0;
        int removed = 0;
        int failedQueries = 0;
        int alertsSent = 0;
        int alertsFailed = 0;
        int persistenceFailures = 0;
        int failed = 0;
        for (var outcome : outcomes) {
            switch (outcome.status()) {
                case CHECKED -> checked++;
                case STALE -> stale++;
                case REMOVED -> removed++;
                case PERSISTENCE_FAILED -> persistenceFailures++;
                case INTERRUPTED, FAILED -> failed++;
            }
            failedQueries += outcome.failedQueries();
            alertsSent += outcome.alertSent() ? 1 : 0;
            alertsFailed += outcome.alertFailed() ? 1 : 0;
        }
        return report.checked(checked)
                .stale(stale)
                .removed(removed)
                .failedQueries(failedQueries)
                .alertsSent(alertsSent)
                .alertsFailed(alertsFailed)
                .persistenceFailures(persistenceFailures)
                .failed(failed)
                .build();
    }
}
