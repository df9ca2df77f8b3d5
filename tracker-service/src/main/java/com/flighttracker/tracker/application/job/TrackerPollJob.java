package com.flighttracker.tracker.application.job;

import com.flighttracker.tracker.domain.polling.PollCycleReport;
import com.flighttracker.tracker.domain.polling.TrackerPoller;
import io.micrometer.core.instrument.Counter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

/**
 * Timer that drives poll cycles. Trackers become due once per poll interval; the tick only
 * decides how soon after that they are picked up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "tracker.polling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TrackerPollJob {

    private final TrackerPoller trackerPoller;
    private final Counter pollCyclesCounter;
    private final Counter providerQueryFailuresCounter;
    private final Counter alertsSentCounter;
    private final Counter alertsFailedCounter;

    @Scheduled(fixedDelayString = "${tracker.polling.tick}", initialDelayString = "${tracker.polling.initial-delay}")
    public void poll() {
        PollCycleReport report;
        try {
            report = trackerPoller.runCycle();
        } catch (DataAccessException | TransactionException e) {
            log.error("Poll cycle aborted: could not select due trackers", e);
            return;
        }
        if (report.skipped() || report.due() == 0) {
            return;
        }

        pollCyclesCounter.increment();
        providerQueryFailuresCounter.increment(report.failedQueries());
        alertsSentCounter.increment(report.alertsSent());
        alertsFailedCounter.increment(report.alertsFailed());

        log.info("poll.cycle.completed: due={}, checked={}, stale={}, removed={}, failed_queries={}, "
                        + "alerts_sent={}, alerts_failed={}, persistence_failures={}, failed={}",
                report.due(), report.checked(), report.stale(), report.removed(), report.failedQueries(),
                report.alertsSent(), report.alertsFailed(), report.persistenceFailures(), report.failed());
    }
}
