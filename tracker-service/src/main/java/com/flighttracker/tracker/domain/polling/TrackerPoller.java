package com.flighttracker.tracker.domain.polling;

import com.flighttracker.tracker.domain.evaluation.PriceEvaluator;
import com.flighttracker.tracker.domain.exceptions.DeliveryException;
import com.flighttracker.tracker.domain.exceptions.ProviderException;
import com.flighttracker.tracker.domain.notification.AlertNotifier;
import com.flighttracker.tracker.domain.quote.FlightQuery;
import com.flighttracker.tracker.domain.quote.FlightQueryClient;
import com.flighttracker.tracker.domain.quote.QuoteSample;
import com.flighttracker.tracker.domain.sampling.DateSampler;
import com.flighttracker.tracker.domain.tracker.Tracker;
import com.flighttracker.tracker.domain.tracker.TrackerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One poll cycle: select due trackers, fan them out on the worker pool, settle each
 * tracker's state independently.
 *
 * <p>Per tracker the pipeline is sequential: sample dates, query each date, evaluate,
 * notify, persist. Provider and delivery failures stay inside the tracker that hit them.
 * The pool size bounds the number of concurrent provider queries.
 */
@Slf4j
@RequiredArgsConstructor
public class TrackerPoller {

    private final TrackerRepository trackerRepository;
    private final DateSampler dateSampler;
    private final FlightQueryClient queryClient;
    private final PriceEvaluator priceEvaluator;
    private final AlertNotifier alertNotifier;
    private final PollingPolicy policy;
    private final Clock clock;
    private final Executor pollWorkerPool;

    private final AtomicBoolean running = new AtomicBoolean();

    public PollCycleReport runCycle() {
        var now = clock.instant();
        if (!running.compareAndSet(false, true)) {
            log.warn("Poll cycle still in progress, skipping tick at {}", now);
            return PollCycleReport.skipped(now);
        }
        try {
            return pollDueTrackers(now);
        } finally {
            running.set(false);
        }
    }

    private PollCycleReport pollDueTrackers(Instant now) {
        var due = trackerRepository.findDue(now.minus(policy.interval()));
        if (due.isEmpty()) {
            log.debug("Poll cycle at {}: no trackers due", now);
            return PollCycleReport.of(now, 0, List.of());
        }
        log.info("poll.cycle.started: due={}, started_at={}", due.size(), now);

        var futures = new ArrayList<CompletableFuture<TrackerOutcome>>(due.size());
        for (var tracker : due) {
            try {
                futures.add(CompletableFuture.supplyAsync(() -> process(tracker, now), pollWorkerPool));
            } catch (RejectedExecutionException e) {
                log.warn("Worker pool is shutting down, deferring {} remaining trackers", due.size() - futures.size());
                break;
            }
        }
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

        var outcomes = futures.stream().map(CompletableFuture::join).toList();
        return PollCycleReport.of(now, due.size(), outcomes);
    }

    TrackerOutcome process(Tracker tracker, Instant now) {
        try {
            var today = LocalDate.ofInstant(now, policy.zone());
            var dates = dateSampler.sample(tracker.dateRange(), today, policy.samplingBudget(), tracker.pollCycles());
            if (dates.isEmpty()) {
                return markStale(tracker, now);
            }

            var samples = new ArrayList<QuoteSample>(dates.size());
            int failedQueries = 0;
            for (int i = 0; i < dates.size(); i++) {
                if (i > 0 && !pauseBetweenRequests()) {
                    log.info("Tracker {} interrupted mid-cycle, will retry next cycle", tracker.id());
                    return TrackerOutcome.of(TrackerOutcome.Status.INTERRUPTED, failedQueries);
                }
                var date = dates.get(i);
                try {
                    var result = queryClient.search(FlightQuery.forTracker(tracker, date));
                    samples.add(result.cheapest(tracker.maxStops())
                            .map(itinerary -> QuoteSample.of(date, itinerary, result.priceLevel()))
                            .orElseGet(() -> QuoteSample.unavailable(date, result.priceLevel())));
                } catch (ProviderException e) {
                    failedQueries++;
                    log.warn("Query failed for tracker {} ({}->{}) on {}: {}",
                            tracker.id(), tracker.origin(), tracker.destination(), date, e.getMessage());
                }
            }

            var evaluation = priceEvaluator.evaluate(tracker, samples, now);
            boolean delivered = false;
            boolean deliveryFailed = false;
            if (evaluation.shouldNotify()) {
                try {
                    alertNotifier.send(evaluation.alert());
                    delivered = true;
                    log.info("alert.sent: tracker_id={}, owner_id={}, price={}, date={}",
                            tracker.id(), tracker.ownerId(), evaluation.alert().price(), evaluation.alert().date());
                } catch (DeliveryException e) {
                    deliveryFailed = true;
                    log.warn("Alert delivery failed for tracker {}, will retry next cycle: {}",
                            tracker.id(), e.getMessage());
                }
            }

            var notified = delivered;
            var updated = trackerRepository.update(tracker.id(),
                    current -> evaluation.applyTo(current, now, notified));
            if (updated.isEmpty()) {
                log.info("Tracker {} was removed during the cycle, dropping its result", tracker.id());
                return TrackerOutcome.of(TrackerOutcome.Status.REMOVED, failedQueries);
            }
            log.debug("Tracker {} checked: dates={}, answered={}, failed_queries={}, cheapest={}",
                    tracker.id(), dates.size(), samples.size(), failedQueries,
                    evaluation.cheapest() != null ? evaluation.cheapest().price() : null);
            return TrackerOutcome.checked(failedQueries, delivered, deliveryFailed);
        } catch (DataAccessException | TransactionException e) {
            log.error("Persisting tracker {} failed, it will be retried next cycle", tracker.id(), e);
            return TrackerOutcome.of(TrackerOutcome.Status.PERSISTENCE_FAILED);
        } catch (RuntimeException e) {
            log.error("Unexpected failure while polling tracker {}", tracker.id(), e);
            return TrackerOutcome.of(TrackerOutcome.Status.FAILED);
        }
    }

    private TrackerOutcome markStale(Tracker tracker, Instant now) {
        var updated = trackerRepository.update(tracker.id(),
                current -> current.toBuilder().stale(true).lastCheckedAt(now).build());
        if (updated.isEmpty()) {
            return TrackerOutcome.of(TrackerOutcome.Status.REMOVED);
        }
        log.info("Tracker {} ({}->{}) range ended {}, marked stale",
                tracker.id(), tracker.origin(), tracker.destination(), tracker.endDate());
        return TrackerOutcome.of(TrackerOutcome.Status.STALE);
    }

    private boolean pauseBetweenRequests() {
        var spacing = policy.requestSpacing();
        if (spacing == null || spacing.isZero() || spacing.isNegative()) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(spacing.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
