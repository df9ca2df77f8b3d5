package com.flighttracker.tracker.domain.tracker;

import com.flighttracker.common.id.UlidGenerator;
import com.flighttracker.tracker.domain.exceptions.AmbiguousTrackerIdException;
import com.flighttracker.tracker.domain.exceptions.TrackerLimitExceededException;
import com.flighttracker.tracker.domain.exceptions.TrackerNotFoundException;
import com.flighttracker.tracker.domain.exceptions.TrackerNotOwnedException;
import com.flighttracker.tracker.domain.exceptions.TrackerValidationException;
import com.flighttracker.tracker.domain.polling.PollingPolicy;
import io.micrometer.core.instrument.Counter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Create, list and remove operations for the command layer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrackerService {

    private static final Pattern AIRPORT_CODE = Pattern.compile("^[A-Z]{3}$");
    private static final Set<Integer> ALLOWED_MAX_STOPS = Set.of(0, 1, 2);

    private final TrackerRepository trackerRepository;
    private final TrackerLimits limits;
    private final PollingPolicy pollingPolicy;
    private final Clock clock;
    private final Counter trackersCreatedCounter;
    private final Counter trackersRemovedCounter;

    public Tracker createTracker(CreateTrackerCommand command) {
        var now = clock.instant();
        var today = LocalDate.ofInstant(now, pollingPolicy.zone());

        var errors = new ArrayList<String>();
        var origin = normalizeCode(command.origin());
        var destination = normalizeCode(command.destination());
        var range = resolveRange(command.dateRange(), today, errors);
        validate(command, origin, destination, errors);
        if (!errors.isEmpty()) {
            throw TrackerValidationException.of(errors);
        }

        if (trackerRepository.countByOwnerId(command.ownerId()) >= limits.maxTrackersPerOwner()) {
            throw TrackerLimitExceededException.of(command.ownerId(), limits.maxTrackersPerOwner());
        }

        var tracker = Tracker.builder()
                .id(UlidGenerator.generate(now))
                .ownerId(command.ownerId())
                .channelId(command.channelId())
                .origin(origin)
                .destination(destination)
                .startDate(range.start())
                .endDate(range.end())
                .adults(command.adults() != null ? command.adults() : 1)
                .seatClass(command.seatClass())
                .maxStops(command.maxStops())
                .thresholdPrice(command.thresholdPrice())
                .createdAt(now)
                .build();

        var saved = trackerRepository.save(tracker);
        trackersCreatedCounter.increment();
        log.info("Created tracker {} for owner {}: {}->{} {}..{} at or below {}",
                saved.id(), saved.ownerId(), saved.origin(), saved.destination(),
                saved.startDate(), saved.endDate(), saved.thresholdPrice());
        return saved;
    }

    public Tracker getTracker(String trackerId, String ownerId) {
        var tracker = trackerRepository.findById(trackerId)
                .orElseThrow(() -> TrackerNotFoundException.of(trackerId));
        if (!tracker.ownerId().equals(ownerId)) {
            throw TrackerNotOwnedException.of(trackerId, ownerId);
        }
        return tracker;
    }

    public List<Tracker> listTrackers(String ownerId) {
        return trackerRepository.findByOwnerId(ownerId);
    }

    public LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), pollingPolicy.zone());
    }

    /**
     * Removes by exact id, or by an id prefix unique among the owner's trackers. A tracker that
     * exists but belongs to another owner is Forbidden whether it is named by id or by prefix.
     */
    public Tracker removeTracker(String ownerId, String idOrPrefix) {
        var tracker = trackerRepository.findById(idOrPrefix)
                .map(found -> {
                    if (!found.ownerId().equals(ownerId)) {
                        throw TrackerNotOwnedException.of(idOrPrefix, ownerId);
                    }
                    return found;
                })
                .orElseGet(() -> findByPrefix(ownerId, idOrPrefix));

        if (!trackerRepository.deleteById(tracker.id())) {
            throw TrackerNotFoundException.of(tracker.id());
        }
        trackersRemovedCounter.increment();
        log.info("Removed tracker {} ({}->{}) for owner {}",
                tracker.id(), tracker.origin(), tracker.destination(), ownerId);
        return tracker;
    }

    private Tracker findByPrefix(String ownerId, String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw TrackerNotFoundException.of(String.valueOf(prefix));
        }
        var normalized = prefix.trim().toUpperCase(Locale.ROOT);
        var matches = trackerRepository.findByIdPrefix(normalized);
        var owned = matches.stream()
                .filter(tracker -> tracker.ownerId().equals(ownerId))
                .toList();
        if (owned.size() > 1) {
            throw AmbiguousTrackerIdException.of(prefix, owned.size());
        }
        if (owned.size() == 1) {
            return owned.get(0);
        }
        if (!matches.isEmpty()) {
            throw TrackerNotOwnedException.of(prefix, ownerId);
        }
        throw TrackerNotFoundException.of(prefix);
    }

    private DateRange resolveRange(DateRangeRequest request, LocalDate today, List<String> errors) {
        if (request == null) {
            errors.add("dateRange: required");
            return null;
        }
        if (request.currentMonth()) {
            return DateRange.monthOf(today);
        }
        if (request.startDate() == null) {
            errors.add("startDate: required unless tracking the current month");
            return null;
        }
        int days = request.days() != null ? request.days() : DateRangeRequest.DEFAULT_DAYS;
        if (days < 1 || days > limits.maxDays()) {
            errors.add("days: must be between 1 and " + limits.maxDays());
            return null;
        }
        var range = DateRange.ofDays(request.startDate(), days);
        if (range.isExhausted(today)) {
            errors.add("startDate: range " + range.start() + ".." + range.end().minusDays(1) + " is already in the past");
            return null;
        }
        return range;
    }

    private void validate(CreateTrackerCommand command, String origin, String destination, List<String> errors) {
        if (command.ownerId() == null || command.ownerId().isBlank()) {
            errors.add("ownerId: required");
        }
        if (origin == null || !AIRPORT_CODE.matcher(origin).matches()) {
            errors.add("origin: must be a 3-letter airport code");
        }
        if (destination == null || !AIRPORT_CODE.matcher(destination).matches()) {
            errors.add("destination: must be a 3-letter airport code");
        }
        if (origin != null && origin.equals(destination)) {
            errors.add("destination: must differ from origin");
        }
        if (command.thresholdPrice() == null || command.thresholdPrice().compareTo(BigDecimal.ZERO) <= 0) {
            errors.add("thresholdPrice: must be greater than 0");
        }
        if (command.adults() != null && (command.adults() < 1 || command.adults() > limits.maxAdults())) {
            errors.add("adults: must be between 1 and " + limits.maxAdults());
        }
        if (command.seatClass() == null) {
            errors.add("seatClass: must be one of economy, premium-economy, business, first");
        }
        if (command.maxStops() != null && !ALLOWED_MAX_STOPS.contains(command.maxStops())) {
            errors.add("maxStops: must be 0, 1 or 2");
        }
    }

    private static String normalizeCode(String code) {
        return code == null ? null : code.trim().toUpperCase(Locale.ROOT);
    }
}
