package com.flighttracker.tracker.domain.tracker;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable tracker registry. Every operation is atomic with respect to the others.
 */
public interface TrackerRepository {

    Tracker save(Tracker tracker);

    Optional<Tracker> findById(String id);

    List<Tracker> findByOwnerId(String ownerId);

    long countByOwnerId(String ownerId);

    /** Trackers of any owner whose id starts with {@code prefix}, oldest first. */
    List<Tracker> findByIdPrefix(String prefix);

    /**
     * Applies {@code mutation} to the current stored record under a write lock.
     *
     * @return the updated tracker, or empty if it no longer exists
     */
    Optional<Tracker> update(String id, UnaryOperator<Tracker> mutation);

    boolean deleteById(String id);

    /**
     * Non-stale trackers never checked, or last checked at or before {@code checkedBefore}.
     */
    List<Tracker> findDue(Instant checkedBefore);
}
