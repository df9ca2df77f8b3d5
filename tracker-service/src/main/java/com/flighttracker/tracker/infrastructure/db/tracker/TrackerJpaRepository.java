package com.flighttracker.tracker.infrastructure.db.tracker;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

public interface TrackerJpaRepository extends JpaRepository<TrackerEntity, String> {

    List<TrackerEntity> findByOwnerIdOrderByCreatedAtAsc(String ownerId);

    long countByOwnerId(String ownerId);

    List<TrackerEntity> findByIdStartingWithOrderByCreatedAtAsc(String prefix);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TrackerEntity t WHERE t.id = :id")
    Optional<TrackerEntity> findByIdForUpdate(String id);

    @Query(
            """
            SELECT t FROM TrackerEntity t
            WHERE t.stale = false
            AND (t.lastCheckedAt IS NULL OR t.lastCheckedAt <= :checkedBefore)
            ORDER BY t.createdAt ASC
            """)
    List<TrackerEntity> findDue(Instant checkedBefore);

    @Modifying
    @Query("DELETE FROM TrackerEntity t WHERE t.id = :id")
    int deleteByIdReturningCount(String id);
}
