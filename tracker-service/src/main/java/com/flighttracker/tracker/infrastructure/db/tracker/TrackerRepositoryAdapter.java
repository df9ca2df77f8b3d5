package com.flighttracker.tracker.infrastructure.db.tracker;

import com.flighttracker.tracker.domain.tracker.Tracker;
import com.flighttracker.tracker.domain.tracker.TrackerRepository;
import com.flighttracker.tracker.infrastructure.db.tracker.mapper.TrackerEntityMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

@Repository
@RequiredArgsConstructor
public class TrackerRepositoryAdapter implements TrackerRepository {

    private final TrackerJpaRepository jpaRepository;
    private final TrackerEntityMapper mapper;

    @Override
    @Transactional
    public Tracker save(Tracker tracker) {
        var saved = jpaRepository.save(mapper.toEntity(tracker));
        return mapper.toDomain(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Tracker> findById(String id) {
        return jpaRepository.findById(id).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Tracker> findByOwnerId(String ownerId) {
        return jpaRepository.findByOwnerIdOrderByCreatedAtAsc(ownerId).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public long countByOwnerId(String ownerId) {
        return jpaRepository.countByOwnerId(ownerId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Tracker> findByIdPrefix(String prefix) {
        return jpaRepository.findByIdStartingWithOrderByCreatedAtAsc(prefix).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional
    public Optional<Tracker> update(String id, UnaryOperator<Tracker> mutation) {
        return jpaRepository.findByIdForUpdate(id)
                .map(entity -> {
                    var mutated = mutation.apply(mapper.toDomain(entity));
                    if (!id.equals(mutated.id())) {
                        throw new IllegalArgumentException("Tracker id is immutable: " + id + " -> " + mutated.id());
                    }
                    return mapper.toDomain(jpaRepository.save(mapper.toEntity(mutated)));
                });
    }

    @Override
    @Transactional
    public boolean deleteById(String id) {
        return jpaRepository.deleteByIdReturningCount(id) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Tracker> findDue(Instant checkedBefore) {
        return jpaRepository.findDue(checkedBefore).stream()
                .map(mapper::toDomain)
                .toList();
    }
}
