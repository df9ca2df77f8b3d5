package com.flighttracker.tracker.infrastructure.db.tracker.mapper;

import com.flighttracker.tracker.domain.tracker.Tracker;
import com.flighttracker.tracker.infrastructure.db.tracker.TrackerEntity;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface TrackerEntityMapper {

    TrackerEntity toEntity(Tracker tracker);

    Tracker toDomain(TrackerEntity entity);
}
