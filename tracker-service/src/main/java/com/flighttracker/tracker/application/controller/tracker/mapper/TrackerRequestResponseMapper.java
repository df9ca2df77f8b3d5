package com.flighttracker.tracker.application.controller.tracker.mapper;

import com.flighttracker.tracker.application.controller.tracker.TrackerResponse;
import com.flighttracker.tracker.domain.tracker.Tracker;
import java.time.LocalDate;
import org.mapstruct.Context;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface TrackerRequestResponseMapper {

    int SHORT_ID_LENGTH = 8;

    @Mapping(target = "shortId", expression = "java(tracker.id().substring(0, SHORT_ID_LENGTH))")
    @Mapping(target = "stale", expression = "java(tracker.isStale(today))")
    TrackerResponse toResponse(Tracker tracker, @Context LocalDate today);
}
