package com.flighttracker.tracker.domain.tracker;

import lombok.Builder;

@Builder(toBuilder = true)
public record TrackerLimits(int maxTrackersPerOwner, int maxDays, int maxAdults) {
}
