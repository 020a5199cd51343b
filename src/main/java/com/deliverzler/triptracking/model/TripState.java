package com.deliverzler.triptracking.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Immutable snapshot of the single trip state slot.
 */
@Value
@Builder(toBuilder = true)
public class TripState {

    Trip trip;
    TripPhase phase;
    LocalDateTime startTime;
    double distanceMeters;
    Double distanceToLoadingMeters;
    Double distanceToUnloadingMeters;
    boolean tracking;

    public Long getTripId() {
        return trip.getId();
    }

    public boolean isActive() {
        return phase == TripPhase.ACTIVE;
    }

    public boolean isEnding() {
        return phase == TripPhase.ENDING || phase == TripPhase.FORCE_ENDING;
    }
}
