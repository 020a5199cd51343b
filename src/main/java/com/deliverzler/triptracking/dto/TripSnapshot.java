package com.deliverzler.triptracking.dto;

import com.deliverzler.triptracking.model.Area;
import com.deliverzler.triptracking.model.Trip;
import com.deliverzler.triptracking.model.TripState;
import lombok.*;

import java.time.LocalDateTime;

/**
 * What the UI sees of the trip state slot. {@code active == false} means no trip.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TripSnapshot {

    private boolean active;
    private Long tripId;
    private String status;
    private String phase;
    private String projectName;
    private String material;
    private Area loadingArea;
    private Area unloadingArea;
    private LocalDateTime startTime;
    private double distanceMeters;
    private Double distanceToLoadingMeters;
    private Double distanceToUnloadingMeters;
    private boolean tracking;

    public static TripSnapshot idle() {
        return TripSnapshot.builder().active(false).build();
    }

    public static TripSnapshot from(TripState state) {
        Trip trip = state.getTrip();
        return TripSnapshot.builder()
                .active(true)
                .tripId(trip.getId())
                .status(trip.getStatus() != null ? trip.getStatus().name() : null)
                .phase(state.getPhase().name())
                .projectName(trip.getProjectName())
                .material(trip.getMaterial())
                .loadingArea(trip.getLoadingArea())
                .unloadingArea(trip.getUnloadingArea())
                .startTime(state.getStartTime())
                .distanceMeters(state.getDistanceMeters())
                .distanceToLoadingMeters(state.getDistanceToLoadingMeters())
                .distanceToUnloadingMeters(state.getDistanceToUnloadingMeters())
                .tracking(state.isTracking())
                .build();
    }
}
