package com.deliverzler.triptracking.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * One transport operation of the driver, as last known from the trip server.
 * {@code startTime} is wall-clock time in the server's zone.
 */
@Value
@Builder(toBuilder = true)
public class Trip {

    Long id;
    TripStatus status;
    Area loadingArea;
    Area unloadingArea;
    String material;
    String title;
    String projectName;
    String driverName;
    Long driverId;
    LocalDateTime startTime;

    // last distance reported by the server, used when resuming
    @Builder.Default
    double distanceMeters = 0.0;
}
