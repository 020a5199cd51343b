package com.deliverzler.triptracking.model;

import lombok.Builder;
import lombok.Value;

/**
 * Loading or unloading site of a trip.
 */
@Value
@Builder
public class Area {

    public static final double DEFAULT_RADIUS_METERS = 50.0;

    Long id;
    String name;
    String address;
    Double latitude;
    Double longitude;

    @Builder.Default
    double radiusMeters = DEFAULT_RADIUS_METERS;

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }
}
