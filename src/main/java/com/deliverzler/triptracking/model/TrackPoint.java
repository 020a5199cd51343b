package com.deliverzler.triptracking.model;

import lombok.Value;

/**
 * Coordinate plus optional speed, the unit the track optimizer works on.
 */
@Value
public class TrackPoint {

    double latitude;
    double longitude;
    Double speed;

    public TrackPoint withCoordinates(double lat, double lon) {
        return new TrackPoint(lat, lon, speed);
    }
}
