package com.deliverzler.triptracking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * One sampled position of a trip, buffered locally until the server confirms it.
 *
 * Rows are append-only: after insert only {@code synced} changes.
 * {@code timestamp} has second precision and never goes backwards within a trip.
 */
@Entity
@Table(
    name = "gps_points",
    indexes = {
        @Index(name = "idx_gps_point_trip_synced", columnList = "trip_id, synced"),
        @Index(name = "idx_gps_point_trip_ts",     columnList = "trip_id, point_timestamp")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GpsPoint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trip_id", nullable = false)
    private Long tripId;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    private Double speed; // m/s, absent when the fix carried none

    /** Haversine distance from the previous accepted point of the trip, 0 for the first */
    @Column(name = "distance_delta", nullable = false)
    private Double distanceDelta;

    @Column(name = "point_timestamp", nullable = false)
    private LocalDateTime timestamp;

    @Column(nullable = false)
    private boolean synced;
}
