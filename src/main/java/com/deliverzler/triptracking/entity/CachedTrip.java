package com.deliverzler.triptracking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Local copy of the driver's latest uncompleted trip, kept for offline recovery.
 * The trip itself is stored as JSON; {@code startTime} is kept in a column so the
 * freshness check does not need to parse it.
 */
@Entity
@Table(name = "cached_trips")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CachedTrip {

    @Id
    @Column(name = "driver_id")
    private Long driverId;

    @Column(name = "trip_id", nullable = false)
    private Long tripId;

    @Lob
    @Column(nullable = false)
    private String payload;

    /** Trip start in the server's zone */
    @Column(name = "start_time")
    private LocalDateTime startTime;

    @Column(name = "cached_at", nullable = false)
    private LocalDateTime cachedAt;
}
