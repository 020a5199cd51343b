package com.deliverzler.triptracking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Telemetry record for lifecycle, location and sync events.
 *
 * {@code timestamp} is always server time, never taken from a device fix.
 * {@code tripId} is null for events raised before a trip exists (e.g. a failed create).
 */
@Entity
@Table(
    name = "trip_events",
    indexes = {
        @Index(name = "idx_trip_event_trip_id",   columnList = "trip_id"),
        @Index(name = "idx_trip_event_timestamp", columnList = "event_timestamp")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TripEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trip_id")
    private Long tripId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 40)
    private TripEventType eventType;

    @Column(length = 1000)
    private String detail;

    private Double latitude;

    private Double longitude;

    @Column(name = "event_timestamp", nullable = false)
    private LocalDateTime timestamp;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }
}
