package com.deliverzler.triptracking.repository;

import com.deliverzler.triptracking.entity.TripEvent;
import com.deliverzler.triptracking.entity.TripEventType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for telemetry events: trip audit trail and time-range queries.
 */
@Repository
public interface TripEventRepository extends JpaRepository<TripEvent, Long> {

    /** All events of a trip, oldest first. */
    List<TripEvent> findByTripIdOrderByTimestampAsc(Long tripId);

    List<TripEvent> findByTimestampBetweenOrderByTimestampAsc(LocalDateTime start, LocalDateTime end);

    long countByTripIdAndEventType(Long tripId, TripEventType eventType);
}
