package com.deliverzler.triptracking.service;

import com.deliverzler.triptracking.entity.TripEvent;
import com.deliverzler.triptracking.entity.TripEventType;
import com.deliverzler.triptracking.repository.TripEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Records and queries trip telemetry events.
 *
 * Recording never throws: a failed insert is logged and the calling operation
 * carries on. Timestamps always come from the server clock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TelemetryService {

    private final TripEventRepository tripEventRepository;
    private final Clock clock;

    public void record(Long tripId, TripEventType type, String detail) {
        record(tripId, type, detail, null, null);
    }

    public void record(Long tripId, TripEventType type, String detail, Double latitude, Double longitude) {
        TripEvent event = TripEvent.builder()
                .tripId(tripId)
                .eventType(type)
                .detail(truncate(detail))
                .latitude(latitude)
                .longitude(longitude)
                .timestamp(LocalDateTime.now(clock))
                .build();
        try {
            tripEventRepository.save(event);
            log.debug("TELEMETRY: {} for trip #{} ({})", type, tripId, detail);
        } catch (RuntimeException e) {
            log.error("TELEMETRY: could not record {} for trip #{}: {}", type, tripId, e.getMessage());
        }
    }

    /**
     * All events of a trip, oldest first.
     */
    @Transactional(readOnly = true)
    public List<TripEvent> getEventsByTripId(Long tripId) {
        List<TripEvent> events = tripEventRepository.findByTripIdOrderByTimestampAsc(tripId);
        log.info("TELEMETRY: Found {} event(s) for trip #{}", events.size(), tripId);
        return events;
    }

    /**
     * Events within a server-timestamp range, oldest first.
     *
     * @throws IllegalArgumentException if start is after end
     */
    @Transactional(readOnly = true)
    public List<TripEvent> getEventsByTimeRange(LocalDateTime start, LocalDateTime end) {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException(
                    "start (" + start + ") must not be after end (" + end + ")");
        }
        List<TripEvent> events = tripEventRepository.findByTimestampBetweenOrderByTimestampAsc(start, end);
        log.info("TELEMETRY: Found {} event(s) between {} and {}", events.size(), start, end);
        return events;
    }

    private static String truncate(String detail) {
        if (detail == null || detail.length() <= 1000) {
            return detail;
        }
        return detail.substring(0, 1000);
    }
}
