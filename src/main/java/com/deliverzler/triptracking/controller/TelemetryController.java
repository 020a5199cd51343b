package com.deliverzler.triptracking.controller;

import com.deliverzler.triptracking.dto.ApiResponse;
import com.deliverzler.triptracking.entity.TripEvent;
import com.deliverzler.triptracking.service.TelemetryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Telemetry queries.
 *
 *  GET /api/events/trip/{tripId}               events of one trip
 *  GET /api/events/range?start=...&end=...      events in a server-time window (ISO date-time)
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
@Slf4j
public class TelemetryController {

    private final TelemetryService telemetryService;

    @GetMapping("/trip/{tripId}")
    public ResponseEntity<ApiResponse> getEventsByTrip(@PathVariable Long tripId) {
        List<TripEvent> events = telemetryService.getEventsByTripId(tripId);
        return ResponseEntity.ok(ApiResponse.success(toResponseList(events),
                "Found " + events.size() + " event(s) for trip #" + tripId));
    }

    @GetMapping("/range")
    public ResponseEntity<ApiResponse> getEventsByRange(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime end) {
        List<TripEvent> events = telemetryService.getEventsByTimeRange(start, end);
        return ResponseEntity.ok(ApiResponse.success(toResponseList(events),
                "Found " + events.size() + " event(s) between " + start + " and " + end));
    }

    private List<Map<String, Object>> toResponseList(List<TripEvent> events) {
        return events.stream().map(e -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("id",        e.getId());
            m.put("tripId",    e.getTripId());
            m.put("eventType", e.getEventType().name());
            m.put("detail",    e.getDetail());
            m.put("latitude",  e.getLatitude());
            m.put("longitude", e.getLongitude());
            m.put("timestamp", e.getTimestamp());
            return m;
        }).toList();
    }
}
