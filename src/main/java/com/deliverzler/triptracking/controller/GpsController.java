package com.deliverzler.triptracking.controller;

import com.deliverzler.triptracking.dto.ApiResponse;
import com.deliverzler.triptracking.model.TripState;
import com.deliverzler.triptracking.service.GpsSyncService;
import com.deliverzler.triptracking.service.TripLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unsynced GPS data indicator and manual resync.
 *
 * The points of the trip being tracked are uploaded but kept, since its distance
 * is still computed from them.
 */
@RestController
@RequestMapping("/api/gps")
@RequiredArgsConstructor
@Slf4j
public class GpsController {

    private final GpsSyncService gpsSyncService;
    private final TripLifecycleService tripLifecycleService;

    @GetMapping("/pending")
    public ResponseEntity<ApiResponse> getPending() {
        Map<Long, Long> pending = gpsSyncService.pendingSummary();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("hasUnsyncedData", !pending.isEmpty());
        data.put("unsyncedPointsByTrip", pending);
        return ResponseEntity.ok(ApiResponse.success(data,
                pending.isEmpty() ? "All GPS data synced" : pending.size() + " trip(s) with unsynced GPS data"));
    }

    @PostMapping("/resync")
    public ResponseEntity<ApiResponse> resyncAll() {
        log.info("Manual GPS resync of all trips requested");
        Map<Long, Boolean> outcome = gpsSyncService.resyncAll(activeTripId());
        boolean allOk = outcome.values().stream().allMatch(Boolean::booleanValue);
        return ResponseEntity.status(allOk ? HttpStatus.OK : HttpStatus.BAD_GATEWAY)
                .body(ApiResponse.builder()
                        .success(allOk)
                        .message(allOk ? "Resynced " + outcome.size() + " trip(s)" : "Some trips could not be synced")
                        .data(outcome)
                        .build());
    }

    @PostMapping("/resync/{tripId}")
    public ResponseEntity<ApiResponse> resyncTrip(@PathVariable Long tripId) {
        log.info("Manual GPS resync of trip #{} requested", tripId);
        boolean ok = gpsSyncService.resync(tripId, tripId.equals(activeTripId()));
        if (!ok) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(ApiResponse.error("GPS data of trip #" + tripId + " could not be synced, kept locally"));
        }
        return ResponseEntity.ok(ApiResponse.success("GPS data of trip #" + tripId + " synced"));
    }

    private Long activeTripId() {
        return tripLifecycleService.currentTrip().map(TripState::getTripId).orElse(null);
    }
}
