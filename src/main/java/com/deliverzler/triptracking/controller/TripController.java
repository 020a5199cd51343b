package com.deliverzler.triptracking.controller;

import com.deliverzler.triptracking.client.dto.HistoryTripDto;
import com.deliverzler.triptracking.dto.*;
import com.deliverzler.triptracking.model.DriveMode;
import com.deliverzler.triptracking.model.TripState;
import com.deliverzler.triptracking.service.DriveModeService;
import com.deliverzler.triptracking.service.TripLifecycleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Trip commands and queries for the driver UI.
 *
 * Endpoints:
 *  GET  /api/trip/current          current trip snapshot
 *  POST /api/trip                  create and start tracking
 *  PUT  /api/trip                  update parameters
 *  POST /api/trip/end              complete
 *  POST /api/trip/force-end        force-end with a reason
 *  POST /api/trip/recover          resume the latest uncompleted trip
 *  POST /api/trip/tracking/resume  retry tracking after a location error
 *  GET  /api/trip/termination      one-shot remote termination notice
 *  GET  /api/trip/history?date=    finished trips of a day
 *  GET|PUT /api/trip/drive-mode
 */
@RestController
@RequestMapping("/api/trip")
@RequiredArgsConstructor
@Slf4j
public class TripController {

    private final TripLifecycleService tripLifecycleService;
    private final DriveModeService driveModeService;

    @GetMapping("/current")
    public ResponseEntity<ApiResponse> getCurrentTrip() {
        Optional<TripState> state = tripLifecycleService.currentTrip();
        return ResponseEntity.ok(ApiResponse.success(
                state.map(TripSnapshot::from).orElse(TripSnapshot.idle()),
                state.isPresent() ? "Trip #" + state.get().getTripId() + " active" : "No active trip"));
    }

    @PostMapping
    public ResponseEntity<ApiResponse> createTrip(@Valid @RequestBody TripRequest request) {
        log.info("Create trip request: project #{}, material {}", request.getProjectId(), request.getMaterial());
        TripState state = tripLifecycleService.createTrip(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(TripSnapshot.from(state), "Trip #" + state.getTripId() + " started"));
    }

    @PutMapping
    public ResponseEntity<ApiResponse> updateTrip(@Valid @RequestBody TripRequest request) {
        boolean updated = tripLifecycleService.updateTrip(request);
        if (!updated) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(ApiResponse.error("Trip could not be updated, previous parameters kept"));
        }
        return ResponseEntity.ok(ApiResponse.success(
                tripLifecycleService.currentTrip().map(TripSnapshot::from).orElse(TripSnapshot.idle()),
                "Trip updated"));
    }

    @PostMapping("/end")
    public ResponseEntity<ApiResponse> endTrip(@RequestBody(required = false) EndTripRequest request) {
        String message = request != null ? request.getMessage() : null;
        boolean ended = tripLifecycleService.endTrip(message);
        if (!ended) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(ApiResponse.error("Trip end already in progress"));
        }
        return ResponseEntity.ok(ApiResponse.success("Trip completed"));
    }

    @PostMapping("/force-end")
    public ResponseEntity<ApiResponse> forceEndTrip(@Valid @RequestBody ForceEndRequest request) {
        log.info("Force end requested: {}", request.getReason());
        boolean ended = tripLifecycleService.forceEndTrip(request.getReason(), request.getUnloadingAreaId());
        if (!ended) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(ApiResponse.error("Trip end already in progress"));
        }
        return ResponseEntity.ok(ApiResponse.success("Trip force-ended"));
    }

    @PostMapping("/recover")
    public ResponseEntity<ApiResponse> recoverTrip() {
        Optional<TripState> state = tripLifecycleService.recoverUncompletedTrip();
        return ResponseEntity.ok(ApiResponse.success(
                state.map(TripSnapshot::from).orElse(TripSnapshot.idle()),
                state.isPresent() ? "Trip #" + state.get().getTripId() + " resumed" : "No uncompleted trip"));
    }

    @PostMapping("/tracking/resume")
    public ResponseEntity<ApiResponse> resumeTracking() {
        TripState state = tripLifecycleService.resumeTracking();
        return ResponseEntity.ok(ApiResponse.success(TripSnapshot.from(state), "Tracking resumed"));
    }

    @GetMapping("/termination")
    public ResponseEntity<ApiResponse> consumeTermination() {
        return tripLifecycleService.consumeTerminationNotice()
                .map(n -> ResponseEntity.ok(ApiResponse.success(n, n.getMessage())))
                .orElseGet(() -> ResponseEntity.ok(ApiResponse.success("No termination notice")));
    }

    @GetMapping("/history")
    public ResponseEntity<ApiResponse> getHistory(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        List<HistoryTripDto> trips = tripLifecycleService.tripHistory(date);
        return ResponseEntity.ok(ApiResponse.success(trips, "Found " + trips.size() + " trip(s) on " + date));
    }

    @GetMapping("/drive-mode")
    public ResponseEntity<ApiResponse> getDriveMode() {
        DriveMode mode = driveModeService.getDriveMode();
        return ResponseEntity.ok(ApiResponse.success(mode, "Drive mode " + mode));
    }

    @PutMapping("/drive-mode")
    public ResponseEntity<ApiResponse> setDriveMode(@Valid @RequestBody DriveModeRequest request) {
        DriveMode mode = driveModeService.setDriveMode(request.getMode());
        return ResponseEntity.ok(ApiResponse.success(mode, "Drive mode set to " + mode));
    }
}
