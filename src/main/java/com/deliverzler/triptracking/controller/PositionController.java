package com.deliverzler.triptracking.controller;

import com.deliverzler.triptracking.dto.ApiResponse;
import com.deliverzler.triptracking.dto.LocationStatusRequest;
import com.deliverzler.triptracking.dto.PositionUpdateRequest;
import com.deliverzler.triptracking.dto.StreamErrorRequest;
import com.deliverzler.triptracking.location.DevicePositionSource;
import com.deliverzler.triptracking.location.Position;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Receives the device's position stream and location state.
 */
@RestController
@RequestMapping("/api/location")
@RequiredArgsConstructor
@Slf4j
public class PositionController {

    private final DevicePositionSource devicePositionSource;

    /**
     * One fix from the device. Returns 202: the fix is queued on the tracking loop.
     */
    @PostMapping("/update")
    public ResponseEntity<ApiResponse> updatePosition(@Valid @RequestBody PositionUpdateRequest request) {
        log.debug("Position update ({}, {}) speed {}", request.getLatitude(), request.getLongitude(), request.getSpeed());
        devicePositionSource.publish(Position.builder()
                .latitude(request.getLatitude())
                .longitude(request.getLongitude())
                .speed(request.getSpeed())
                .accuracy(request.getAccuracy())
                .timestamp(request.getTimestamp())
                .build());
        return ResponseEntity.accepted().body(ApiResponse.success("Position accepted"));
    }

    @PostMapping("/stream-error")
    public ResponseEntity<ApiResponse> reportStreamError(@RequestBody(required = false) StreamErrorRequest request) {
        String message = request != null && request.getMessage() != null ? request.getMessage() : "position stream failed";
        devicePositionSource.publishError(new IllegalStateException(message));
        return ResponseEntity.accepted().body(ApiResponse.success("Stream error recorded"));
    }

    @PutMapping("/status")
    public ResponseEntity<ApiResponse> updateStatus(@Valid @RequestBody LocationStatusRequest request) {
        devicePositionSource.updateStatus(request.getServiceEnabled(), request.getPermission());
        return ResponseEntity.ok(ApiResponse.success("Location status updated"));
    }
}
