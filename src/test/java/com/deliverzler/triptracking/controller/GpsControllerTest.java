package com.deliverzler.triptracking.controller;

import com.deliverzler.triptracking.dto.ApiResponse;
import com.deliverzler.triptracking.model.Trip;
import com.deliverzler.triptracking.model.TripPhase;
import com.deliverzler.triptracking.model.TripState;
import com.deliverzler.triptracking.service.GpsSyncService;
import com.deliverzler.triptracking.service.TripLifecycleService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GpsControllerTest {

    @Mock private GpsSyncService       gpsSyncService;
    @Mock private TripLifecycleService tripLifecycleService;

    @InjectMocks
    private GpsController gpsController;

    @Test
    @DisplayName("Pending summary flags unsynced data per trip")
    @SuppressWarnings("unchecked")
    void pending() {
        when(gpsSyncService.pendingSummary()).thenReturn(Map.of(3L, 14L));

        ResponseEntity<ApiResponse> response = gpsController.getPending();

        Map<String, Object> data = (Map<String, Object>) response.getBody().getData();
        assertThat(data).containsEntry("hasUnsyncedData", true);
        assertThat((Map<Long, Long>) data.get("unsyncedPointsByTrip")).containsEntry(3L, 14L);
    }

    @Test
    @DisplayName("Resync of the tracked trip keeps its points")
    void resyncActiveTripKeepsPoints() {
        when(tripLifecycleService.currentTrip()).thenReturn(Optional.of(active(5L)));
        when(gpsSyncService.resync(5L, true)).thenReturn(true);

        ResponseEntity<ApiResponse> response = gpsController.resyncTrip(5L);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        verify(gpsSyncService).resync(5L, true);
    }

    @Test
    @DisplayName("Failed resync of a finished trip answers 502")
    void resyncFinishedTripFails() {
        when(tripLifecycleService.currentTrip()).thenReturn(Optional.empty());
        when(gpsSyncService.resync(4L, false)).thenReturn(false);

        ResponseEntity<ApiResponse> response = gpsController.resyncTrip(4L);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
    }

    @Test
    @DisplayName("Resync of all trips reports per-trip outcome")
    void resyncAll() {
        Map<Long, Boolean> outcome = new LinkedHashMap<>();
        outcome.put(1L, true);
        outcome.put(2L, false);
        when(tripLifecycleService.currentTrip()).thenReturn(Optional.of(active(2L)));
        when(gpsSyncService.resyncAll(2L)).thenReturn(outcome);

        ResponseEntity<ApiResponse> response = gpsController.resyncAll();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody().getData()).isEqualTo(outcome);
    }

    private static TripState active(Long tripId) {
        return TripState.builder()
                .trip(Trip.builder().id(tripId).build())
                .phase(TripPhase.ACTIVE)
                .build();
    }
}
