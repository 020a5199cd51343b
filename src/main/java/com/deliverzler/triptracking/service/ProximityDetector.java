package com.deliverzler.triptracking.service;

import com.deliverzler.triptracking.entity.TripEventType;
import com.deliverzler.triptracking.model.DriveMode;
import com.deliverzler.triptracking.model.ProximityTarget;
import com.deliverzler.triptracking.model.TargetKind;
import com.deliverzler.triptracking.util.GeoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Arrival detection for the loading and unloading areas.
 *
 * A target counts as reached within its radius plus a 50 m buffer. Each target
 * notifies once per tracking session. In SMART mode, every position inside the
 * unloading threshold asks for the trip to be ended; ending is idempotent so
 * repeats are harmless. Arrival order is not enforced.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProximityDetector {

    public static final double ARRIVAL_BUFFER_METERS = 50.0;

    private final NotificationService notificationService;
    private final TelemetryService telemetryService;
    private final DriveModeService driveModeService;

    public ProximityReport evaluate(Long tripId, ProximityTarget loading, ProximityTarget unloading,
                                    double latitude, double longitude) {
        Double toLoading = check(tripId, loading, latitude, longitude);
        Double toUnloading = check(tripId, unloading, latitude, longitude);

        boolean autoEnd = toUnloading != null
                && toUnloading <= unloading.getRadiusMeters() + ARRIVAL_BUFFER_METERS
                && driveModeService.getDriveMode() == DriveMode.SMART;
        if (autoEnd) {
            log.info("Trip #{} inside unloading area in SMART mode, requesting auto end", tripId);
        }
        return new ProximityReport(toLoading, toUnloading, autoEnd);
    }

    private Double check(Long tripId, ProximityTarget target, double latitude, double longitude) {
        if (target == null) {
            return null;
        }
        double distance = GeoUtil.haversineMeters(latitude, longitude, target.getLatitude(), target.getLongitude());
        log.debug("Trip #{}: {} m to {} area '{}'", tripId, String.format("%.2f", distance),
                target.getKind(), target.getName());

        if (distance <= target.getRadiusMeters() + ARRIVAL_BUFFER_METERS && target.markNotified()) {
            log.info("Trip #{} arrived at {} area '{}' ({} m)", tripId, target.getKind(), target.getName(),
                    String.format("%.1f", distance));
            boolean loading = target.getKind() == TargetKind.LOADING;
            notificationService.notify(loading ? "Arrived at the loading area" : "Arrived at the unloading area");
            notificationService.playCue();
            notificationService.vibrate();
            telemetryService.record(tripId,
                    loading ? TripEventType.LOADING_ARRIVED : TripEventType.UNLOADING_ARRIVED,
                    target.getName(), latitude, longitude);
        }
        return distance;
    }
}
