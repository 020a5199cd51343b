package com.deliverzler.triptracking.service;

import com.deliverzler.triptracking.entity.TripEventType;
import com.deliverzler.triptracking.exception.LocationErrorType;
import com.deliverzler.triptracking.exception.LocationException;
import com.deliverzler.triptracking.location.PermissionStatus;
import com.deliverzler.triptracking.location.Position;
import com.deliverzler.triptracking.location.PositionSource;
import com.deliverzler.triptracking.location.ResourceGuard;
import com.deliverzler.triptracking.location.Subscription;
import com.deliverzler.triptracking.model.ProximityTarget;
import com.deliverzler.triptracking.util.GeoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Background tracking loop of the active trip.
 *
 * Position updates are serialized on the single tracking-loop thread. Each one:
 *   - measures the step from the previous accepted position (0 for the first)
 *   - appends a point to the GPS buffer
 *   - recomputes the trip distance over the whole stored track
 *   - triggers the threshold sync on the task pool
 *   - runs arrival detection
 *
 * A watchdog checks for a stalled stream every 30 s and forces a single fetch
 * after 2 minutes without updates. A failed stream is resubscribed after 5 s,
 * keeping the last position as the distance anchor.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackingService {

    private final PositionSource positionSource;
    private final ResourceGuard resourceGuard;
    private final GpsBufferService gpsBufferService;
    private final GpsSyncService gpsSyncService;
    private final GpsTrackOptimizer gpsTrackOptimizer;
    private final ProximityDetector proximityDetector;
    private final NotificationService notificationService;
    private final TelemetryService telemetryService;
    private final Clock clock;

    @Qualifier("trackingLoopExecutor")
    private final Executor trackingLoopExecutor;

    @Qualifier("locationTaskExecutor")
    private final Executor locationTaskExecutor;

    @Qualifier("trackingScheduler")
    private final TaskScheduler trackingScheduler;

    @Value("${tracking.permission-timeout-seconds:30}")
    private long permissionTimeoutSeconds = 30;

    @Value("${tracking.watchdog.interval-seconds:30}")
    private long watchdogIntervalSeconds = 30;

    @Value("${tracking.watchdog.stale-seconds:30}")
    private long staleSeconds = 30;

    @Value("${tracking.watchdog.force-fetch-seconds:120}")
    private long forceFetchSeconds = 120;

    @Value("${tracking.resubscribe-delay-seconds:5}")
    private long resubscribeDelaySeconds = 5;

    private volatile TrackingSession current;

    /**
     * Starts tracking a trip, replacing any running session.
     *
     * @throws LocationException when location is off, denied, or the permission prompt times out
     */
    public void start(Long tripId, ProximityTarget loading, ProximityTarget unloading,
                      TrackingListener listener) {
        checkLocationAvailable(tripId);

        synchronized (this) {
            TrackingSession previous = current;
            if (previous != null) {
                log.info("Replacing tracking session of trip #{}", previous.getTripId());
                current = null;
                previous.close();
            }

            TrackingSession session = new TrackingSession(tripId, loading, unloading, listener,
                    resourceGuard.acquire("trip-" + tripId));
            current = session;
            subscribe(session);
            session.setWatchdog(trackingScheduler.scheduleAtFixedRate(
                    () -> checkStaleness(session), Duration.ofSeconds(watchdogIntervalSeconds)));
        }
        log.info("Tracking started for trip #{}", tripId);
    }

    /**
     * Stops tracking the trip and runs its final GPS sync on the task pool.
     * Works without a live session; the sync still runs for {@code tripId}.
     *
     * @return completes with the final sync outcome
     */
    public CompletableFuture<Boolean> stop(Long tripId) {
        TrackingSession session = null;
        synchronized (this) {
            if (current != null && current.getTripId().equals(tripId)) {
                session = current;
                current = null;
            }
        }
        if (session != null) {
            session.close();
            log.info("Tracking stopped for trip #{}", tripId);
        } else {
            log.info("No live tracking session for trip #{}, running final sync only", tripId);
        }
        notificationService.stopCue();

        // drain updates already queued on the loop before the final sync reads the buffer
        return CompletableFuture.runAsync(() -> { }, trackingLoopExecutor)
                .thenApplyAsync(ignored -> gpsSyncService.finalSync(tripId), locationTaskExecutor);
    }

    /** Replaces the arrival targets of the running session after a trip update. */
    public void retarget(Long tripId, ProximityTarget loading, ProximityTarget unloading) {
        TrackingSession session = current;
        if (session != null && session.getTripId().equals(tripId)) {
            if (loading != null) {
                loading.carryOverFrom(session.getLoadingTarget());
            }
            if (unloading != null) {
                unloading.carryOverFrom(session.getUnloadingTarget());
            }
            session.setLoadingTarget(loading);
            session.setUnloadingTarget(unloading);
            log.info("Arrival targets of trip #{} replaced", tripId);
        }
    }

    public boolean isTracking(Long tripId) {
        TrackingSession session = current;
        return session != null && session.getTripId().equals(tripId) && !session.isClosed();
    }

    public Optional<Long> currentTripId() {
        TrackingSession session = current;
        return session != null ? Optional.of(session.getTripId()) : Optional.empty();
    }

    private void checkLocationAvailable(Long tripId) {
        if (!positionSource.isServiceEnabled()) {
            telemetryService.record(tripId, TripEventType.LOCATION_UNAVAILABLE, LocationErrorType.SERVICE_DISABLED.name());
            throw new LocationException(LocationErrorType.SERVICE_DISABLED, "Location service is disabled");
        }
        PermissionStatus permission = positionSource.requestPermission(Duration.ofSeconds(permissionTimeoutSeconds));
        if (permission == PermissionStatus.DENIED) {
            telemetryService.record(tripId, TripEventType.LOCATION_UNAVAILABLE, LocationErrorType.PERMISSION_DENIED.name());
            throw new LocationException(LocationErrorType.PERMISSION_DENIED, "Location permission denied");
        }
        if (permission != PermissionStatus.GRANTED) {
            telemetryService.record(tripId, TripEventType.LOCATION_UNAVAILABLE, LocationErrorType.PERMISSION_TIMEOUT.name());
            throw new LocationException(LocationErrorType.PERMISSION_TIMEOUT,
                    "No location permission answer within " + permissionTimeoutSeconds + " s");
        }
    }

    private void subscribe(TrackingSession session) {
        Subscription subscription = positionSource.subscribe(
                position -> trackingLoopExecutor.execute(() -> handleUpdate(session, position)),
                error -> onStreamError(session, error));
        session.replaceSubscription(subscription);
    }

    void handleUpdate(TrackingSession session, Position position) {
        if (session.isClosed() || session != current) {
            return;
        }
        Long tripId = session.getTripId();
        try {
            session.setLastUpdate(clock.instant());

            Position previous = session.getAnchor();
            double delta = previous == null ? 0.0 : GeoUtil.haversineMeters(
                    previous.getLatitude(), previous.getLongitude(), position.getLatitude(), position.getLongitude());
            session.setAnchor(position);

            LocalDateTime timestamp = position.getTimestamp() != null ? position.getTimestamp() : LocalDateTime.now(clock);
            gpsBufferService.append(tripId, position.getLatitude(), position.getLongitude(),
                    position.getSpeed(), delta, timestamp);

            double distance = gpsTrackOptimizer.totalDistanceMeters(gpsBufferService.history(tripId));
            session.getListener().onDistanceChanged(tripId, distance);

            locationTaskExecutor.execute(() -> gpsSyncService.syncIfThresholdReached(tripId));

            ProximityReport report = proximityDetector.evaluate(tripId, session.getLoadingTarget(),
                    session.getUnloadingTarget(), position.getLatitude(), position.getLongitude());
            session.getListener().onTargetDistances(tripId,
                    report.getDistanceToLoadingMeters(), report.getDistanceToUnloadingMeters());
            if (report.isAutoEndRequested()) {
                session.getListener().onAutoEndRequested(tripId);
            }
        } catch (RuntimeException e) {
            log.error("Error processing position update of trip #{}: {}", tripId, e.getMessage(), e);
        }
    }

    private void onStreamError(TrackingSession session, Throwable error) {
        log.warn("Position stream of trip #{} failed: {}", session.getTripId(), error.getMessage());
        telemetryService.record(session.getTripId(), TripEventType.LOCATION_STREAM_ERROR, error.getMessage());
        if (!session.markResubscribePending()) {
            return;
        }
        trackingScheduler.schedule(() -> resubscribe(session),
                clock.instant().plusSeconds(resubscribeDelaySeconds));
    }

    void resubscribe(TrackingSession session) {
        session.clearResubscribePending();
        if (session.isClosed() || session != current) {
            return;
        }
        log.info("Resubscribing position stream of trip #{}", session.getTripId());
        subscribe(session);
    }

    /**
     * Watchdog tick. Nothing happens before the first update of the session.
     */
    void checkStaleness(TrackingSession session) {
        Instant last = session.getLastUpdate();
        if (session.isClosed() || last == null) {
            return;
        }
        Duration idle = Duration.between(last, clock.instant());
        if (idle.getSeconds() < staleSeconds) {
            return;
        }
        log.warn("No position update for trip #{} in {} s", session.getTripId(), idle.getSeconds());
        telemetryService.record(session.getTripId(), TripEventType.LOCATION_STREAM_STALE,
                "idle " + idle.getSeconds() + " s");

        if (idle.getSeconds() >= forceFetchSeconds) {
            log.warn("Forcing a single position fetch for trip #{}", session.getTripId());
            try {
                Optional<Position> position = positionSource.getOnce();
                if (position.isPresent()) {
                    trackingLoopExecutor.execute(() -> handleUpdate(session, position.get()));
                } else {
                    log.warn("Single position fetch for trip #{} returned nothing", session.getTripId());
                }
            } catch (RuntimeException e) {
                log.error("Single position fetch for trip #{} failed: {}", session.getTripId(), e.getMessage());
            }
        }
    }

    // visible for tests
    TrackingSession currentSession() {
        return current;
    }
}
