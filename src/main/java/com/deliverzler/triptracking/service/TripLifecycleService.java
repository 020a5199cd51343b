package com.deliverzler.triptracking.service;

import com.deliverzler.triptracking.client.ConnectivityChecker;
import com.deliverzler.triptracking.client.RemoteTripService;
import com.deliverzler.triptracking.client.dto.HistoryTripDto;
import com.deliverzler.triptracking.client.dto.TripRequestDto;
import com.deliverzler.triptracking.dto.TripRequest;
import com.deliverzler.triptracking.entity.TripEventType;
import com.deliverzler.triptracking.exception.LocationException;
import com.deliverzler.triptracking.exception.TripCompletionException;
import com.deliverzler.triptracking.exception.TripCreationException;
import com.deliverzler.triptracking.model.ProximityTarget;
import com.deliverzler.triptracking.model.TargetKind;
import com.deliverzler.triptracking.model.Trip;
import com.deliverzler.triptracking.model.TripPhase;
import com.deliverzler.triptracking.model.TripState;
import com.deliverzler.triptracking.model.TripStatus;
import com.deliverzler.triptracking.model.TripTerminationNotice;
import com.deliverzler.triptracking.util.Retrier;
import com.deliverzler.triptracking.util.RetryPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Trip lifecycle state machine.
 *
 * Idle -> Active -> Ending -> Idle, with ForceEnding and remote termination as the
 * other exits from Active. The state lives in one slot guarded by {@code monitor};
 * remote calls never run while it is held. Every exit goes through
 * {@link #teardown(Long, boolean)}, which clears the slot only if it still holds
 * the same trip, so a trip is torn down exactly once whichever exit wins.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TripLifecycleService implements TrackingListener {

    private final RemoteTripService remoteTripService;
    private final TrackingService trackingService;
    private final TripCacheService tripCacheService;
    private final TripHistoryService tripHistoryService;
    private final NotificationService notificationService;
    private final TripStatePublisher tripStatePublisher;
    private final TelemetryService telemetryService;
    private final ConnectivityChecker connectivityChecker;
    private final Retrier retrier;
    private final Clock clock;

    @Qualifier("trackingScheduler")
    private final TaskScheduler trackingScheduler;

    @Qualifier("locationTaskExecutor")
    private final Executor locationTaskExecutor;

    @Value("${driver.id}")
    private Long driverId;

    @Value("${remote.api.zone:Asia/Seoul}")
    private String remoteZone = "Asia/Seoul";

    @Value("${trip.poll.interval-seconds:5}")
    private long pollIntervalSeconds = 5;

    @Value("${trip.end.max-attempts:3}")
    private int endMaxAttempts = 3;

    @Value("${trip.end.retry-delay-seconds:2}")
    private long endRetryDelaySeconds = 2;

    @Value("${trip.force-end.await-final-sync:false}")
    private boolean awaitFinalSyncOnForceEnd;

    @Value("${trip.recovery.max-age-hours:12}")
    private long recoveryMaxAgeHours = 12;

    @Value("${trip.auto-end.message:Trip completed on arrival at the unloading area}")
    private String autoEndMessage = "Trip completed on arrival at the unloading area";

    private final Object monitor = new Object();
    private final AtomicReference<TripTerminationNotice> terminationNotice = new AtomicReference<>();

    // guarded by monitor
    private TripState state;
    private boolean creating;
    private ScheduledFuture<?> pollTask;

    // ── Queries ───────────────────────────────────────────────────────────────

    public Optional<TripState> currentTrip() {
        synchronized (monitor) {
            return Optional.ofNullable(state);
        }
    }

    /** Returns the pending remote-termination notice once, then forgets it. */
    public Optional<TripTerminationNotice> consumeTerminationNotice() {
        return Optional.ofNullable(terminationNotice.getAndSet(null));
    }

    public List<HistoryTripDto> tripHistory(LocalDate date) {
        return tripHistoryService.getHistory(date);
    }

    // ── Commands ──────────────────────────────────────────────────────────────

    /**
     * Creates a trip on the server and starts tracking it.
     *
     * @throws IllegalStateException when a trip is already held
     * @throws TripCreationException when the server call fails; nothing is kept locally
     * @throws LocationException when tracking cannot start; the trip stays active
     */
    public TripState createTrip(TripRequest request) {
        synchronized (monitor) {
            if (state != null) {
                throw new IllegalStateException("Trip #" + state.getTripId() + " is still active");
            }
            if (creating) {
                throw new IllegalStateException("A trip is already being created");
            }
            creating = true;
        }

        Trip trip;
        try {
            log.info("Creating trip: site #{}, project #{}, loading area #{}, unloading area #{}",
                    request.getSiteId(), request.getProjectId(), request.getLoadingAreaId(), request.getUnloadingAreaId());
            trip = remoteTripService.create(toRequestDto(request));
        } catch (RuntimeException e) {
            synchronized (monitor) {
                creating = false;
            }
            log.error("Trip creation failed: {}", e.getMessage());
            telemetryService.record(null, TripEventType.TRIP_CREATION_FAILED, e.getMessage());
            throw new TripCreationException("Trip could not be created: " + e.getMessage(), e);
        }

        Trip started = trip.toBuilder().startTime(nowInServerZone()).build();
        try {
            cacheTrip(started);
            synchronized (monitor) {
                state = TripState.builder()
                        .trip(started)
                        .phase(TripPhase.ACTIVE)
                        .startTime(started.getStartTime())
                        .distanceMeters(0.0)
                        .build();
            }
        } finally {
            synchronized (monitor) {
                creating = false;
            }
        }
        log.info("Trip #{} created", started.getId());
        telemetryService.record(started.getId(), TripEventType.TRIP_STARTED, started.getMaterial());
        publishState();

        synchronizeTripState();
        startTracking(started);
        return currentTrip().orElse(null);
    }

    /**
     * Ends the active trip on the server, retrying a fixed number of times.
     *
     * @return false when an end of this trip is already in progress
     * @throws IllegalStateException when no trip is held
     * @throws TripCompletionException when every attempt failed; the trip stays active
     */
    public boolean endTrip(String message) {
        return endTrip(message, false);
    }

    private boolean endTrip(String message, boolean automatic) {
        Long tripId;
        synchronized (monitor) {
            if (state == null) {
                throw new IllegalStateException("No active trip to end");
            }
            if (!state.isActive()) {
                log.info("End of trip #{} already in progress", state.getTripId());
                return false;
            }
            state = state.toBuilder().phase(TripPhase.ENDING).build();
            tripId = state.getTripId();
        }
        publishState();

        RetryPolicy policy = RetryPolicy.fixed(endMaxAttempts, Duration.ofSeconds(endRetryDelaySeconds));
        boolean completed = retrier.execute("Completing trip #" + tripId, policy,
                attempt -> remoteTripService.complete(tripId));

        if (!completed) {
            restoreActive(tripId, TripPhase.ENDING);
            telemetryService.record(tripId, TripEventType.TRIP_COMPLETION_FAILED,
                    "complete failed after " + policy.getMaxAttempts() + " attempts");
            throw new TripCompletionException("Trip #" + tripId + " could not be completed, please try again");
        }

        telemetryService.record(tripId,
                automatic ? TripEventType.TRIP_AUTO_COMPLETED : TripEventType.TRIP_COMPLETED, message);
        if (teardown(tripId, true)) {
            notificationService.notify(message != null && !message.isBlank() ? message : "Trip completed");
            log.info("Trip #{} completed", tripId);
        } else {
            log.info("Trip #{} completed on the server after local state was already cleared", tripId);
        }
        return true;
    }

    /**
     * Force-ends the active trip with a reason. One server call, no retry.
     *
     * @param unloadingAreaId null for the trip's own unloading area
     * @return false when an end of this trip is already in progress
     */
    public boolean forceEndTrip(String reason, Long unloadingAreaId) {
        Long tripId;
        Long areaId;
        synchronized (monitor) {
            if (state == null) {
                throw new IllegalStateException("No active trip to force-end");
            }
            if (!state.isActive()) {
                log.info("End of trip #{} already in progress", state.getTripId());
                return false;
            }
            Trip trip = state.getTrip();
            areaId = unloadingAreaId != null ? unloadingAreaId
                    : trip.getUnloadingArea() != null ? trip.getUnloadingArea().getId() : null;
            if (areaId == null) {
                throw new IllegalArgumentException("Unloading area is required to force-end trip #" + trip.getId());
            }
            state = state.toBuilder().phase(TripPhase.FORCE_ENDING).build();
            tripId = state.getTripId();
        }
        publishState();

        try {
            remoteTripService.forceEnd(tripId, reason, areaId);
        } catch (RuntimeException e) {
            restoreActive(tripId, TripPhase.FORCE_ENDING);
            telemetryService.record(tripId, TripEventType.TRIP_COMPLETION_FAILED, "force end failed: " + e.getMessage());
            throw new TripCompletionException("Trip #" + tripId + " could not be force-ended: " + e.getMessage(), e);
        }

        telemetryService.record(tripId, TripEventType.TRIP_FORCE_ENDED, reason);
        if (teardown(tripId, awaitFinalSyncOnForceEnd)) {
            notificationService.notify("Trip ended: " + reason);
            log.info("Trip #{} force-ended ({})", tripId, reason);
        }
        return true;
    }

    /**
     * Sends new trip parameters. On success the held trip is replaced, keeping its
     * phase, distance and start time.
     *
     * @return false when the server call failed or the trip changed meanwhile
     */
    public boolean updateTrip(TripRequest request) {
        Long tripId;
        synchronized (monitor) {
            if (state == null) {
                throw new IllegalStateException("No active trip to update");
            }
            tripId = state.getTripId();
        }

        Trip updated;
        try {
            updated = remoteTripService.update(tripId, toRequestDto(request));
        } catch (RuntimeException e) {
            log.warn("Update of trip #{} failed: {}", tripId, e.getMessage());
            return false;
        }

        Trip merged;
        synchronized (monitor) {
            if (state == null || !tripId.equals(state.getTripId())) {
                log.warn("Trip #{} is no longer held, dropping update", tripId);
                return false;
            }
            merged = updated.toBuilder()
                    .id(tripId)
                    .startTime(state.getStartTime())
                    .distanceMeters(state.getDistanceMeters())
                    .build();
            state = state.toBuilder()
                    .trip(merged)
                    .distanceToLoadingMeters(null)
                    .distanceToUnloadingMeters(null)
                    .build();
        }
        cacheTrip(merged);
        trackingService.retarget(tripId,
                ProximityTarget.of(TargetKind.LOADING, merged.getLoadingArea()),
                ProximityTarget.of(TargetKind.UNLOADING, merged.getUnloadingArea()));
        telemetryService.record(tripId, TripEventType.TRIP_UPDATED, merged.getMaterial());
        publishState();
        return true;
    }

    /**
     * Starts the remote status poll if it is not running yet.
     */
    public void synchronizeTripState() {
        synchronized (monitor) {
            if (pollTask != null && !pollTask.isDone()) {
                return;
            }
            pollTask = trackingScheduler.scheduleAtFixedRate(this::pollRemoteState,
                    Duration.ofSeconds(pollIntervalSeconds));
        }
        log.debug("Remote trip status poll started ({} s)", pollIntervalSeconds);
    }

    /**
     * Restarts tracking of the held trip, e.g. after the driver granted location permission.
     */
    public TripState resumeTracking() {
        Trip trip;
        synchronized (monitor) {
            if (state == null) {
                throw new IllegalStateException("No active trip to track");
            }
            trip = state.getTrip();
        }
        startTracking(trip);
        return currentTrip().orElse(null);
    }

    /**
     * Resumes the driver's latest uncompleted trip after a restart.
     *
     * The server answer replaces the local cache. Without the server, a cached trip
     * is used only when it started less than {@code trip.recovery.max-age-hours} ago.
     */
    public Optional<TripState> recoverUncompletedTrip() {
        synchronized (monitor) {
            if (state != null || creating) {
                log.debug("Trip already held, skipping recovery");
                return Optional.ofNullable(state);
            }
        }

        Optional<Trip> found;
        try {
            found = remoteTripService.latestUncompleted(driverId);
            if (found.isPresent()) {
                tripCacheService.save(found.get());
            } else {
                tripCacheService.clear(driverId);
            }
        } catch (RuntimeException e) {
            log.warn("Could not fetch latest uncompleted trip: {}", e.getMessage());
            found = cachedTripWithinMaxAge();
        }

        Optional<Trip> resumable = found.filter(t -> t.getStatus() == TripStatus.UNCOMPLETED);
        if (resumable.isEmpty()) {
            log.info("No uncompleted trip to resume for driver #{}", driverId);
            return Optional.empty();
        }

        Trip trip = resumable.get();
        if (trip.getStartTime() == null) {
            trip = trip.toBuilder().startTime(nowInServerZone()).build();
        }
        synchronized (monitor) {
            if (state != null) {
                return Optional.of(state);
            }
            state = TripState.builder()
                    .trip(trip)
                    .phase(TripPhase.ACTIVE)
                    .startTime(trip.getStartTime())
                    .distanceMeters(trip.getDistanceMeters())
                    .build();
        }
        log.info("Resuming trip #{} started {}", trip.getId(), trip.getStartTime());
        telemetryService.record(trip.getId(), TripEventType.TRIP_RECOVERED, "started " + trip.getStartTime());
        publishState();

        synchronizeTripState();
        try {
            startTracking(trip);
        } catch (LocationException e) {
            log.warn("Trip #{} resumed without tracking: {}", trip.getId(), e.getMessage());
        }
        return currentTrip();
    }

    // ── Tracking callbacks ────────────────────────────────────────────────────

    @Override
    public void onDistanceChanged(Long tripId, double distanceMeters) {
        if (updateIfHeld(tripId, s -> s.toBuilder().distanceMeters(distanceMeters).build())) {
            publishState();
        }
    }

    @Override
    public void onTargetDistances(Long tripId, Double toLoadingMeters, Double toUnloadingMeters) {
        if (updateIfHeld(tripId, s -> s.toBuilder()
                .distanceToLoadingMeters(toLoadingMeters)
                .distanceToUnloadingMeters(toUnloadingMeters)
                .build())) {
            publishState();
        }
    }

    @Override
    public void onAutoEndRequested(Long tripId) {
        locationTaskExecutor.execute(() -> {
            synchronized (monitor) {
                if (state == null || !tripId.equals(state.getTripId()) || !state.isActive()) {
                    return;
                }
            }
            try {
                endTrip(autoEndMessage, true);
            } catch (TripCompletionException | IllegalStateException e) {
                log.warn("Automatic end of trip #{} failed: {}", tripId, e.getMessage());
            }
        });
    }

    // ── Internals ─────────────────────────────────────────────────────────────

    /** One poll tick. */
    void pollRemoteState() {
        Long tripId;
        synchronized (monitor) {
            if (state == null) {
                return;
            }
            tripId = state.getTripId();
        }
        if (!connectivityChecker.isOnline()) {
            log.debug("Offline, skipping status poll of trip #{}", tripId);
            return;
        }

        TripStatus status;
        try {
            status = remoteTripService.getStatus(tripId);
        } catch (RuntimeException e) {
            log.warn("Status poll of trip #{} failed: {}", tripId, e.getMessage());
            return;
        }
        if (status.isRemoteTermination()) {
            handleRemoteTermination(tripId, status);
        }
    }

    private void handleRemoteTermination(Long tripId, TripStatus status) {
        if (!teardown(tripId, false)) {
            return;
        }
        String message = status == TripStatus.FORCE
                ? "Trip #" + tripId + " was force-ended by the office"
                : "Trip #" + tripId + " was cancelled by the office";
        TripTerminationNotice notice = new TripTerminationNotice(tripId, status, message, LocalDateTime.now(clock));
        terminationNotice.set(notice);
        tripStatePublisher.publishTermination(notice);
        notificationService.notify(message);
        telemetryService.record(tripId, TripEventType.TRIP_REMOTE_TERMINATED, status.name());
        log.warn("Trip #{} terminated by the server ({})", tripId, status);
    }

    /**
     * Clears the slot if it still holds {@code tripId}, then stops polling and tracking
     * and drops the cached trip and history.
     *
     * @return false if another exit already tore this trip down
     */
    boolean teardown(Long tripId, boolean awaitFinalSync) {
        ScheduledFuture<?> poll;
        synchronized (monitor) {
            if (state == null || !tripId.equals(state.getTripId())) {
                return false;
            }
            state = null;
            poll = pollTask;
            pollTask = null;
        }
        if (poll != null) {
            poll.cancel(false);
        }

        CompletableFuture<Boolean> finalSync = trackingService.stop(tripId);
        tripHistoryService.evictAll();
        clearCachedTrip();
        publishState();

        if (awaitFinalSync) {
            try {
                boolean synced = finalSync.join();
                log.info("Final GPS sync of trip #{} {}", tripId, synced ? "succeeded" : "failed, data kept locally");
            } catch (CompletionException e) {
                log.error("Final GPS sync of trip #{} failed: {}", tripId, e.getMessage());
            }
        }
        return true;
    }

    private void startTracking(Trip trip) {
        try {
            trackingService.start(trip.getId(),
                    ProximityTarget.of(TargetKind.LOADING, trip.getLoadingArea()),
                    ProximityTarget.of(TargetKind.UNLOADING, trip.getUnloadingArea()),
                    this);
        } catch (LocationException e) {
            log.warn("Tracking of trip #{} could not start: {} ({})", trip.getId(), e.getMessage(), e.getType());
            updateIfHeld(trip.getId(), s -> s.toBuilder().tracking(false).build());
            publishState();
            throw e;
        }
        if (updateIfHeld(trip.getId(), s -> s.toBuilder().tracking(true).build())) {
            publishState();
        }
    }

    private void restoreActive(Long tripId, TripPhase expected) {
        boolean restored = updateIfHeld(tripId,
                s -> s.getPhase() == expected ? s.toBuilder().phase(TripPhase.ACTIVE).build() : s);
        if (restored) {
            publishState();
        }
    }

    private boolean updateIfHeld(Long tripId, UnaryOperator<TripState> change) {
        synchronized (monitor) {
            if (state == null || !tripId.equals(state.getTripId())) {
                return false;
            }
            state = change.apply(state);
            return true;
        }
    }

    // the server holds the trip either way, the local copy only serves offline recovery
    private void cacheTrip(Trip trip) {
        try {
            tripCacheService.save(trip);
        } catch (RuntimeException e) {
            log.error("Could not cache trip #{} locally: {}", trip.getId(), e.getMessage());
        }
    }

    private void clearCachedTrip() {
        try {
            tripCacheService.clear(driverId);
        } catch (RuntimeException e) {
            log.error("Could not remove cached trip of driver #{}: {}", driverId, e.getMessage());
        }
    }

    private void publishState() {
        tripStatePublisher.publishState(currentTrip().orElse(null));
    }

    private Optional<Trip> cachedTripWithinMaxAge() {
        Optional<Trip> cached = tripCacheService.load(driverId);
        if (cached.isEmpty()) {
            return Optional.empty();
        }
        Trip trip = cached.get();
        LocalDateTime startTime = trip.getStartTime();
        if (startTime != null
                && Duration.between(startTime, nowInServerZone()).compareTo(Duration.ofHours(recoveryMaxAgeHours)) < 0) {
            log.info("Using cached trip #{} (started {})", trip.getId(), startTime);
            return cached;
        }
        log.warn("Cached trip #{} is older than {} h (started {}), discarding", trip.getId(), recoveryMaxAgeHours, startTime);
        telemetryService.record(trip.getId(), TripEventType.TRIP_CACHE_EXPIRED, "started " + startTime);
        tripCacheService.clear(driverId);
        return Optional.empty();
    }

    private TripRequestDto toRequestDto(TripRequest request) {
        return TripRequestDto.builder()
                .driverId(driverId)
                .material(request.getMaterial())
                .loadingAreaId(request.getLoadingAreaId())
                .unloadingAreaId(request.getUnloadingAreaId())
                .projectId(request.getProjectId())
                .build();
    }

    private LocalDateTime nowInServerZone() {
        return LocalDateTime.now(clock.withZone(ZoneId.of(remoteZone)));
    }
}
