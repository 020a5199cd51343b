package com.deliverzler.triptracking.service;

import com.deliverzler.triptracking.client.ConnectivityChecker;
import com.deliverzler.triptracking.client.GpsUploadResult;
import com.deliverzler.triptracking.client.RemoteGpsService;
import com.deliverzler.triptracking.entity.GpsPoint;
import com.deliverzler.triptracking.entity.TripEventType;
import com.deliverzler.triptracking.util.Retrier;
import com.deliverzler.triptracking.util.RetryPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Moves buffered GPS points to the server.
 *
 * Threshold sync: one upload once a trip has a full batch of unsynced points,
 * skipped while offline or while another threshold upload is running.
 * Final sync: bounded retries with linear backoff when the trip stops; on success
 * the trip's points are deleted, on failure they stay for a manual resync.
 *
 * Delivery is at-least-once. Points are marked synced by id, only after the
 * server accepted exactly that batch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GpsSyncService {

    private final GpsBufferService gpsBufferService;
    private final RemoteGpsService remoteGpsService;
    private final ConnectivityChecker connectivityChecker;
    private final Retrier retrier;
    private final TelemetryService telemetryService;

    private final AtomicBoolean syncing = new AtomicBoolean(false);

    @Value("${gps.sync.batch-size:10}")
    private int batchSize = 10;

    @Value("${gps.sync.final-attempts:5}")
    private int finalAttempts = 5;

    @Value("${gps.sync.final-backoff-step-seconds:2}")
    private long finalBackoffStepSeconds = 2;

    /**
     * Uploads the trip's unsynced points when there are at least a batch of them.
     *
     * @return true if a batch was uploaded and marked synced
     */
    public boolean syncIfThresholdReached(Long tripId) {
        if (!syncing.compareAndSet(false, true)) {
            log.debug("GPS sync already in flight, skipping trigger for trip #{}", tripId);
            return false;
        }
        try {
            long unsynced = gpsBufferService.countUnsynced(tripId);
            if (unsynced < batchSize) {
                return false;
            }
            if (!connectivityChecker.isOnline()) {
                log.debug("Offline, deferring {} unsynced point(s) of trip #{}", unsynced, tripId);
                return false;
            }
            boolean ok = uploadUnsynced(tripId);
            if (!ok) {
                log.warn("Threshold GPS sync failed for trip #{}, {} point(s) stay unsynced", tripId, unsynced);
            }
            return ok;
        } finally {
            syncing.set(false);
        }
    }

    /**
     * Final sync of a stopped trip. Nothing unsynced is an immediate success.
     * Deletes the trip's points on success; records GPS_SYNC_FAILED and keeps them otherwise.
     */
    public boolean finalSync(Long tripId) {
        return resync(tripId, false);
    }

    /**
     * Retried upload of every unsynced point of a trip.
     *
     * @param keepPoints true for the trip still being tracked, whose history must survive
     */
    public boolean resync(Long tripId, boolean keepPoints) {
        if (gpsBufferService.countUnsynced(tripId) == 0) {
            log.info("No unsynced GPS data for trip #{}", tripId);
            if (!keepPoints) {
                gpsBufferService.deleteByTrip(tripId);
            }
            return true;
        }

        RetryPolicy policy = RetryPolicy.linear(finalAttempts, Duration.ofSeconds(finalBackoffStepSeconds));
        boolean ok = retrier.execute("GPS sync of trip #" + tripId, policy,
                connectivityChecker::isOnline, attempt -> uploadUnsynced(tripId));

        if (ok) {
            log.info("All GPS data of trip #{} confirmed by the server", tripId);
            if (!keepPoints) {
                gpsBufferService.deleteByTrip(tripId);
            }
        } else {
            long left = gpsBufferService.countUnsynced(tripId);
            log.error("GPS sync of trip #{} gave up, {} point(s) kept for manual resync", tripId, left);
            telemetryService.record(tripId, TripEventType.GPS_SYNC_FAILED,
                    left + " unsynced point(s) after " + policy.getMaxAttempts() + " attempts");
        }
        return ok;
    }

    /**
     * Resyncs every trip holding unsynced points.
     *
     * @param activeTripId trip currently tracked (its points are kept), may be null
     * @return outcome per trip id
     */
    public Map<Long, Boolean> resyncAll(Long activeTripId) {
        Map<Long, Boolean> outcome = new LinkedHashMap<>();
        for (Long tripId : gpsBufferService.tripsWithUnsyncedData()) {
            outcome.put(tripId, resync(tripId, Objects.equals(tripId, activeTripId)));
        }
        return outcome;
    }

    /** Unsynced point count per trip; empty when everything reached the server. */
    public Map<Long, Long> pendingSummary() {
        Map<Long, Long> pending = new LinkedHashMap<>();
        for (Long tripId : gpsBufferService.tripsWithUnsyncedData()) {
            pending.put(tripId, gpsBufferService.countUnsynced(tripId));
        }
        return pending;
    }

    public boolean hasUnsyncedData() {
        return gpsBufferService.hasUnsyncedData();
    }

    private boolean uploadUnsynced(Long tripId) {
        List<GpsPoint> batch = gpsBufferService.unsynced(tripId);
        if (batch.isEmpty()) {
            return true;
        }
        GpsUploadResult result = remoteGpsService.uploadBatch(tripId, batch);
        if (!result.isSuccess()) {
            return false;
        }
        List<Long> ids = batch.stream().map(GpsPoint::getId).toList();
        gpsBufferService.markSynced(ids);
        log.info("Synced {} GPS point(s) of trip #{} ({})", ids.size(), tripId, result);
        return true;
    }
}
