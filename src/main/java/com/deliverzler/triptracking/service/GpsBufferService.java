package com.deliverzler.triptracking.service;

import com.deliverzler.triptracking.entity.GpsPoint;
import com.deliverzler.triptracking.repository.GpsPointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Durable local buffer of captured GPS points.
 *
 * A point stays here until its trip is torn down and every point is confirmed on
 * the server. Only the synced flag is ever updated.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GpsBufferService {

    private final GpsPointRepository gpsPointRepository;

    /**
     * Appends one point. The timestamp is truncated to seconds and clamped so it
     * never precedes the trip's latest stored point.
     */
    @Transactional
    public GpsPoint append(Long tripId, double latitude, double longitude, Double speed,
                           double distanceDelta, LocalDateTime timestamp) {
        GpsPoint point = GpsPoint.builder()
                .tripId(tripId)
                .latitude(latitude)
                .longitude(longitude)
                .speed(speed)
                .distanceDelta(distanceDelta)
                .timestamp(clamp(tripId, timestamp))
                .synced(false)
                .build();
        return gpsPointRepository.save(point);
    }

    /** Batch insert of points, in the given order. */
    @Transactional
    public List<GpsPoint> appendAll(List<GpsPoint> points) {
        List<GpsPoint> saved = new ArrayList<>(points.size());
        for (GpsPoint p : points) {
            saved.add(append(p.getTripId(), p.getLatitude(), p.getLongitude(), p.getSpeed(),
                    p.getDistanceDelta(), p.getTimestamp()));
        }
        return saved;
    }

    @Transactional(readOnly = true)
    public List<GpsPoint> unsynced(Long tripId) {
        return gpsPointRepository.findByTripIdAndSyncedFalseOrderByTimestampAscIdAsc(tripId);
    }

    @Transactional(readOnly = true)
    public long countUnsynced(Long tripId) {
        return gpsPointRepository.countByTripIdAndSyncedFalse(tripId);
    }

    @Transactional(readOnly = true)
    public long countSynced(Long tripId) {
        return gpsPointRepository.countByTripIdAndSyncedTrue(tripId);
    }

    /** Whole stored track of a trip, oldest first. */
    @Transactional(readOnly = true)
    public List<GpsPoint> history(Long tripId) {
        return gpsPointRepository.findByTripIdOrderByTimestampAscIdAsc(tripId);
    }

    /** Marks exactly the given points synced; already-synced ids are left alone. */
    @Transactional
    public int markSynced(Collection<Long> pointIds) {
        if (pointIds.isEmpty()) {
            return 0;
        }
        int updated = gpsPointRepository.markSynced(pointIds);
        log.debug("Marked {} point(s) synced", updated);
        return updated;
    }

    @Transactional
    public int deleteByTrip(Long tripId) {
        int deleted = gpsPointRepository.deleteAllByTripId(tripId);
        log.info("Deleted {} buffered point(s) of trip #{}", deleted, tripId);
        return deleted;
    }

    @Transactional(readOnly = true)
    public boolean hasUnsyncedData() {
        return gpsPointRepository.existsBySyncedFalse();
    }

    @Transactional(readOnly = true)
    public List<Long> tripsWithUnsyncedData() {
        return gpsPointRepository.findTripIdsWithUnsyncedPoints();
    }

    private LocalDateTime clamp(Long tripId, LocalDateTime timestamp) {
        LocalDateTime truncated = timestamp.truncatedTo(ChronoUnit.SECONDS);
        return gpsPointRepository.findTopByTripIdOrderByTimestampDescIdDesc(tripId)
                .map(GpsPoint::getTimestamp)
                .filter(latest -> latest.isAfter(truncated))
                .orElse(truncated);
    }
}
