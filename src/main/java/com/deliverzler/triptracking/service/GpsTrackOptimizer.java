package com.deliverzler.triptracking.service;

import com.deliverzler.triptracking.entity.GpsPoint;
import com.deliverzler.triptracking.model.TrackPoint;
import com.deliverzler.triptracking.util.GeoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Distance pipeline over the stored track of a trip:
 *   1. drop points without speed (the first point always stays)
 *   2. centered moving average, endpoints untouched
 *   3. Douglas-Peucker simplification on cross-track distance
 *   4. sum of haversine distances over what is left
 *
 * Stateless; safe to call from any thread.
 */
@Component
@Slf4j
public class GpsTrackOptimizer {

    public static final int SMOOTHING_WINDOW = 3;

    @Value("${gps.optimizer.tolerance-meters:0.00005}")
    private double toleranceMeters = 0.00005;

    /** Total distance of a stored track in meters. */
    public double totalDistanceMeters(List<GpsPoint> history) {
        List<TrackPoint> track = new ArrayList<>(history.size());
        for (GpsPoint p : history) {
            track.add(new TrackPoint(p.getLatitude(), p.getLongitude(), p.getSpeed()));
        }
        return distanceMeters(optimize(track));
    }

    public List<TrackPoint> optimize(List<TrackPoint> track) {
        List<TrackPoint> moving = removeStationary(track);
        List<TrackPoint> smoothed = smooth(moving, SMOOTHING_WINDOW);
        List<TrackPoint> simplified = simplify(smoothed, toleranceMeters);
        log.trace("Track optimized: {} raw, {} moving, {} simplified",
                track.size(), moving.size(), simplified.size());
        return simplified;
    }

    /** Keeps the first point plus every point with a positive speed. */
    public List<TrackPoint> removeStationary(List<TrackPoint> track) {
        if (track.isEmpty()) {
            return List.of();
        }
        List<TrackPoint> result = new ArrayList<>();
        result.add(track.get(0));
        for (int i = 1; i < track.size(); i++) {
            Double speed = track.get(i).getSpeed();
            if (speed != null && speed > 0) {
                result.add(track.get(i));
            }
        }
        return result;
    }

    /**
     * Centered moving average of latitude and longitude. Tracks no longer than the
     * window come back unchanged.
     */
    public List<TrackPoint> smooth(List<TrackPoint> track, int window) {
        if (track.size() <= window) {
            return new ArrayList<>(track);
        }
        int half = window / 2;
        List<TrackPoint> result = new ArrayList<>(track.size());
        result.add(track.get(0));
        for (int i = half; i < track.size() - half; i++) {
            double sumLat = 0;
            double sumLon = 0;
            for (int j = i - half; j <= i + half; j++) {
                sumLat += track.get(j).getLatitude();
                sumLon += track.get(j).getLongitude();
            }
            result.add(track.get(i).withCoordinates(sumLat / window, sumLon / window));
        }
        result.add(track.get(track.size() - 1));
        return result;
    }

    /** Douglas-Peucker: keep the farthest point from the chord while it exceeds the tolerance. */
    public List<TrackPoint> simplify(List<TrackPoint> track, double tolerance) {
        if (track.size() <= 2) {
            return new ArrayList<>(track);
        }
        TrackPoint first = track.get(0);
        TrackPoint last = track.get(track.size() - 1);

        int indexMax = 0;
        double maxDistance = 0;
        for (int i = 1; i < track.size() - 1; i++) {
            TrackPoint p = track.get(i);
            double d = GeoUtil.crossTrackMeters(p.getLatitude(), p.getLongitude(),
                    first.getLatitude(), first.getLongitude(),
                    last.getLatitude(), last.getLongitude());
            if (d > maxDistance) {
                indexMax = i;
                maxDistance = d;
            }
        }

        if (maxDistance <= tolerance) {
            return new ArrayList<>(List.of(first, last));
        }
        List<TrackPoint> left = simplify(track.subList(0, indexMax + 1), tolerance);
        List<TrackPoint> right = simplify(track.subList(indexMax, track.size()), tolerance);

        List<TrackPoint> result = new ArrayList<>(left.subList(0, left.size() - 1));
        result.addAll(right);
        return result;
    }

    public double distanceMeters(List<TrackPoint> track) {
        double distance = 0;
        for (int i = 1; i < track.size(); i++) {
            TrackPoint a = track.get(i - 1);
            TrackPoint b = track.get(i);
            distance += GeoUtil.haversineMeters(a.getLatitude(), a.getLongitude(), b.getLatitude(), b.getLongitude());
        }
        return distance;
    }
}
