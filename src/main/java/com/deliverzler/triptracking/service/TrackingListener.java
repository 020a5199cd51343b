package com.deliverzler.triptracking.service;

/**
 * Callbacks from the tracking loop to whoever owns the trip. Called on the
 * tracking-loop thread, so implementations must not block.
 */
public interface TrackingListener {

    void onDistanceChanged(Long tripId, double distanceMeters);

    void onTargetDistances(Long tripId, Double toLoadingMeters, Double toUnloadingMeters);

    void onAutoEndRequested(Long tripId);
}
