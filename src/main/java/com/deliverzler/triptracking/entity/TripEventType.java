package com.deliverzler.triptracking.entity;

/**
 * Typed telemetry events recorded in {@link TripEvent}.
 */
public enum TripEventType {
    TRIP_STARTED,
    TRIP_RECOVERED,
    TRIP_UPDATED,
    LOADING_ARRIVED,
    UNLOADING_ARRIVED,
    TRIP_COMPLETED,
    TRIP_AUTO_COMPLETED,
    TRIP_FORCE_ENDED,
    TRIP_REMOTE_TERMINATED,
    TRIP_CREATION_FAILED,
    TRIP_COMPLETION_FAILED,
    GPS_SYNC_FAILED,
    LOCATION_UNAVAILABLE,
    LOCATION_STREAM_ERROR,
    LOCATION_STREAM_STALE,
    TRIP_CACHE_EXPIRED
}
