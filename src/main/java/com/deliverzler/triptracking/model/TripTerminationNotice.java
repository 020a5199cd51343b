package com.deliverzler.triptracking.model;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * Raised once when the server force-ends or cancels the trip the device is running.
 */
@Value
public class TripTerminationNotice {

    Long tripId;
    TripStatus status;
    String message;
    LocalDateTime detectedAt;
}
