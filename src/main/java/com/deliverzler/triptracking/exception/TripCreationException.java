package com.deliverzler.triptracking.exception;

/**
 * The trip server did not create the trip; no local trip exists.
 */
public class TripCreationException extends RuntimeException {

    public TripCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
