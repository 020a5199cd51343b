package com.deliverzler.triptracking.exception;

/**
 * Ending (or force-ending) the trip failed on the server. The trip stays active
 * and the driver may retry.
 */
public class TripCompletionException extends RuntimeException {

    public TripCompletionException(String message) {
        super(message);
    }

    public TripCompletionException(String message, Throwable cause) {
        super(message, cause);
    }
}
