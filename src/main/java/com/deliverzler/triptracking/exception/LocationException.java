package com.deliverzler.triptracking.exception;

import lombok.Getter;

/**
 * Location tracking cannot start. Reported to the caller, never retried automatically.
 */
@Getter
public class LocationException extends RuntimeException {

    private final LocationErrorType type;

    public LocationException(LocationErrorType type, String message) {
        super(message);
        this.type = type;
    }
}
