package com.deliverzler.triptracking.exception;

import lombok.Getter;

/**
 * Network or server failure talking to the trip/GPS server.
 * {@code status} is null when no HTTP response was received.
 */
@Getter
public class RemoteServiceException extends RuntimeException {

    private final Integer status;

    public RemoteServiceException(String message) {
        super(message);
        this.status = null;
    }

    public RemoteServiceException(String message, Integer status) {
        super(message);
        this.status = status;
    }

    public RemoteServiceException(String message, Throwable cause) {
        super(message, cause);
        this.status = null;
    }
}
