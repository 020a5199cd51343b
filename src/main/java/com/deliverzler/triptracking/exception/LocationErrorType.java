package com.deliverzler.triptracking.exception;

public enum LocationErrorType {
    SERVICE_DISABLED,
    PERMISSION_DENIED,
    PERMISSION_TIMEOUT
}
