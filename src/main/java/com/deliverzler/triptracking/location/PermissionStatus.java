package com.deliverzler.triptracking.location;

public enum PermissionStatus {
    GRANTED,
    DENIED,
    UNDETERMINED
}
