package com.deliverzler.triptracking.model;

import java.util.Locale;

/**
 * Trip status as reported by the trip server.
 */
public enum TripStatus {
    UNCOMPLETED,
    COMPLETED,
    FORCE,
    CANCEL,
    UNKNOWN;

    /** Case-insensitive parse of the server's status string; anything unrecognised is UNKNOWN. */
    public static TripStatus fromRemote(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    /** FORCE and CANCEL are server-side terminations the device must obey. */
    public boolean isRemoteTermination() {
        return this == FORCE || this == CANCEL;
    }
}
