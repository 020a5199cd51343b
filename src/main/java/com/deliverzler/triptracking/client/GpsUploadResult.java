package com.deliverzler.triptracking.client;

public enum GpsUploadResult {
    ACCEPTED,
    /** HTTP 406: the server already holds these points */
    ALREADY_RECEIVED,
    FAILED;

    public boolean isSuccess() {
        return this != FAILED;
    }
}
