package com.deliverzler.triptracking.model;

/**
 * NORMAL leaves ending the trip to the driver, SMART ends it automatically on
 * arrival at the unloading area.
 */
public enum DriveMode {
    NORMAL,
    SMART
}
