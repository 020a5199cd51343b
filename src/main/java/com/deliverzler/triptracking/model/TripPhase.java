package com.deliverzler.triptracking.model;

/**
 * Phase of a held trip. No held trip at all means the machine is idle.
 */
public enum TripPhase {
    ACTIVE,
    ENDING,
    FORCE_ENDING
}
