package com.deliverzler.triptracking.service;

import lombok.Value;

/**
 * Outcome of one proximity check. Distances are null for a target without coordinates.
 */
@Value
public class ProximityReport {

    Double distanceToLoadingMeters;
    Double distanceToUnloadingMeters;
    boolean autoEndRequested;
}
