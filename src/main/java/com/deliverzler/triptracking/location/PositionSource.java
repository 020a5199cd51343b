package com.deliverzler.triptracking.location;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Source of device positions consumed by the tracking loop.
 */
public interface PositionSource {

    /**
     * Starts delivering positions to {@code onUpdate}. Stream failures go to
     * {@code onError}; the subscription stays registered until closed.
     */
    Subscription subscribe(Consumer<Position> onUpdate, Consumer<Throwable> onError);

    /** Single-shot fetch, empty when no fix is available. */
    Optional<Position> getOnce();

    boolean isServiceEnabled();

    /**
     * Asks for location permission, waiting at most {@code timeout} for an answer.
     * Returns {@link PermissionStatus#UNDETERMINED} on timeout.
     */
    PermissionStatus requestPermission(Duration timeout);
}
