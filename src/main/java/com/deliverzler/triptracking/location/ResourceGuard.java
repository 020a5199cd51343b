package com.deliverzler.triptracking.location;

/**
 * Holds a device resource (the tracking wake lock) for as long as a lease is open.
 */
public interface ResourceGuard {

    Lease acquire(String owner);

    /** Open lease on the guarded resource. {@link #close()} releases it once; later calls do nothing. */
    interface Lease extends AutoCloseable {

        boolean isHeld();

        @Override
        void close();
    }
}
