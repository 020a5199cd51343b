package com.deliverzler.triptracking.location;

/**
 * Handle of a live position subscription. Closing twice is harmless.
 */
public interface Subscription extends AutoCloseable {

    boolean isActive();

    @Override
    void close();
}
