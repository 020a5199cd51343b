package com.deliverzler.triptracking.util;

import java.time.Duration;

/**
 * Blocking pause between retry attempts. Tests substitute a recording no-op.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
