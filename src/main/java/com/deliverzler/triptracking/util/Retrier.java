package com.deliverzler.triptracking.util;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Runs an action under a {@link RetryPolicy}.
 *
 * An attempt fails when the action returns {@code false} or throws. When a
 * precondition is given and does not hold at the start of an attempt, the attempt
 * is skipped without calling the action but still counts against the policy.
 */
@Slf4j
@RequiredArgsConstructor
public class Retrier {

    private final Sleeper sleeper;

    @FunctionalInterface
    public interface Action {
        boolean attempt(int attempt) throws Exception;
    }

    public boolean execute(String operation, RetryPolicy policy, Action action) {
        return execute(operation, policy, () -> true, action);
    }

    public boolean execute(String operation, RetryPolicy policy, BooleanSupplier precondition, Action action) {
        for (int attempt = 1; attempt <= policy.getMaxAttempts(); attempt++) {
            if (precondition.getAsBoolean()) {
                try {
                    if (action.attempt(attempt)) {
                        log.debug("{} succeeded on attempt {}/{}", operation, attempt, policy.getMaxAttempts());
                        return true;
                    }
                    log.warn("{} failed (attempt {}/{})", operation, attempt, policy.getMaxAttempts());
                } catch (Exception e) {
                    log.warn("{} failed (attempt {}/{}): {}", operation, attempt, policy.getMaxAttempts(), e.getMessage());
                }
            } else {
                log.warn("{} skipped, precondition not met (attempt {}/{})", operation, attempt, policy.getMaxAttempts());
            }

            if (attempt < policy.getMaxAttempts()) {
                Duration delay = policy.delayAfter(attempt);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("{} interrupted while waiting {} ms before retry", operation, delay.toMillis());
                    return false;
                }
            }
        }
        log.error("{} gave up after {} attempts", operation, policy.getMaxAttempts());
        return false;
    }
}
