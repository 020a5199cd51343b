package com.deliverzler.triptracking.util;

import lombok.Value;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable retry policy: a bounded number of attempts and the delay to wait after
 * each failed attempt. {@code backoffSchedule.get(n - 1)} is the wait after attempt
 * {@code n}; when the schedule is shorter than needed its last entry is reused.
 */
@Value
public class RetryPolicy {

    int maxAttempts;
    List<Duration> backoffSchedule;

    public RetryPolicy(int maxAttempts, List<Duration> backoffSchedule) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.backoffSchedule = List.copyOf(backoffSchedule);
    }

    /** Same delay between every attempt. */
    public static RetryPolicy fixed(int maxAttempts, Duration delay) {
        return new RetryPolicy(maxAttempts, List.of(delay));
    }

    /** Delay grows by {@code step} after every attempt: step, 2*step, 3*step ... */
    public static RetryPolicy linear(int maxAttempts, Duration step) {
        List<Duration> schedule = new ArrayList<>();
        for (int i = 1; i < maxAttempts; i++) {
            schedule.add(step.multipliedBy(i));
        }
        return new RetryPolicy(maxAttempts, schedule);
    }

    /** Wait after the given (1-based) failed attempt. */
    public Duration delayAfter(int attempt) {
        if (backoffSchedule.isEmpty()) {
            return Duration.ZERO;
        }
        int index = Math.min(attempt, backoffSchedule.size()) - 1;
        return backoffSchedule.get(Math.max(index, 0));
    }
}
