package com.deliverzler.triptracking.service;

import com.deliverzler.triptracking.location.Position;
import com.deliverzler.triptracking.location.ResourceGuard;
import com.deliverzler.triptracking.location.Subscription;
import com.deliverzler.triptracking.model.ProximityTarget;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Everything owned by one tracking run of one trip: the position subscription,
 * the watchdog, the wake lock lease and the last accepted position.
 *
 * {@link #close()} releases all of it exactly once.
 */
@Getter
class TrackingSession implements AutoCloseable {

    private final Long tripId;
    private final TrackingListener listener;
    private final ResourceGuard.Lease lease;

    @Setter
    private volatile ProximityTarget loadingTarget;
    @Setter
    private volatile ProximityTarget unloadingTarget;

    // previous accepted position, the anchor for the next distance delta
    @Setter
    private volatile Position anchor;
    @Setter
    private volatile Instant lastUpdate;

    private volatile Subscription subscription;
    private volatile ScheduledFuture<?> watchdog;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean closed = new AtomicBoolean(false);
    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean resubscribePending = new AtomicBoolean(false);

    TrackingSession(Long tripId, ProximityTarget loadingTarget, ProximityTarget unloadingTarget,
                    TrackingListener listener, ResourceGuard.Lease lease) {
        this.tripId = tripId;
        this.loadingTarget = loadingTarget;
        this.unloadingTarget = unloadingTarget;
        this.listener = listener;
        this.lease = lease;
    }

    boolean isClosed() {
        return closed.get();
    }

    /** Swaps in a new subscription, closing the previous one. */
    synchronized void replaceSubscription(Subscription next) {
        Subscription previous = this.subscription;
        this.subscription = next;
        if (previous != null) {
            previous.close();
        }
        if (closed.get() && next != null) {
            next.close();
        }
    }

    synchronized void setWatchdog(ScheduledFuture<?> watchdog) {
        this.watchdog = watchdog;
        if (closed.get() && watchdog != null) {
            watchdog.cancel(false);
        }
    }

    boolean markResubscribePending() {
        return resubscribePending.compareAndSet(false, true);
    }

    void clearResubscribePending() {
        resubscribePending.set(false);
    }

    @Override
    public synchronized void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (subscription != null) {
            subscription.close();
        }
        if (watchdog != null) {
            watchdog.cancel(false);
        }
        lease.close();
    }
}
