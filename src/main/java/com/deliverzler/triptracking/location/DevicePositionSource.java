package com.deliverzler.triptracking.location;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Position source fed by the driver's device.
 *
 * The device app posts fixes, stream failures and its location service / permission
 * state through {@code PositionController}; this class fans them out to subscribers.
 */
@Component
@Slf4j
public class DevicePositionSource implements PositionSource {

    private final List<DeviceSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final Object statusLock = new Object();

    private volatile Position lastKnown;
    private boolean serviceEnabled = true;
    private PermissionStatus permission = PermissionStatus.UNDETERMINED;

    @Override
    public Subscription subscribe(Consumer<Position> onUpdate, Consumer<Throwable> onError) {
        DeviceSubscription subscription = new DeviceSubscription(onUpdate, onError);
        subscriptions.add(subscription);
        log.debug("Position subscription opened ({} live)", subscriptions.size());
        return subscription;
    }

    @Override
    public Optional<Position> getOnce() {
        return Optional.ofNullable(lastKnown);
    }

    @Override
    public boolean isServiceEnabled() {
        synchronized (statusLock) {
            return serviceEnabled;
        }
    }

    @Override
    public PermissionStatus requestPermission(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (statusLock) {
            while (permission == PermissionStatus.UNDETERMINED) {
                long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
                if (remainingMs <= 0) {
                    log.warn("No location permission answer within {} s", timeout.toSeconds());
                    return PermissionStatus.UNDETERMINED;
                }
                try {
                    statusLock.wait(remainingMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return PermissionStatus.UNDETERMINED;
                }
            }
            return permission;
        }
    }

    /** Device reported its location service switch and permission state. */
    public void updateStatus(boolean enabled, PermissionStatus status) {
        synchronized (statusLock) {
            this.serviceEnabled = enabled;
            if (status != null) {
                this.permission = status;
            }
            statusLock.notifyAll();
        }
        log.info("Device location status: service={}, permission={}", enabled, status);
    }

    /** Fan a new fix out to every live subscriber. */
    public void publish(Position position) {
        lastKnown = position;
        for (DeviceSubscription subscription : subscriptions) {
            subscription.deliver(position);
        }
    }

    /** Device reported that its position stream broke. */
    public void publishError(Throwable error) {
        log.warn("Device position stream error: {}", error.getMessage());
        for (DeviceSubscription subscription : subscriptions) {
            subscription.fail(error);
        }
    }

    public int liveSubscriptions() {
        return subscriptions.size();
    }

    private final class DeviceSubscription implements Subscription {

        private final Consumer<Position> onUpdate;
        private final Consumer<Throwable> onError;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private DeviceSubscription(Consumer<Position> onUpdate, Consumer<Throwable> onError) {
            this.onUpdate = onUpdate;
            this.onError = onError;
        }

        private void deliver(Position position) {
            if (!active.get()) {
                return;
            }
            try {
                onUpdate.accept(position);
            } catch (RuntimeException e) {
                log.error("Position subscriber failed: {}", e.getMessage(), e);
            }
        }

        private void fail(Throwable error) {
            if (active.get()) {
                onError.accept(error);
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void close() {
            if (active.compareAndSet(true, false)) {
                subscriptions.remove(this);
                log.debug("Position subscription closed ({} live)", subscriptions.size());
            }
        }
    }
}
