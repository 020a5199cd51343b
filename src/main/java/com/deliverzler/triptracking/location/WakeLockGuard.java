package com.deliverzler.triptracking.location;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps the tracking process awake while a trip is tracked. The resource is held
 * while at least one lease is open.
 */
@Component
@Slf4j
public class WakeLockGuard implements ResourceGuard {

    private final AtomicInteger held = new AtomicInteger();

    @Override
    public Lease acquire(String owner) {
        int count = held.incrementAndGet();
        log.info("Wake lock acquired by {} ({} held)", owner, count);
        return new WakeLockLease(owner);
    }

    public int heldCount() {
        return held.get();
    }

    private final class WakeLockLease implements Lease {

        private final String owner;
        private final AtomicBoolean open = new AtomicBoolean(true);

        private WakeLockLease(String owner) {
            this.owner = owner;
        }

        @Override
        public boolean isHeld() {
            return open.get();
        }

        @Override
        public void close() {
            if (open.compareAndSet(true, false)) {
                int count = held.decrementAndGet();
                log.info("Wake lock released by {} ({} held)", owner, count);
            }
        }
    }
}
