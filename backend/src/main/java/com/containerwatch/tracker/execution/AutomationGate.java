package com.containerwatch.tracker.execution;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caps how many browser sessions exist at once. Waiters are served in arrival order.
 */
public class AutomationGate {
    private final Semaphore permits;
    private final int capacity;

    public AutomationGate(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        this.capacity = capacity;
        this.permits = new Semaphore(capacity, true);
    }

    public Optional<Permit> tryAcquire(Duration wait) throws InterruptedException {
        long nanos = Math.max(0L, wait.toNanos());
        if (!permits.tryAcquire(nanos, TimeUnit.NANOSECONDS)) {
            return Optional.empty();
        }
        return Optional.of(new Permit());
    }

    public int inUse() {
        return capacity - permits.availablePermits();
    }

    public final class Permit implements AutoCloseable {
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                permits.release();
            }
        }
    }
}
