package com.containerwatch.supervisor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Sliding record of recent worker restarts. Only the supervisor loop touches it.
 */
public class RestartWindow {
    private final Duration span;
    private final Deque<Instant> restarts = new ArrayDeque<>();
    private long restartCount;

    public RestartWindow(Duration span) {
        if (span == null || span.isNegative() || span.isZero()) {
            throw new IllegalArgumentException("span must be positive");
        }
        this.span = span;
    }

    public long record(Instant restartedAt) {
        prune(restartedAt);
        restarts.addLast(restartedAt);
        return ++restartCount;
    }

    public int prune(Instant now) {
        Instant cutoff = now.minus(span);
        while (!restarts.isEmpty() && !restarts.peekFirst().isAfter(cutoff)) {
            restarts.pollFirst();
        }
        return restarts.size();
    }

    /**
     * True when one more restart would put more than {@code cap} restarts inside the window.
     */
    public boolean isFull(int cap) {
        return restarts.size() >= cap;
    }

    public void clear() {
        restarts.clear();
    }

    public long restartCount() {
        return restartCount;
    }

    public int size() {
        return restarts.size();
    }

    public List<Instant> snapshot() {
        return List.copyOf(restarts);
    }
}
