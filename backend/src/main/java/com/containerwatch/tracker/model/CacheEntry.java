package com.containerwatch.tracker.model;

import java.time.Duration;
import java.time.Instant;

public record CacheEntry(
    String key,
    Coordinates coordinates,
    Instant createdAt,
    String query
) {
    public CacheEntry {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        if (coordinates == null || createdAt == null) {
            throw new IllegalArgumentException("coordinates and createdAt are required");
        }
    }

    public boolean isFresh(Instant now, Duration ttl) {
        return Duration.between(createdAt, now).compareTo(ttl) < 0;
    }
}
