package com.containerwatch.tracker.geo;

public record GeoCacheStats(
    int total,
    int valid,
    int expired,
    long hits,
    long misses,
    String store
) {
}
