package com.containerwatch.tracker.api;

public record TrackRequest(
    Long ownerId,
    String query,
    String destination
) {
}
