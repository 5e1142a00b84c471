package com.containerwatch.tracker.model;

public record TrackingResult(
    String containerNumber,
    String location,
    String action,
    String country,
    String reportedAt
) {
}
