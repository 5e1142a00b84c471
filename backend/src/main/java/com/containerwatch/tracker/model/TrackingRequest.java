package com.containerwatch.tracker.model;

public record TrackingRequest(String query, String destination) {
    public TrackingRequest {
        query = ScheduleEntry.normalizeQuery(query);
        if (query.isEmpty()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        destination = (destination == null || destination.isBlank()) ? null : destination.trim();
    }
}
