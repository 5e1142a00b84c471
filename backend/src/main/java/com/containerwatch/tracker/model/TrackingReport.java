package com.containerwatch.tracker.model;

public record TrackingReport(
    TrackingResult result,
    Coordinates locationCoordinates,
    String destination,
    Double distanceKm
) {
    public boolean hasDistance() {
        return distanceKm != null;
    }
}
