package com.containerwatch.tracker.execution;

public class TrackingNotFoundException extends RuntimeException {
    private final String query;

    public TrackingNotFoundException(String query) {
        super("No tracking data for " + query);
        this.query = query;
    }

    public String getQuery() {
        return query;
    }
}
