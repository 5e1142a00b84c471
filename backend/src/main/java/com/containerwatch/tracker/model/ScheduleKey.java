package com.containerwatch.tracker.model;

public record ScheduleKey(long ownerId, String query) {
    public ScheduleKey {
        query = ScheduleEntry.normalizeQuery(query);
    }
}
