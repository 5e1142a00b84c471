package com.containerwatch.tracker.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public record ScheduleEntry(
    long ownerId,
    String query,
    Set<DayOfWeek> daysOfWeek,
    LocalTime timeOfDay,
    Instant lastFired,
    boolean enabled,
    String destination
) {
    public ScheduleEntry {
        // group chats carry negative ids
        if (ownerId == 0) {
            throw new IllegalArgumentException("ownerId must not be 0");
        }
        query = normalizeQuery(query);
        if (query.isEmpty()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (daysOfWeek == null || daysOfWeek.isEmpty()) {
            throw new IllegalArgumentException("daysOfWeek must not be empty");
        }
        if (timeOfDay == null) {
            throw new IllegalArgumentException("timeOfDay is required");
        }
        daysOfWeek = Collections.unmodifiableSet(EnumSet.copyOf(daysOfWeek));
        timeOfDay = timeOfDay.withSecond(0).withNano(0);
        destination = (destination == null || destination.isBlank()) ? null : destination.trim();
    }

    public static ScheduleEntry of(long ownerId, String query, Set<DayOfWeek> days, LocalTime timeOfDay) {
        return new ScheduleEntry(ownerId, query, days, timeOfDay, null, true, null);
    }

    public static String normalizeQuery(String query) {
        return query == null ? "" : query.trim();
    }

    @JsonIgnore
    public ScheduleKey key() {
        return new ScheduleKey(ownerId, query);
    }

    public ScheduleEntry withLastFired(Instant firedAt) {
        return new ScheduleEntry(ownerId, query, daysOfWeek, timeOfDay, firedAt, enabled, destination);
    }

    public ScheduleEntry withEnabled(boolean value) {
        return new ScheduleEntry(ownerId, query, daysOfWeek, timeOfDay, lastFired, value, destination);
    }
}
