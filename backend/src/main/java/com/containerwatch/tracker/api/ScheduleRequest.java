package com.containerwatch.tracker.api;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Set;

public record ScheduleRequest(
    Long ownerId,
    String query,
    Set<DayOfWeek> daysOfWeek,
    LocalTime timeOfDay,
    Boolean enabled,
    String destination
) {
}
