package com.containerwatch.tracker.schedule;

import com.containerwatch.tracker.model.ScheduleEntry;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Decides whether an entry is due. A slot fires once, only within {@code grace} after it
 * passes; slots missed by more than that are dropped, never caught up.
 */
public class FiringPolicy {
    private final ZoneId zone;
    private final Duration grace;

    public FiringPolicy(ZoneId zone, Duration grace) {
        this.zone = zone;
        this.grace = grace;
    }

    public Optional<Instant> dueSlot(ScheduleEntry entry, Instant now) {
        if (!entry.enabled()) {
            return Optional.empty();
        }
        LocalDate today = now.atZone(zone).toLocalDate();
        // yesterday matters for slots just before midnight whose grace runs past it
        for (LocalDate date : new LocalDate[] {today, today.minusDays(1)}) {
            if (!entry.daysOfWeek().contains(date.getDayOfWeek())) {
                continue;
            }
            Instant slot = ZonedDateTime.of(date, entry.timeOfDay(), zone).toInstant();
            if (slot.isAfter(now) || Duration.between(slot, now).compareTo(grace) > 0) {
                continue;
            }
            if (entry.lastFired() != null && !entry.lastFired().isBefore(slot)) {
                continue;
            }
            return Optional.of(slot);
        }
        return Optional.empty();
    }

    public ZoneId zone() {
        return zone;
    }

    public Duration grace() {
        return grace;
    }
}
