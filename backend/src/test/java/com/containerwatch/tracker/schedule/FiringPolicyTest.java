package com.containerwatch.tracker.schedule;

import com.containerwatch.tracker.model.ScheduleEntry;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class FiringPolicyTest {
    private static final ZoneId MOSCOW = ZoneId.of("Europe/Moscow");
    private final FiringPolicy policy = new FiringPolicy(MOSCOW, Duration.ofSeconds(120));

    // 2024-01-01 is a Monday; 09:00 in Moscow is 06:00Z
    private final ScheduleEntry mondayNine = ScheduleEntry.of(7L, "Container-7", Set.of(DayOfWeek.MONDAY), LocalTime.of(9, 0));

    @Test
    void dueWithinGraceAfterSlot() {
        assertThat(policy.dueSlot(mondayNine, Instant.parse("2024-01-01T06:00:00Z")))
            .contains(Instant.parse("2024-01-01T06:00:00Z"));
        assertThat(policy.dueSlot(mondayNine, Instant.parse("2024-01-01T06:02:00Z"))).isPresent();
    }

    @Test
    void notDueBeforeSlotOrAfterGrace() {
        assertThat(policy.dueSlot(mondayNine, Instant.parse("2024-01-01T05:59:59Z"))).isEmpty();
        assertThat(policy.dueSlot(mondayNine, Instant.parse("2024-01-01T06:02:01Z"))).isEmpty();
    }

    @Test
    void notDueOnOtherWeekdays() {
        assertThat(policy.dueSlot(mondayNine, Instant.parse("2024-01-02T06:00:30Z"))).isEmpty();
    }

    @Test
    void notDueOnceFiredForTheSlot() {
        ScheduleEntry fired = mondayNine.withLastFired(Instant.parse("2024-01-01T06:00:00Z"));
        assertThat(policy.dueSlot(fired, Instant.parse("2024-01-01T06:01:00Z"))).isEmpty();

        ScheduleEntry firedLastWeek = mondayNine.withLastFired(Instant.parse("2023-12-25T06:00:00Z"));
        assertThat(policy.dueSlot(firedLastWeek, Instant.parse("2024-01-01T06:01:00Z"))).isPresent();
    }

    @Test
    void disabledEntryNeverDue() {
        assertThat(policy.dueSlot(mondayNine.withEnabled(false), Instant.parse("2024-01-01T06:00:30Z"))).isEmpty();
    }

    @Test
    void slotJustBeforeMidnightStaysDuePastMidnight() {
        ScheduleEntry sundayLate = ScheduleEntry.of(7L, "Container-7", Set.of(DayOfWeek.SUNDAY), LocalTime.of(23, 59));
        // Sunday 2023-12-31 23:59 Moscow is 20:59Z; one minute later it is Monday in Moscow
        assertThat(policy.dueSlot(sundayLate, Instant.parse("2023-12-31T21:00:00Z")))
            .contains(Instant.parse("2023-12-31T20:59:00Z"));
    }
}
