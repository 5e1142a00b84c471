package com.containerwatch.supervisor;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RestartWindowTest {
    private static final Instant T0 = Instant.parse("2026-01-05T00:00:00Z");

    @Test
    void retainsOnlyRestartsInsideTheLastHour() {
        RestartWindow window = new RestartWindow(Duration.ofHours(1));
        window.record(T0);
        window.record(T0.plus(Duration.ofMinutes(30)));
        window.record(T0.plus(Duration.ofMinutes(59)));

        assertThat(window.prune(T0.plus(Duration.ofMinutes(60)))).isEqualTo(2);
        assertThat(window.snapshot()).containsExactly(
            T0.plus(Duration.ofMinutes(30)),
            T0.plus(Duration.ofMinutes(59))
        );
        assertThat(window.restartCount()).isEqualTo(3);
    }

    @Test
    void fullWhenCapReached() {
        RestartWindow window = new RestartWindow(Duration.ofHours(1));
        for (int i = 0; i < 10; i++) {
            window.record(T0.plusSeconds(i));
        }
        assertThat(window.isFull(10)).isTrue();
        assertThat(window.isFull(11)).isFalse();

        window.clear();
        assertThat(window.size()).isZero();
        assertThat(window.restartCount()).isEqualTo(10);
    }
}
