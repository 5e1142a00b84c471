package com.containerwatch.supervisor;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SupervisorSettingsTest {

    @Test
    void systemPropertiesWinOverEnvironment() {
        Properties properties = new Properties();
        properties.setProperty("supervisor.max-restarts-per-hour", "4");
        Map<String, String> env = Map.of(
            "SUPERVISOR_MAX_RESTARTS_PER_HOUR", "7",
            "SUPERVISOR_BACKOFF_SECONDS", "2"
        );

        SupervisorSettings settings = SupervisorSettings.fromEnvironment(properties, env);

        assertThat(settings.maxRestartsPerWindow()).isEqualTo(4);
        assertThat(settings.backoff()).isEqualTo(Duration.ofSeconds(2));
        assertThat(settings.cooldown()).isEqualTo(Duration.ofHours(1));
    }

    @Test
    void unsafeValuesAreClamped() {
        Properties properties = new Properties();
        properties.setProperty("supervisor.max-restarts-per-hour", "0");
        properties.setProperty("supervisor.backoff-seconds", "-3");

        SupervisorSettings settings = SupervisorSettings.fromEnvironment(properties, Map.of());

        assertThat(settings.maxRestartsPerWindow()).isEqualTo(1);
        assertThat(settings.backoff()).isEqualTo(Duration.ZERO);
    }

    @Test
    void malformedNumberIsRejected() {
        Properties properties = new Properties();
        properties.setProperty("supervisor.cooldown-seconds", "soon");

        assertThatThrownBy(() -> SupervisorSettings.fromEnvironment(properties, Map.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("supervisor.cooldown-seconds");
    }

    @Test
    void workerCommandFollowsSeparator() {
        assertThat(SupervisorMain.workerCommand(new String[] {"--", "java", "-jar", "backend.jar"}))
            .containsExactly("java", "-jar", "backend.jar");
        assertThat(SupervisorMain.workerCommand(new String[] {"python3", "bot.py"}))
            .containsExactly("python3", "bot.py");
        assertThat(SupervisorMain.workerCommand(new String[0])).isEmpty();
    }
}
