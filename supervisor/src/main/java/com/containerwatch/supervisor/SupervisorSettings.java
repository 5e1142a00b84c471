package com.containerwatch.supervisor;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

public record SupervisorSettings(
    int maxRestartsPerWindow,
    Duration window,
    Duration backoff,
    Duration cooldown,
    Duration terminationGrace,
    Duration errorPause
) {
    public static final int DEFAULT_MAX_RESTARTS = 10;
    public static final Duration DEFAULT_WINDOW = Duration.ofHours(1);
    public static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(5);
    public static final Duration DEFAULT_COOLDOWN = Duration.ofHours(1);
    public static final Duration DEFAULT_GRACE = Duration.ofSeconds(10);
    public static final Duration DEFAULT_ERROR_PAUSE = Duration.ofSeconds(10);

    public SupervisorSettings {
        maxRestartsPerWindow = Math.max(1, maxRestartsPerWindow);
        window = atLeast(window, Duration.ofSeconds(1), DEFAULT_WINDOW);
        backoff = atLeast(backoff, Duration.ZERO, DEFAULT_BACKOFF);
        cooldown = atLeast(cooldown, Duration.ofSeconds(1), DEFAULT_COOLDOWN);
        terminationGrace = atLeast(terminationGrace, Duration.ZERO, DEFAULT_GRACE);
        errorPause = atLeast(errorPause, Duration.ZERO, DEFAULT_ERROR_PAUSE);
    }

    public static SupervisorSettings defaults() {
        return new SupervisorSettings(
            DEFAULT_MAX_RESTARTS,
            DEFAULT_WINDOW,
            DEFAULT_BACKOFF,
            DEFAULT_COOLDOWN,
            DEFAULT_GRACE,
            DEFAULT_ERROR_PAUSE
        );
    }

    public static SupervisorSettings fromEnvironment(Properties systemProperties, Map<String, String> environment) {
        return new SupervisorSettings(
            (int) readLong(systemProperties, environment, "supervisor.max-restarts-per-hour", DEFAULT_MAX_RESTARTS),
            Duration.ofSeconds(readLong(systemProperties, environment, "supervisor.window-seconds", DEFAULT_WINDOW.toSeconds())),
            Duration.ofSeconds(readLong(systemProperties, environment, "supervisor.backoff-seconds", DEFAULT_BACKOFF.toSeconds())),
            Duration.ofSeconds(readLong(systemProperties, environment, "supervisor.cooldown-seconds", DEFAULT_COOLDOWN.toSeconds())),
            Duration.ofSeconds(readLong(systemProperties, environment, "supervisor.grace-seconds", DEFAULT_GRACE.toSeconds())),
            DEFAULT_ERROR_PAUSE
        );
    }

    static String environmentName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    private static long readLong(Properties systemProperties, Map<String, String> environment, String key, long fallback) {
        String raw = systemProperties == null ? null : systemProperties.getProperty(key);
        if ((raw == null || raw.isBlank()) && environment != null) {
            raw = environment.get(environmentName(key));
        }
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + raw, e);
        }
    }

    private static Duration atLeast(Duration value, Duration floor, Duration fallback) {
        if (value == null) {
            return fallback;
        }
        return value.compareTo(floor) < 0 ? floor : value;
    }
}
