package com.containerwatch.tracker.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Refuses to start the worker without a chat credential, so the supervisor sees a crash
 * instead of a process that silently does nothing.
 */
@Component
public class StartupCredentialCheck {
    private static final Logger log = LoggerFactory.getLogger(StartupCredentialCheck.class);

    private final TrackerProperties properties;

    public StartupCredentialCheck(TrackerProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void verify() {
        String token = properties.getBotToken();
        if (token == null || token.isBlank()) {
            throw new MissingCredentialException("BOT_TOKEN is not set (tracker.bot-token)");
        }
        log.info("Chat credential present, timezone={}", properties.zoneId());
    }
}
