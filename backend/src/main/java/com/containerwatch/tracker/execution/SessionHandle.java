package com.containerwatch.tracker.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Closes the wrapped session at most once, whichever thread gets there first.
 */
final class SessionHandle {
    private static final Logger log = LoggerFactory.getLogger(SessionHandle.class);

    private final AutomationSession session;
    private final AtomicBoolean released = new AtomicBoolean();

    SessionHandle(AutomationSession session) {
        this.session = session;
    }

    AutomationSession session() {
        return session;
    }

    void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        try {
            session.close();
        } catch (RuntimeException e) {
            log.warn("Closing automation session failed: {}", e.getMessage());
        }
    }
}
