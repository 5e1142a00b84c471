package com.containerwatch.tracker.model;

import java.util.Locale;

public enum JobStatus {
    SUCCESS,
    TIMEOUT,
    NOT_FOUND,
    TRANSIENT_ERROR,
    FATAL_ERROR;

    public boolean isRetryable() {
        return this == TIMEOUT || this == TRANSIENT_ERROR;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
