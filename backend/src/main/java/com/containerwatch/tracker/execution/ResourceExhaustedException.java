package com.containerwatch.tracker.execution;

public class ResourceExhaustedException extends RuntimeException {
    public ResourceExhaustedException(String message) {
        super(message);
    }
}
