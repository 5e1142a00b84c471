package com.containerwatch.tracker.config;

public class MissingCredentialException extends RuntimeException {
    public MissingCredentialException(String message) {
        super(message);
    }
}
