package com.containerwatch.tracker.execution;

public class TransientTrackingException extends RuntimeException {
    private final String reasonCode;

    public TransientTrackingException(String reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }

    public TransientTrackingException(String reasonCode, String message, Throwable cause) {
        super(message, cause);
        this.reasonCode = reasonCode;
    }

    public String getReasonCode() {
        return reasonCode;
    }
}
