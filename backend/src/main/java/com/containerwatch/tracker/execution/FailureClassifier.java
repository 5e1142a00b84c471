package com.containerwatch.tracker.execution;

import com.containerwatch.tracker.model.JobStatus;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class FailureClassifier {
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String TIMEOUT = "TIMEOUT";
    public static final String RESOURCE_EXHAUSTED = "RESOURCE_EXHAUSTED";
    public static final String BROWSER_START_FAILED = "BROWSER_START_FAILED";
    public static final String BROWSER_ERROR = "BROWSER_ERROR";
    public static final String PAGE_TIMEOUT = "PAGE_TIMEOUT";
    public static final String NETWORK_TIMEOUT = "NETWORK_TIMEOUT";
    public static final String IO_ERROR = "IO_ERROR";
    public static final String CANCELLED = "CANCELLED";
    public static final String INTERRUPTED = "INTERRUPTED";
    public static final String UNEXPECTED = "UNEXPECTED";

    private FailureClassifier() {}

    public static Classification classify(Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause == null) {
            return new Classification(JobStatus.FATAL_ERROR, UNEXPECTED);
        }
        if (cause instanceof TrackingNotFoundException) {
            return new Classification(JobStatus.NOT_FOUND, NOT_FOUND);
        }
        if (cause instanceof ResourceExhaustedException) {
            return new Classification(JobStatus.TRANSIENT_ERROR, RESOURCE_EXHAUSTED);
        }
        if (cause instanceof TransientTrackingException transientFailure) {
            String reason = transientFailure.getReasonCode();
            return new Classification(
                JobStatus.TRANSIENT_ERROR,
                (reason == null || reason.isBlank()) ? BROWSER_ERROR : reason
            );
        }
        if (cause instanceof CancellationException) {
            return new Classification(JobStatus.TRANSIENT_ERROR, CANCELLED);
        }
        if (cause instanceof InterruptedException) {
            return new Classification(JobStatus.TRANSIENT_ERROR, INTERRUPTED);
        }
        if (cause instanceof HttpTimeoutException || cause instanceof SocketTimeoutException) {
            return new Classification(JobStatus.TRANSIENT_ERROR, NETWORK_TIMEOUT);
        }
        if (cause instanceof IOException) {
            return new Classification(JobStatus.TRANSIENT_ERROR, IO_ERROR);
        }
        return new Classification(JobStatus.FATAL_ERROR, UNEXPECTED);
    }

    static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while (current != null && current.getCause() != null
            && (current instanceof ExecutionException
                || current instanceof CompletionException
                || current instanceof UncheckedIOException)) {
            current = current.getCause();
        }
        return current;
    }

    public record Classification(JobStatus status, String reasonCode) {
    }
}
