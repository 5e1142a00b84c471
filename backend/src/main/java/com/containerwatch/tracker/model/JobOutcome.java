package com.containerwatch.tracker.model;

import java.time.Duration;

public record JobOutcome(
    JobStatus status,
    Duration duration,
    String detail,
    String reasonCode,
    TrackingReport report
) {
    public static JobOutcome success(TrackingReport report, Duration duration) {
        return new JobOutcome(JobStatus.SUCCESS, duration, null, null, report);
    }

    public static JobOutcome failure(JobStatus status, String reasonCode, String detail, Duration duration) {
        return new JobOutcome(status, duration, detail, reasonCode, null);
    }

    public boolean isSuccess() {
        return status == JobStatus.SUCCESS;
    }
}
