package com.containerwatch.tracker.schedule;

import com.containerwatch.tracker.model.JobOutcome;
import com.containerwatch.tracker.model.ScheduleEntry;
import com.containerwatch.tracker.model.TrackingReport;
import com.containerwatch.tracker.model.TrackingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingCheckNotifier implements CheckNotifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingCheckNotifier.class);

    @Override
    public void deliver(ScheduleEntry entry, JobOutcome outcome) {
        switch (outcome.status()) {
            case SUCCESS -> {
                TrackingReport report = outcome.report();
                TrackingResult result = report.result();
                log.info(
                    "owner={} container={} location={} action={} country={} at={} distanceKm={}",
                    entry.ownerId(),
                    result.containerNumber(),
                    result.location(),
                    result.action(),
                    result.country(),
                    result.reportedAt(),
                    report.hasDistance() ? Math.round(report.distanceKm()) : "unknown"
                );
            }
            case NOT_FOUND -> log.info("owner={} container={} not found", entry.ownerId(), entry.query());
            case FATAL_ERROR -> log.warn(
                "owner={} container={} check failed: {} ({})",
                entry.ownerId(),
                entry.query(),
                outcome.reasonCode(),
                outcome.detail()
            );
            default -> log.debug("owner={} container={} status={} not delivered", entry.ownerId(), entry.query(), outcome.status());
        }
    }
}
