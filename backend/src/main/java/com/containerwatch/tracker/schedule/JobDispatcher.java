package com.containerwatch.tracker.schedule;

import com.containerwatch.tracker.config.TrackerProperties;
import com.containerwatch.tracker.execution.AutomationGate;
import com.containerwatch.tracker.execution.FailureClassifier;
import com.containerwatch.tracker.execution.TrackingExecutor;
import com.containerwatch.tracker.metrics.MetricsSink;
import com.containerwatch.tracker.metrics.TrackerMetrics;
import com.containerwatch.tracker.model.JobOutcome;
import com.containerwatch.tracker.model.JobStatus;
import com.containerwatch.tracker.model.TrackingJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Single entry point for tracking work. The returned future always completes normally.
 */
@Service
public class JobDispatcher {
    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private final TrackingExecutor executor;
    private final AutomationGate gate;
    private final ExecutorService dispatchExecutor;
    private final MetricsSink metrics;
    private final Duration slotWait;
    private final Duration scheduledTimeout;
    private final Duration interactiveTimeout;

    public JobDispatcher(
        TrackingExecutor executor,
        AutomationGate gate,
        @Qualifier("dispatchExecutor") ExecutorService dispatchExecutor,
        MetricsSink metrics,
        TrackerProperties properties
    ) {
        this.executor = executor;
        this.gate = gate;
        this.dispatchExecutor = dispatchExecutor;
        this.metrics = metrics;
        TrackerProperties.Scheduler scheduler = properties.getScheduler();
        this.slotWait = Duration.ofSeconds(scheduler.getSlotWaitSeconds());
        this.scheduledTimeout = Duration.ofSeconds(scheduler.getScheduledTimeoutSeconds());
        this.interactiveTimeout = Duration.ofSeconds(scheduler.getInteractiveTimeoutSeconds());
    }

    public CompletableFuture<JobOutcome> dispatch(TrackingJob job) {
        Duration timeout = timeoutFor(job);
        try {
            return CompletableFuture.supplyAsync(() -> run(job, timeout), dispatchExecutor);
        } catch (RejectedExecutionException e) {
            JobOutcome outcome = JobOutcome.failure(
                JobStatus.TRANSIENT_ERROR,
                FailureClassifier.RESOURCE_EXHAUSTED,
                "dispatch pool is not accepting work",
                Duration.ZERO
            );
            count(job, outcome);
            return CompletableFuture.completedFuture(outcome);
        }
    }

    Duration timeoutFor(TrackingJob job) {
        if (job instanceof TrackingJob.ScheduledCheck) {
            return scheduledTimeout;
        }
        if (job instanceof TrackingJob.InteractiveCheck) {
            return interactiveTimeout;
        }
        throw new IllegalStateException("Unknown job type " + job.getClass().getName());
    }

    private JobOutcome run(TrackingJob job, Duration timeout) {
        long started = System.nanoTime();
        JobOutcome outcome;
        try {
            Optional<AutomationGate.Permit> permit = gate.tryAcquire(slotWait);
            if (permit.isEmpty()) {
                log.warn("No automation slot for {} check owner={} within {}s", job.kind(), job.ownerId(), slotWait.toSeconds());
                outcome = JobOutcome.failure(
                    JobStatus.TRANSIENT_ERROR,
                    FailureClassifier.RESOURCE_EXHAUSTED,
                    "no automation slot within " + slotWait.toSeconds() + "s",
                    Duration.ofNanos(System.nanoTime() - started)
                );
            } else {
                try (AutomationGate.Permit ignored = permit.get()) {
                    outcome = executor.execute(job.request(), timeout);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = JobOutcome.failure(
                JobStatus.TRANSIENT_ERROR,
                FailureClassifier.INTERRUPTED,
                "interrupted while waiting for an automation slot",
                Duration.ofNanos(System.nanoTime() - started)
            );
        } catch (RuntimeException e) {
            log.error("Dispatch of {} check owner={} failed", job.kind(), job.ownerId(), e);
            outcome = JobOutcome.failure(
                JobStatus.FATAL_ERROR,
                FailureClassifier.UNEXPECTED,
                e.getMessage(),
                Duration.ofNanos(System.nanoTime() - started)
            );
        }
        count(job, outcome);
        return outcome;
    }

    private void count(TrackingJob job, JobOutcome outcome) {
        metrics.increment(TrackerMetrics.CHECKS, Map.of("kind", job.kind(), "status", outcome.status().label()));
    }
}
