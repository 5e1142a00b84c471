package com.containerwatch.tracker.execution;

import com.containerwatch.tracker.config.TrackerProperties;
import com.containerwatch.tracker.geo.GeoLookupService;
import com.containerwatch.tracker.metrics.MetricsSink;
import com.containerwatch.tracker.metrics.TrackerMetrics;
import com.containerwatch.tracker.model.Coordinates;
import com.containerwatch.tracker.model.JobOutcome;
import com.containerwatch.tracker.model.JobStatus;
import com.containerwatch.tracker.model.TrackingReport;
import com.containerwatch.tracker.model.TrackingRequest;
import com.containerwatch.tracker.model.TrackingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs a single tracking request against a fresh automation session with a hard deadline.
 * Every call returns an outcome; nothing is retried here.
 */
@Service
public class TrackingExecutor {
    private static final Logger log = LoggerFactory.getLogger(TrackingExecutor.class);

    private final AutomationSessionFactory sessionFactory;
    private final GeoLookupService geoLookup;
    private final MetricsSink metrics;
    private final ExecutorService automationExecutor;
    private final String defaultDestination;

    public TrackingExecutor(
        AutomationSessionFactory sessionFactory,
        GeoLookupService geoLookup,
        MetricsSink metrics,
        @Qualifier("automationExecutor") ExecutorService automationExecutor,
        TrackerProperties properties
    ) {
        this.sessionFactory = sessionFactory;
        this.geoLookup = geoLookup;
        this.metrics = metrics;
        this.automationExecutor = automationExecutor;
        this.defaultDestination = properties.getDefaultDestination();
    }

    public JobOutcome execute(TrackingRequest request, Duration timeout) {
        long started = System.nanoTime();
        CancellationToken token = new CancellationToken();
        AtomicReference<SessionHandle> handleRef = new AtomicReference<>();
        JobOutcome outcome;
        Future<TrackingReport> future = null;
        try {
            future = automationExecutor.submit(() -> {
                SessionHandle handle = new SessionHandle(sessionFactory.open());
                handleRef.set(handle);
                // the caller may have given up while the session was starting
                if (token.isCancelled()) {
                    handle.release();
                }
                token.throwIfCancelled();
                TrackingResult result = track(handle, request, token);
                handle.release();
                token.throwIfCancelled();
                return buildReport(result, request);
            });
            TrackingReport report = future.get(Math.max(1L, timeout.toNanos()), TimeUnit.NANOSECONDS);
            outcome = JobOutcome.success(report, elapsed(started));
        } catch (TimeoutException e) {
            abort(token, future);
            outcome = JobOutcome.failure(
                JobStatus.TIMEOUT,
                FailureClassifier.TIMEOUT,
                "no result within " + timeout.toSeconds() + "s",
                elapsed(started)
            );
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort(token, future);
            outcome = JobOutcome.failure(
                JobStatus.TRANSIENT_ERROR,
                FailureClassifier.INTERRUPTED,
                "interrupted while waiting for tracking result",
                elapsed(started)
            );
        } catch (RejectedExecutionException e) {
            outcome = JobOutcome.failure(
                JobStatus.TRANSIENT_ERROR,
                FailureClassifier.RESOURCE_EXHAUSTED,
                "automation pool rejected the job",
                elapsed(started)
            );
        } catch (ExecutionException e) {
            outcome = classified(e.getCause(), request, started);
        } catch (RuntimeException e) {
            outcome = classified(e, request, started);
        } finally {
            release(token, handleRef);
        }

        record(outcome);
        log.info(
            "Tracking query={} status={} reason={} durationMs={}",
            request.query(),
            outcome.status().label(),
            outcome.reasonCode(),
            outcome.duration().toMillis()
        );
        return outcome;
    }

    private JobOutcome classified(Throwable failure, TrackingRequest request, long started) {
        FailureClassifier.Classification classification = FailureClassifier.classify(failure);
        Throwable cause = FailureClassifier.unwrap(failure);
        String detail = cause == null ? null : cause.getMessage();
        if (classification.status() == JobStatus.FATAL_ERROR) {
            log.error("Unexpected failure tracking query={}", request.query(), cause);
        } else {
            log.info("Tracking query={} failed: {} ({})", request.query(), classification.reasonCode(), detail);
        }
        return JobOutcome.failure(classification.status(), classification.reasonCode(), detail, elapsed(started));
    }

    private TrackingResult track(SessionHandle handle, TrackingRequest request, CancellationToken token) {
        long started = System.nanoTime();
        String outcome = "error";
        try {
            TrackingResult result = handle.session().track(request.query(), token);
            outcome = "success";
            return result;
        } finally {
            metrics.observe(
                TrackerMetrics.BROWSER_DURATION,
                (System.nanoTime() - started) / 1_000_000_000.0,
                Map.of("outcome", outcome)
            );
        }
    }

    // runs inside the timed task, so geocoding counts against the same deadline
    private TrackingReport buildReport(TrackingResult result, TrackingRequest request) {
        String destination = request.destination() != null ? request.destination() : defaultDestination;
        Optional<Coordinates> location = geoLookup.resolve(result.location());
        Optional<Coordinates> target = (destination == null || destination.isBlank())
            ? Optional.empty()
            : geoLookup.resolve(destination);
        Double distance = null;
        if (location.isPresent() && target.isPresent()) {
            distance = location.get().distanceKmTo(target.get());
        }
        return new TrackingReport(result, location.orElse(null), destination, distance);
    }

    private void abort(CancellationToken token, Future<?> future) {
        token.cancel();
        if (future != null) {
            future.cancel(true);
        }
    }

    private void release(CancellationToken token, AtomicReference<SessionHandle> handleRef) {
        token.cancel();
        SessionHandle handle = handleRef.get();
        if (handle != null) {
            handle.release();
        }
    }

    private void record(JobOutcome outcome) {
        Map<String, String> labels = Map.of("status", outcome.status().label());
        metrics.observe(TrackerMetrics.JOB_DURATION, outcome.duration().toNanos() / 1_000_000_000.0, labels);
        metrics.increment(TrackerMetrics.JOB_OUTCOMES, labels);
    }

    private static Duration elapsed(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
