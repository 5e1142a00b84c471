package com.containerwatch.tracker.schedule;

import com.containerwatch.tracker.config.TrackerProperties;
import com.containerwatch.tracker.execution.AutomationGate;
import com.containerwatch.tracker.execution.FailureClassifier;
import com.containerwatch.tracker.execution.TrackingExecutor;
import com.containerwatch.tracker.metrics.TrackerMetrics;
import com.containerwatch.tracker.model.JobOutcome;
import com.containerwatch.tracker.model.JobStatus;
import com.containerwatch.tracker.model.ScheduleEntry;
import com.containerwatch.tracker.model.TrackingJob;
import com.containerwatch.tracker.model.TrackingRequest;
import com.containerwatch.tracker.support.RecordingMetricsSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobDispatcherTest {
    @Mock
    private TrackingExecutor executor;

    private ExecutorService pool;
    private RecordingMetricsSink metrics;
    private TrackerProperties properties;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(6);
        metrics = new RecordingMetricsSink();
        properties = new TrackerProperties();
        properties.getScheduler().setSlotWaitSeconds(1);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private JobDispatcher dispatcher(int permits) {
        return new JobDispatcher(executor, new AutomationGate(permits), pool, metrics, properties);
    }

    private static JobOutcome success() {
        return JobOutcome.success(null, Duration.ofMillis(5));
    }

    @Test
    void eachJobKindGetsItsOwnTimeout() throws Exception {
        when(executor.execute(any(), any())).thenReturn(success());
        JobDispatcher dispatcher = dispatcher(2);
        ScheduleEntry entry = ScheduleEntry.of(7L, "Container-7", Set.of(DayOfWeek.MONDAY), LocalTime.of(9, 0));

        dispatcher.dispatch(new TrackingJob.ScheduledCheck(entry)).get(5, TimeUnit.SECONDS);
        dispatcher.dispatch(new TrackingJob.InteractiveCheck(9L, new TrackingRequest("ABCU1234567", null)))
            .get(5, TimeUnit.SECONDS);

        verify(executor).execute(new TrackingRequest("Container-7", null), Duration.ofSeconds(180));
        verify(executor).execute(eq(new TrackingRequest("ABCU1234567", null)), eq(Duration.ofSeconds(120)));
        assertThat(metrics.count(TrackerMetrics.CHECKS, "kind", "scheduled")).isEqualTo(1);
        assertThat(metrics.count(TrackerMetrics.CHECKS, "kind", "interactive")).isEqualTo(1);
    }

    @Test
    void gateBoundsConcurrentSessionsAndTimesOutWaiters() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        when(executor.execute(any(), any())).thenAnswer(invocation -> {
            peak.accumulateAndGet(running.incrementAndGet(), Math::max);
            try {
                release.await(5, TimeUnit.SECONDS);
            } finally {
                running.decrementAndGet();
            }
            return success();
        });
        JobDispatcher dispatcher = dispatcher(2);

        List<CompletableFuture<JobOutcome>> futures = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            futures.add(dispatcher.dispatch(new TrackingJob.InteractiveCheck(1L, new TrackingRequest("C-" + i, null))));
        }
        JobOutcome starved = CompletableFuture.anyOf(futures.toArray(new CompletableFuture[0]))
            .thenApply(JobOutcome.class::cast)
            .get(5, TimeUnit.SECONDS);
        release.countDown();
        List<JobStatus> statuses = new ArrayList<>();
        for (CompletableFuture<JobOutcome> future : futures) {
            statuses.add(future.get(5, TimeUnit.SECONDS).status());
        }

        assertThat(starved.status()).isEqualTo(JobStatus.TRANSIENT_ERROR);
        assertThat(starved.reasonCode()).isEqualTo(FailureClassifier.RESOURCE_EXHAUSTED);
        assertThat(peak.get()).isEqualTo(2);
        assertThat(statuses).containsExactlyInAnyOrder(JobStatus.SUCCESS, JobStatus.SUCCESS, JobStatus.TRANSIENT_ERROR);
    }

    @Test
    void unexpectedExecutorFailureStillCompletesNormally() throws Exception {
        when(executor.execute(any(), any())).thenThrow(new IllegalStateException("boom"));
        JobDispatcher dispatcher = dispatcher(1);

        JobOutcome outcome = dispatcher.dispatch(new TrackingJob.InteractiveCheck(1L, new TrackingRequest("X-1", null)))
            .get(5, TimeUnit.SECONDS);

        assertThat(outcome.status()).isEqualTo(JobStatus.FATAL_ERROR);
        assertThat(metrics.count(TrackerMetrics.CHECKS, "status", "fatal_error")).isEqualTo(1);
    }

    @Test
    void permitIsReturnedAfterEachJob() throws Exception {
        when(executor.execute(any(), any())).thenReturn(success());
        JobDispatcher dispatcher = dispatcher(1);

        for (int i = 0; i < 3; i++) {
            JobOutcome outcome = dispatcher.dispatch(new TrackingJob.InteractiveCheck(1L, new TrackingRequest("X-" + i, null)))
                .get(5, TimeUnit.SECONDS);
            assertThat(outcome.isSuccess()).isTrue();
        }
    }
}
