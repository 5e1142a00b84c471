package com.containerwatch.tracker.schedule;

import com.containerwatch.tracker.config.TrackerProperties;
import com.containerwatch.tracker.metrics.MetricsSink;
import com.containerwatch.tracker.metrics.TrackerMetrics;
import com.containerwatch.tracker.model.JobOutcome;
import com.containerwatch.tracker.model.JobStatus;
import com.containerwatch.tracker.model.ScheduleEntry;
import com.containerwatch.tracker.model.ScheduleKey;
import com.containerwatch.tracker.model.TrackingJob;
import com.containerwatch.tracker.persistence.RecordStore;
import com.containerwatch.tracker.persistence.StoreWriteException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns the per-owner schedule registry. Every change is written to the store before it is
 * acknowledged; a failed write leaves the registry as it was.
 */
@Service
public class TrackingScheduler {
    private static final Logger log = LoggerFactory.getLogger(TrackingScheduler.class);

    private final RecordStore<ScheduleEntry> store;
    private final JobDispatcher dispatcher;
    private final CheckNotifier notifier;
    private final Clock clock;
    private final ScheduledExecutorService ticker;
    private final TrackerProperties.Scheduler properties;
    private final FiringPolicy policy;
    private final Map<ScheduleKey, ScheduleEntry> entries = new LinkedHashMap<>();
    private volatile ScheduledFuture<?> tickTask;

    public TrackingScheduler(
        RecordStore<ScheduleEntry> store,
        JobDispatcher dispatcher,
        CheckNotifier notifier,
        Clock clock,
        @Qualifier("schedulerTicker") ScheduledExecutorService ticker,
        TrackerProperties properties,
        MetricsSink metrics
    ) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.notifier = notifier;
        this.clock = clock;
        this.ticker = ticker;
        this.properties = properties.getScheduler();
        this.policy = new FiringPolicy(
            properties.zoneId(),
            Duration.ofSeconds(this.properties.getMisfireGraceSeconds())
        );
        metrics.gauge(TrackerMetrics.ACTIVE_OWNERS, this::activeOwnerCount);
    }

    @PostConstruct
    public void start() {
        load();
        if (!properties.isEnabled()) {
            log.info("Scheduler ticking disabled");
            return;
        }
        long period = properties.getTickSeconds();
        tickTask = ticker.scheduleWithFixedDelay(this::tickSafely, period, period, TimeUnit.SECONDS);
        log.info("Scheduler started tick={}s grace={}s zone={}", period, policy.grace().toSeconds(), policy.zone());
    }

    @PreDestroy
    public void stop() {
        ScheduledFuture<?> task = tickTask;
        if (task != null) {
            task.cancel(false);
        }
    }

    public synchronized int load() {
        List<ScheduleEntry> loaded = store.load();
        entries.clear();
        for (ScheduleEntry entry : loaded) {
            ScheduleEntry previous = entries.put(entry.key(), entry);
            if (previous != null) {
                log.warn("Duplicate schedule for owner={} query={}, keeping the later record", entry.ownerId(), entry.query());
            }
        }
        log.info("Loaded {} schedules for {} owners", entries.size(), activeOwnerCount());
        return entries.size();
    }

    /**
     * Inserts or replaces the entry for its (owner, query). A replaced entry keeps its
     * {@code lastFired} so an edit never re-fires a slot that already ran.
     */
    public synchronized ScheduleEntry register(ScheduleEntry entry) {
        ScheduleEntry existing = entries.get(entry.key());
        ScheduleEntry toStore = entry;
        if (existing != null && existing.lastFired() != null) {
            toStore = entry.withLastFired(existing.lastFired());
        }
        Map<ScheduleKey, ScheduleEntry> next = new LinkedHashMap<>(entries);
        next.put(toStore.key(), toStore);
        persist(next);
        log.info(
            "Registered schedule owner={} query={} days={} time={}",
            toStore.ownerId(),
            toStore.query(),
            toStore.daysOfWeek(),
            toStore.timeOfDay()
        );
        return toStore;
    }

    public synchronized boolean cancel(long ownerId, String query) {
        ScheduleKey key = new ScheduleKey(ownerId, query);
        if (!entries.containsKey(key)) {
            return false;
        }
        Map<ScheduleKey, ScheduleEntry> next = new LinkedHashMap<>(entries);
        next.remove(key);
        persist(next);
        log.info("Cancelled schedule owner={} query={}", ownerId, key.query());
        return true;
    }

    public synchronized Optional<ScheduleEntry> setEnabled(long ownerId, String query, boolean enabled) {
        ScheduleKey key = new ScheduleKey(ownerId, query);
        ScheduleEntry existing = entries.get(key);
        if (existing == null) {
            return Optional.empty();
        }
        if (existing.enabled() == enabled) {
            return Optional.of(existing);
        }
        ScheduleEntry updated = existing.withEnabled(enabled);
        Map<ScheduleKey, ScheduleEntry> next = new LinkedHashMap<>(entries);
        next.put(key, updated);
        persist(next);
        return Optional.of(updated);
    }

    public synchronized List<ScheduleEntry> entries() {
        return List.copyOf(entries.values());
    }

    public synchronized List<ScheduleEntry> entriesFor(long ownerId) {
        List<ScheduleEntry> result = new ArrayList<>();
        for (ScheduleEntry entry : entries.values()) {
            if (entry.ownerId() == ownerId) {
                result.add(entry);
            }
        }
        return result;
    }

    public synchronized int activeOwnerCount() {
        return (int) entries.values().stream().mapToLong(ScheduleEntry::ownerId).distinct().count();
    }

    /**
     * Dispatches every entry due at the current instant.
     *
     * @return number of jobs dispatched
     */
    public int tick() {
        Instant now = clock.instant();
        List<DueEntry> due = new ArrayList<>();
        synchronized (this) {
            for (ScheduleEntry entry : entries.values()) {
                policy.dueSlot(entry, now).ifPresent(slot -> due.add(new DueEntry(entry, slot)));
            }
        }
        int dispatched = 0;
        for (DueEntry item : due) {
            Optional<Firing> firing = fire(item);
            if (firing.isEmpty()) {
                log.info("Skipping slot={} for owner={} query={}: cancelled, paused or already fired",
                    item.slot(), item.entry().ownerId(), item.entry().query());
                continue;
            }
            ScheduleEntry entry = firing.get().entry();
            firing.get().pending().thenAccept(outcome -> onCompleted(entry, outcome));
            dispatched++;
        }
        return dispatched;
    }

    // claim and submission share the lock so a cancel is either before both or after both
    private synchronized Optional<Firing> fire(DueEntry item) {
        // recorded before submission so the slot is spent even if the job resolves immediately
        Optional<ScheduleEntry> fired = markFired(item.entry().key(), item.slot());
        if (fired.isEmpty()) {
            return Optional.empty();
        }
        ScheduleEntry entry = fired.get();
        log.info("Firing scheduled check owner={} query={} slot={}", entry.ownerId(), entry.query(), item.slot());
        return Optional.of(new Firing(entry, dispatcher.dispatch(new TrackingJob.ScheduledCheck(entry))));
    }

    private void tickSafely() {
        try {
            tick();
        } catch (RuntimeException e) {
            // keep the fixed-delay task alive
            log.error("Scheduler tick failed", e);
        }
    }

    /**
     * Claims {@code slot} for the entry currently registered under {@code key}.
     *
     * @return the updated entry, or empty when the entry was cancelled, paused or has already
     *     fired this slot since the due scan
     */
    private synchronized Optional<ScheduleEntry> markFired(ScheduleKey key, Instant slot) {
        ScheduleEntry current = entries.get(key);
        if (current == null || !current.enabled()) {
            return Optional.empty();
        }
        if (current.lastFired() != null && !current.lastFired().isBefore(slot)) {
            return Optional.empty();
        }
        ScheduleEntry fired = current.withLastFired(slot);
        entries.put(key, fired);
        try {
            store.save(entries.values());
        } catch (StoreWriteException e) {
            // memory stays ahead of disk so this process does not fire the slot twice
            log.error("Could not persist lastFired for owner={} query={}: {}", key.ownerId(), key.query(), e.getMessage());
        }
        return Optional.of(fired);
    }

    private void onCompleted(ScheduleEntry entry, JobOutcome outcome) {
        JobStatus status = outcome.status();
        if (status.isRetryable()) {
            log.info(
                "Scheduled check owner={} query={} ended {} ({}), next slot retries",
                entry.ownerId(),
                entry.query(),
                status.label(),
                outcome.reasonCode()
            );
            return;
        }
        try {
            notifier.deliver(entry, outcome);
        } catch (RuntimeException e) {
            log.warn("Notification for owner={} query={} failed: {}", entry.ownerId(), entry.query(), e.getMessage());
        }
    }

    private void persist(Map<ScheduleKey, ScheduleEntry> next) {
        store.save(next.values());
        entries.clear();
        entries.putAll(next);
    }

    private record DueEntry(ScheduleEntry entry, Instant slot) {
    }

    private record Firing(ScheduleEntry entry, CompletableFuture<JobOutcome> pending) {
    }
}
