package com.containerwatch.tracker.geo;

import com.containerwatch.tracker.config.TrackerProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

@Component
public class GeoCacheMaintenance {
    private static final Logger log = LoggerFactory.getLogger(GeoCacheMaintenance.class);

    private final GeoCache cache;
    private final ScheduledExecutorService executor;
    private final long intervalHours;
    private volatile ScheduledFuture<?> task;

    public GeoCacheMaintenance(
        GeoCache cache,
        @Qualifier("maintenanceExecutor") ScheduledExecutorService executor,
        TrackerProperties properties
    ) {
        this.cache = cache;
        this.executor = executor;
        this.intervalHours = properties.getGeocoding().getEvictionIntervalHours();
    }

    @PostConstruct
    public void start() {
        task = executor.scheduleAtFixedRate(this::sweepSafely, intervalHours, intervalHours, TimeUnit.HOURS);
        log.info("Geocache eviction scheduled every {}h", intervalHours);
    }

    @PreDestroy
    public void stop() {
        ScheduledFuture<?> current = task;
        if (current != null) {
            current.cancel(false);
        }
    }

    public int sweep() {
        int removed = cache.clearExpired();
        if (removed > 0) {
            log.info("Evicted {} expired geocache entries, {} remain", removed, cache.size());
        }
        return removed;
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            // a failed sweep must not cancel the periodic task
            log.warn("Geocache eviction failed: {}", e.getMessage(), e);
        }
    }
}
