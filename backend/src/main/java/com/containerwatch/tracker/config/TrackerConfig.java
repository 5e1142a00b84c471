package com.containerwatch.tracker.config;

import com.containerwatch.tracker.execution.AutomationGate;
import com.containerwatch.tracker.geo.GeoCache;
import com.containerwatch.tracker.metrics.MetricsSink;
import com.containerwatch.tracker.model.CacheEntry;
import com.containerwatch.tracker.model.ScheduleEntry;
import com.containerwatch.tracker.persistence.JsonFileRecordStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class TrackerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "dispatchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService dispatchExecutor(TrackerProperties properties) {
        return Executors.newFixedThreadPool(
            properties.getScheduler().getDispatchThreads(),
            namedThreads("tracker-dispatch")
        );
    }

    // A hung browser step holds its thread until its session is closed; the automation gate bounds concurrency.
    @Bean(name = "automationExecutor", destroyMethod = "shutdownNow")
    public ExecutorService automationExecutor() {
        return Executors.newCachedThreadPool(namedThreads("tracker-automation"));
    }

    @Bean(name = "schedulerTicker", destroyMethod = "shutdownNow")
    public ScheduledExecutorService schedulerTicker() {
        return Executors.newSingleThreadScheduledExecutor(namedThreads("tracker-scheduler"));
    }

    @Bean(name = "maintenanceExecutor", destroyMethod = "shutdownNow")
    public ScheduledExecutorService maintenanceExecutor() {
        return Executors.newSingleThreadScheduledExecutor(namedThreads("tracker-maintenance"));
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor() {
        return Executors.newFixedThreadPool(2, namedThreads("tracker-http"));
    }

    @Bean
    public AutomationGate automationGate(TrackerProperties properties) {
        return new AutomationGate(properties.getScheduler().getMaxConcurrentJobs());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public JsonFileRecordStore<ScheduleEntry> scheduleStore(TrackerProperties properties, ObjectMapper objectMapper) {
        return new JsonFileRecordStore<>(
            Path.of(properties.getDataDir(), "schedule.json"),
            ScheduleEntry.class,
            objectMapper
        );
    }

    @Bean
    public JsonFileRecordStore<CacheEntry> geoCacheStore(TrackerProperties properties, ObjectMapper objectMapper) {
        return new JsonFileRecordStore<>(
            Path.of(properties.getDataDir(), "geocache.json"),
            CacheEntry.class,
            objectMapper
        );
    }

    @Bean
    public GeoCache geoCache(
        @Qualifier("geoCacheStore") JsonFileRecordStore<CacheEntry> geoCacheStore,
        Clock clock,
        TrackerProperties properties,
        MetricsSink metrics
    ) {
        return new GeoCache(
            geoCacheStore,
            clock,
            Duration.ofDays(properties.getGeocoding().getCacheTtlDays()),
            metrics,
            geoCacheStore.file().toString()
        );
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
