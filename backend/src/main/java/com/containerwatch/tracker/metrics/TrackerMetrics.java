package com.containerwatch.tracker.metrics;

public final class TrackerMetrics {
    public static final String JOB_DURATION = "tracker.job.duration";
    public static final String BROWSER_DURATION = "tracker.browser.duration";
    public static final String JOB_OUTCOMES = "tracker.job.outcomes";
    public static final String CHECKS = "tracker.checks";
    public static final String ACTIVE_OWNERS = "tracker.active.owners";
    public static final String GEOCACHE_HITS = "tracker.geocache.hits";
    public static final String GEOCACHE_MISSES = "tracker.geocache.misses";
    public static final String GEOCACHE_SIZE = "tracker.geocache.size";
    public static final String GEOCODING_DURATION = "tracker.geocoding.duration";

    private TrackerMetrics() {}
}
