package com.containerwatch.tracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DateTimeException;
import java.time.ZoneId;

@ConfigurationProperties(prefix = "tracker")
public class TrackerProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    private static final String DEFAULT_TIMEZONE = "Europe/Moscow";

    private String botToken;
    private String timezone = DEFAULT_TIMEZONE;
    private String dataDir = "data";
    private String defaultDestination = "Москва";
    private Scheduler scheduler = new Scheduler();
    private Automation automation = new Automation();
    private Geocoding geocoding = new Geocoding();

    public String getBotToken() {
        return botToken;
    }

    public void setBotToken(String botToken) {
        this.botToken = botToken == null ? null : botToken.trim();
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = (timezone == null || timezone.isBlank()) ? DEFAULT_TIMEZONE : timezone.trim();
    }

    public ZoneId zoneId() {
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            return ZoneId.of(DEFAULT_TIMEZONE);
        }
    }

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = (dataDir == null || dataDir.isBlank()) ? "data" : dataDir.trim();
    }

    public String getDefaultDestination() {
        return defaultDestination;
    }

    public void setDefaultDestination(String defaultDestination) {
        this.defaultDestination = defaultDestination;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Automation getAutomation() {
        return automation;
    }

    public void setAutomation(Automation automation) {
        this.automation = automation;
    }

    public Geocoding getGeocoding() {
        return geocoding;
    }

    public void setGeocoding(Geocoding geocoding) {
        this.geocoding = geocoding;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Scheduler {
        private boolean enabled = true;
        private int tickSeconds = 20;
        private int misfireGraceSeconds = 120;
        private int maxConcurrentJobs = 2;
        private int dispatchThreads = 4;
        private int slotWaitSeconds = 900;
        private int scheduledTimeoutSeconds = 180;
        private int interactiveTimeoutSeconds = 120;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getTickSeconds() {
            return Math.max(1, tickSeconds);
        }

        public void setTickSeconds(int tickSeconds) {
            this.tickSeconds = Math.max(1, tickSeconds);
        }

        public int getMisfireGraceSeconds() {
            return Math.max(getTickSeconds(), misfireGraceSeconds);
        }

        public void setMisfireGraceSeconds(int misfireGraceSeconds) {
            this.misfireGraceSeconds = Math.max(1, misfireGraceSeconds);
        }

        public int getMaxConcurrentJobs() {
            return Math.max(1, maxConcurrentJobs);
        }

        public void setMaxConcurrentJobs(int maxConcurrentJobs) {
            this.maxConcurrentJobs = Math.max(1, maxConcurrentJobs);
        }

        public int getDispatchThreads() {
            return Math.max(getMaxConcurrentJobs(), dispatchThreads);
        }

        public void setDispatchThreads(int dispatchThreads) {
            this.dispatchThreads = Math.max(1, dispatchThreads);
        }

        public int getSlotWaitSeconds() {
            return Math.max(1, slotWaitSeconds);
        }

        public void setSlotWaitSeconds(int slotWaitSeconds) {
            this.slotWaitSeconds = Math.max(1, slotWaitSeconds);
        }

        public int getScheduledTimeoutSeconds() {
            return Math.max(5, scheduledTimeoutSeconds);
        }

        public void setScheduledTimeoutSeconds(int scheduledTimeoutSeconds) {
            this.scheduledTimeoutSeconds = Math.max(5, scheduledTimeoutSeconds);
        }

        public int getInteractiveTimeoutSeconds() {
            return Math.max(5, interactiveTimeoutSeconds);
        }

        public void setInteractiveTimeoutSeconds(int interactiveTimeoutSeconds) {
            this.interactiveTimeoutSeconds = Math.max(5, interactiveTimeoutSeconds);
        }
    }

    public static class Automation {
        private String trackingUrl = "https://isales.trcont.com/?tab=tracking&lang=ru";
        private String userAgent;
        private boolean headless = true;
        private int pageLoadTimeoutSeconds = 30;
        private int elementWaitSeconds = 10;
        private boolean screenshotsEnabled = false;
        private String screenshotDir = "screenshots";

        public String getTrackingUrl() {
            return trackingUrl;
        }

        public void setTrackingUrl(String trackingUrl) {
            this.trackingUrl = trackingUrl;
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public int getPageLoadTimeoutSeconds() {
            return Math.max(1, pageLoadTimeoutSeconds);
        }

        public void setPageLoadTimeoutSeconds(int pageLoadTimeoutSeconds) {
            this.pageLoadTimeoutSeconds = Math.max(1, pageLoadTimeoutSeconds);
        }

        public int getElementWaitSeconds() {
            return Math.max(1, elementWaitSeconds);
        }

        public void setElementWaitSeconds(int elementWaitSeconds) {
            this.elementWaitSeconds = Math.max(1, elementWaitSeconds);
        }

        public boolean isScreenshotsEnabled() {
            return screenshotsEnabled;
        }

        public void setScreenshotsEnabled(boolean screenshotsEnabled) {
            this.screenshotsEnabled = screenshotsEnabled;
        }

        public String getScreenshotDir() {
            return screenshotDir;
        }

        public void setScreenshotDir(String screenshotDir) {
            this.screenshotDir = screenshotDir;
        }
    }

    public static class Geocoding {
        private String baseUrl = "https://nominatim.openstreetmap.org";
        private String country = "Russia";
        private String userAgent = "container-watch/0.1 (+geocoding)";
        private int requestTimeoutSeconds = 10;
        private int cacheTtlDays = 30;
        private int evictionIntervalHours = 24;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getCountry() {
            return country;
        }

        public void setCountry(String country) {
            this.country = country == null ? "" : country.trim();
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = (userAgent == null || userAgent.isBlank()) ? "container-watch/0.1 (+geocoding)" : userAgent.trim();
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getCacheTtlDays() {
            return Math.max(1, cacheTtlDays);
        }

        public void setCacheTtlDays(int cacheTtlDays) {
            this.cacheTtlDays = Math.max(1, cacheTtlDays);
        }

        public int getEvictionIntervalHours() {
            return Math.max(1, evictionIntervalHours);
        }

        public void setEvictionIntervalHours(int evictionIntervalHours) {
            this.evictionIntervalHours = Math.max(1, evictionIntervalHours);
        }
    }
}
