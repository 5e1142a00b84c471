package com.containerwatch.tracker.geo;

import com.containerwatch.tracker.config.TrackerProperties;
import com.containerwatch.tracker.metrics.MetricsSink;
import com.containerwatch.tracker.metrics.TrackerMetrics;
import com.containerwatch.tracker.model.Coordinates;
import com.containerwatch.tracker.persistence.StoreWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Cache-first place resolution. Geocoding failures never fail the caller; they yield empty.
 */
@Service
public class GeoLookupService {
    private static final Logger log = LoggerFactory.getLogger(GeoLookupService.class);

    private final GeoCache cache;
    private final Geocoder geocoder;
    private final MetricsSink metrics;
    private final String country;

    public GeoLookupService(GeoCache cache, Geocoder geocoder, MetricsSink metrics, TrackerProperties properties) {
        this.cache = cache;
        this.geocoder = geocoder;
        this.metrics = metrics;
        this.country = properties.getGeocoding().getCountry();
    }

    public Optional<Coordinates> resolve(String rawPlace) {
        if (rawPlace == null || rawPlace.isBlank()) {
            return Optional.empty();
        }
        String place = rawPlace.trim();
        String cacheKey = cacheKey(place);
        Optional<Coordinates> cached = cache.get(cacheKey);
        if (cached.isPresent()) {
            return cached;
        }

        long started = System.nanoTime();
        String outcome = "found";
        try {
            Optional<Coordinates> found = geocoder.geocode(place, country);
            if (found.isEmpty()) {
                outcome = "not_found";
                log.info("No coordinates for place={} country={}", place, country);
                return Optional.empty();
            }
            store(cacheKey, found.get());
            return found;
        } catch (GeocodingException e) {
            outcome = "error";
            log.warn("Geocoding failed for place={}: {}", place, e.getMessage());
            return Optional.empty();
        } finally {
            double seconds = (System.nanoTime() - started) / 1_000_000_000.0;
            metrics.observe(TrackerMetrics.GEOCODING_DURATION, seconds, Map.of("outcome", outcome));
        }
    }

    String cacheKey(String place) {
        if (country == null || country.isBlank()) {
            return place;
        }
        return place + "," + country;
    }

    private void store(String cacheKey, Coordinates coordinates) {
        try {
            cache.put(cacheKey, coordinates);
        } catch (StoreWriteException e) {
            log.warn("Could not persist geocache entry for {}: {}", cacheKey, e.getMessage());
        }
    }
}
