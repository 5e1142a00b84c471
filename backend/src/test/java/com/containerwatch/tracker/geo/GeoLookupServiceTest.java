package com.containerwatch.tracker.geo;

import com.containerwatch.tracker.config.TrackerProperties;
import com.containerwatch.tracker.metrics.TrackerMetrics;
import com.containerwatch.tracker.model.CacheEntry;
import com.containerwatch.tracker.model.Coordinates;
import com.containerwatch.tracker.support.InMemoryRecordStore;
import com.containerwatch.tracker.support.MutableClock;
import com.containerwatch.tracker.support.RecordingMetricsSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GeoLookupServiceTest {
    private static final Coordinates EKB = new Coordinates(56.8389, 60.6057);

    @Mock
    private Geocoder geocoder;

    private InMemoryRecordStore<CacheEntry> store;
    private GeoCache cache;
    private RecordingMetricsSink metrics;
    private GeoLookupService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore<>();
        metrics = new RecordingMetricsSink();
        cache = new GeoCache(store, new MutableClock(Instant.parse("2024-05-01T00:00:00Z")), Duration.ofDays(30), metrics, "memory");
        service = new GeoLookupService(cache, geocoder, metrics, new TrackerProperties());
    }

    @Test
    void secondLookupIsServedFromCache() throws Exception {
        when(geocoder.geocode("Екатеринбург", "Russia")).thenReturn(Optional.of(EKB));

        assertThat(service.resolve("Екатеринбург")).contains(EKB);
        assertThat(service.resolve(" екатеринбург ")).contains(EKB);

        verify(geocoder, times(1)).geocode(anyString(), anyString());
        assertThat(store.stored()).extracting(CacheEntry::key).containsExactly("екатеринбург,russia");
        assertThat(metrics.observations(TrackerMetrics.GEOCODING_DURATION)).hasSize(1);
    }

    @Test
    void geocodingFailureYieldsNoCoordinatesAndCachesNothing() throws Exception {
        when(geocoder.geocode("Kazan", "Russia")).thenThrow(new GeocodingException("geocoding returned HTTP 503"));

        assertThat(service.resolve("Kazan")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void unknownPlaceIsNotCached() throws Exception {
        when(geocoder.geocode("Atlantis", "Russia")).thenReturn(Optional.empty());

        assertThat(service.resolve("Atlantis")).isEmpty();
        assertThat(service.resolve("Atlantis")).isEmpty();

        verify(geocoder, times(2)).geocode("Atlantis", "Russia");
    }

    @Test
    void cacheWriteFailureStillReturnsCoordinates() throws Exception {
        when(geocoder.geocode("Омск", "Russia")).thenReturn(Optional.of(new Coordinates(54.9885, 73.3242)));
        store.failWrites(true);

        assertThat(service.resolve("Омск")).isPresent();
    }

    @Test
    void blankPlaceNeverCallsGeocoder() throws Exception {
        assertThat(service.resolve(" ")).isEmpty();
        assertThat(service.resolve(null)).isEmpty();
        verify(geocoder, never()).geocode(anyString(), anyString());
    }
}
