package com.containerwatch.tracker.geo;

import com.containerwatch.tracker.config.TrackerProperties;
import com.containerwatch.tracker.model.Coordinates;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NominatimGeocoderTest {
    private MockWebServer server;
    private ExecutorService executor;
    private NominatimGeocoder geocoder;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);

        TrackerProperties properties = new TrackerProperties();
        properties.getGeocoding().setBaseUrl(server.url("/").toString());
        properties.getGeocoding().setUserAgent("container-watch-test");
        properties.getGeocoding().setRequestTimeoutSeconds(2);
        geocoder = new NominatimGeocoder(properties, new ObjectMapper(), executor);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void returnsFirstMatchAndSendsUserAgent() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("[{\"lat\":\"55.7558\",\"lon\":\"37.6173\",\"display_name\":\"Москва\"}]"));

        Optional<Coordinates> result = geocoder.geocode("Москва", "Russia");

        assertThat(result).contains(new Coordinates(55.7558, 37.6173));
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getHeader("User-Agent")).isEqualTo("container-watch-test");
        assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/search");
        String query = URLDecoder.decode(request.getRequestUrl().encodedQuery(), StandardCharsets.UTF_8);
        assertThat(query).contains("q=Москва,Russia").contains("format=json").contains("limit=1");
    }

    @Test
    void emptyListMeansUnknownPlace() throws Exception {
        server.enqueue(new MockResponse().setBody("[]"));

        assertThat(geocoder.geocode("Nowhere", "Russia")).isEmpty();
    }

    @Test
    void serverErrorIsAGeocodingFailure() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));

        assertThatThrownBy(() -> geocoder.geocode("Kazan", "Russia"))
            .isInstanceOf(GeocodingException.class)
            .hasMessageContaining("503");
    }

    @Test
    void garbageBodyIsAGeocodingFailure() {
        server.enqueue(new MockResponse().setBody("<html>maintenance</html>"));

        assertThatThrownBy(() -> geocoder.geocode("Kazan", "Russia"))
            .isInstanceOf(GeocodingException.class);
    }

    @Test
    void blankPlaceSkipsTheRequest() throws Exception {
        assertThat(geocoder.geocode("  ", "Russia")).isEmpty();
        assertThat(server.getRequestCount()).isZero();
    }
}
