package com.containerwatch.tracker.geo;

import com.containerwatch.tracker.config.TrackerProperties;
import com.containerwatch.tracker.model.Coordinates;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

@Service
public class NominatimGeocoder implements Geocoder {
    private final TrackerProperties.Geocoding properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public NominatimGeocoder(
        TrackerProperties properties,
        ObjectMapper objectMapper,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties.getGeocoding();
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(this.properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .executor(httpExecutor)
            .build();
    }

    @Override
    public Optional<Coordinates> geocode(String place, String country) throws GeocodingException {
        if (place == null || place.isBlank()) {
            return Optional.empty();
        }
        URI uri = searchUri(place.trim(), country);
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", "application/json")
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new GeocodingException("geocoding timed out for " + place, e);
        } catch (IOException e) {
            throw new GeocodingException("geocoding request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GeocodingException("geocoding interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw new GeocodingException("geocoding returned HTTP " + response.statusCode());
        }
        return parse(response.body());
    }

    Optional<Coordinates> parse(String body) throws GeocodingException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (IOException e) {
            throw new GeocodingException("geocoding response is not JSON", e);
        }
        if (root == null || !root.isArray()) {
            throw new GeocodingException("geocoding response is not a list");
        }
        if (root.isEmpty()) {
            return Optional.empty();
        }
        JsonNode first = root.get(0);
        try {
            double lat = Double.parseDouble(first.path("lat").asText());
            double lon = Double.parseDouble(first.path("lon").asText());
            return Optional.of(new Coordinates(lat, lon));
        } catch (IllegalArgumentException e) {
            throw new GeocodingException("geocoding result has no usable coordinates", e);
        }
    }

    private URI searchUri(String place, String country) {
        String q = (country == null || country.isBlank()) ? place : place + "," + country.trim();
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + "/search?q=" + URLEncoder.encode(q, StandardCharsets.UTF_8)
            + "&format=json&limit=1");
    }
}
