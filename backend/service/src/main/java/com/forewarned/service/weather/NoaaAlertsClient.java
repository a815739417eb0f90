package com.forewarned.service.weather;

import com.fasterxml.jackson.databind.JsonNode;
import com.forewarned.collectors.weather.WeatherAlertProvider;
import com.forewarned.core.model.Severity;
import com.forewarned.core.model.WeatherAlert;
import com.forewarned.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Active alerts for one point from the api.weather.gov GeoJSON feed.
 */
public final class NoaaAlertsClient implements WeatherAlertProvider {
    private final HttpClient httpClient;
    private final String baseUrl;
    private final double latitude;
    private final double longitude;
    private final Duration timeout;
    private final String userAgent;

    public NoaaAlertsClient(
            HttpClient httpClient,
            String baseUrl,
            double latitude,
            double longitude,
            Duration timeout,
            String userAgent
    ) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.latitude = latitude;
        this.longitude = longitude;
        this.timeout = timeout;
        this.userAgent = userAgent;
    }

    @Override
    public String name() {
        return "noaa";
    }

    @Override
    public Map<String, WeatherAlert> activeAlerts() {
        JsonNode collection = getJson(URI.create(baseUrl + "/alerts/active?point=" + latitude + "," + longitude));
        JsonNode features = collection.path("features");
        if (!features.isArray()) {
            throw new IllegalStateException("NOAA alerts response missing features");
        }
        Map<String, WeatherAlert> alerts = new LinkedHashMap<>();
        for (JsonNode feature : features) {
            JsonNode properties = feature.path("properties");
            String id = properties.path("id").asText(feature.path("id").asText(""));
            if (id.isBlank()) {
                continue;
            }
            alerts.put(id, new WeatherAlert(
                    properties.path("event").asText(""),
                    Severity.fromText(properties.path("severity").asText("")),
                    properties.path("headline").asText(""),
                    properties.path("areaDesc").asText(""),
                    instant(properties.path("onset")),
                    instant(properties.path("expires")),
                    name()
            ));
        }
        return alerts;
    }

    private JsonNode getJson(URI uri) {
        int attempts = 0;
        while (true) {
            attempts++;
            HttpRequest request = HttpRequest.newBuilder(uri)
                    .GET()
                    .timeout(timeout)
                    .header("Accept", "application/geo+json,application/json")
                    .header("User-Agent", userAgent)
                    .build();
            HttpResponse<String> response;
            try {
                response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            } catch (IOException e) {
                throw new IllegalStateException("NOAA alerts request failed for " + uri, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted during NOAA alerts request", e);
            }
            if (response.statusCode() / 100 == 2) {
                try {
                    return JsonUtils.objectMapper().readTree(response.body());
                } catch (IOException e) {
                    throw new IllegalStateException("NOAA alerts response was not JSON", e);
                }
            }
            if (attempts >= 2 || response.statusCode() < 500) {
                throw new IllegalStateException("NOAA request failed with status " + response.statusCode() + " for " + uri);
            }
        }
    }

    private static Instant instant(JsonNode node) {
        String text = node.asText("");
        if (text.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
