package com.forewarned.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Every active weather alert from one poll, keyed by the feed's identifier. A new snapshot
 * supersedes the previous one entirely.
 */
public record WeatherSnapshot(Map<String, WeatherAlert> alerts, Instant receivedAt) {
    public WeatherSnapshot {
        Objects.requireNonNull(alerts, "alerts is required");
        Objects.requireNonNull(receivedAt, "receivedAt is required");
        alerts = Collections.unmodifiableMap(new LinkedHashMap<>(alerts));
    }

    public static WeatherSnapshot empty() {
        return new WeatherSnapshot(Map.of(), Instant.EPOCH);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return alerts.isEmpty();
    }
}
