package com.forewarned.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * State of every monitored EOC site from one poll, keyed by site identifier.
 */
public record EocSnapshot(Map<String, EocSiteState> sites, Instant receivedAt) {
    public EocSnapshot {
        Objects.requireNonNull(sites, "sites is required");
        Objects.requireNonNull(receivedAt, "receivedAt is required");
        sites = Collections.unmodifiableMap(new LinkedHashMap<>(sites));
    }

    public static EocSnapshot empty() {
        return new EocSnapshot(Map.of(), Instant.EPOCH);
    }

    @JsonIgnore
    public long activatedCount() {
        return sites.values().stream().filter(EocSiteState::activated).count();
    }
}
