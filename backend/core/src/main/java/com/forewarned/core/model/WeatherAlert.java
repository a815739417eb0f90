package com.forewarned.core.model;

import java.time.Instant;
import java.util.Objects;

public record WeatherAlert(
        String event,
        Severity severity,
        String headline,
        String areas,
        Instant onset,
        Instant expires,
        String source
) {
    public WeatherAlert {
        event = event == null ? "" : event;
        severity = severity == null ? Severity.UNKNOWN : severity;
        headline = headline == null || headline.isBlank() ? event : headline;
        areas = areas == null ? "" : areas;
        Objects.requireNonNull(source, "source is required");
    }
}
