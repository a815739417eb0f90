package com.forewarned.service.config;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Contents of {@code weather.json}. {@code provider} is {@code mock} (reads {@code fixturePath}) or
 * {@code noaa} (queries active alerts for the configured point).
 */
public record WeatherSourceConfig(
        Duration interval,
        String provider,
        String fixturePath,
        Double latitude,
        Double longitude,
        String noaaBaseUrl,
        List<String> areaKeywords
) {
    public static final String MOCK = "mock";
    public static final String NOAA = "noaa";

    public WeatherSourceConfig {
        interval = interval == null ? Duration.ofMinutes(5) : interval;
        provider = provider == null || provider.isBlank() ? MOCK : provider.trim().toLowerCase(Locale.ROOT);
        noaaBaseUrl = noaaBaseUrl == null || noaaBaseUrl.isBlank() ? "https://api.weather.gov" : noaaBaseUrl;
        areaKeywords = areaKeywords == null ? List.of() : List.copyOf(areaKeywords);
    }
}
