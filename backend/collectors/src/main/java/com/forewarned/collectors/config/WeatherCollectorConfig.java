package com.forewarned.collectors.config;

import java.time.Duration;
import java.util.List;

/**
 * @param areaKeywords alerts must mention one of these in event, headline or areas; empty keeps all
 */
public record WeatherCollectorConfig(Duration interval, List<String> areaKeywords) {
    public WeatherCollectorConfig {
        areaKeywords = areaKeywords == null ? List.of() : List.copyOf(areaKeywords);
    }
}
