package com.forewarned.collectors.weather;

import com.forewarned.core.model.WeatherAlert;

import java.util.Map;

/**
 * Source of currently active weather alerts keyed by the feed's alert identifier. Implementations
 * throw {@link IllegalStateException} when the feed cannot be read.
 */
public interface WeatherAlertProvider {
    String name();

    Map<String, WeatherAlert> activeAlerts();
}
