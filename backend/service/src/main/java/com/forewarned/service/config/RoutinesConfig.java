package com.forewarned.service.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.forewarned.core.effects.RoutinePlan;
import com.forewarned.core.model.AlertLevel;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contents of {@code routines.json}. The {@code *_alert} and {@code alert_cleared} lists follow the
 * local alert level; the rest are run by the weather and EOC feeds themselves.
 */
public record RoutinesConfig(
        @JsonProperty("advisory_alert") List<String> advisoryAlert,
        @JsonProperty("watch_alert") List<String> watchAlert,
        @JsonProperty("warning_alert") List<String> warningAlert,
        @JsonProperty("emergency_alert") List<String> emergencyAlert,
        @JsonProperty("alert_cleared") List<String> alertCleared,
        @JsonProperty("tornado_warning") List<String> tornadoWarning,
        @JsonProperty("severe_weather") List<String> severeWeather,
        @JsonProperty("eoc_alert") List<String> eocAlert,
        @JsonProperty("eoc_lean_forward") List<String> eocLeanForward,
        @JsonProperty("eoc_stand_up") List<String> eocStandUp,
        @JsonProperty("eoc_stand_down") List<String> eocStandDown,
        @JsonProperty("eoc_activated") List<String> eocActivated
) {
    public static RoutinesConfig none() {
        return new RoutinesConfig(null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public RoutinePlan toPlan() {
        Map<AlertLevel, List<String>> byLevel = new EnumMap<>(AlertLevel.class);
        byLevel.put(AlertLevel.ADVISORY, orEmpty(advisoryAlert));
        byLevel.put(AlertLevel.WATCH, orEmpty(watchAlert));
        byLevel.put(AlertLevel.WARNING, orEmpty(warningAlert));
        byLevel.put(AlertLevel.EMERGENCY, orEmpty(emergencyAlert));

        Map<String, List<String>> named = new LinkedHashMap<>();
        putIfConfigured(named, "tornado_warning", tornadoWarning);
        putIfConfigured(named, "severe_weather", severeWeather);
        putIfConfigured(named, "eoc_alert", eocAlert);
        putIfConfigured(named, "eoc_lean_forward", eocLeanForward);
        putIfConfigured(named, "eoc_stand_up", eocStandUp);
        putIfConfigured(named, "eoc_stand_down", eocStandDown);
        putIfConfigured(named, "eoc_activated", eocActivated);
        return new RoutinePlan(byLevel, orEmpty(alertCleared), named);
    }

    private static void putIfConfigured(Map<String, List<String>> named, String key, List<String> routines) {
        if (routines != null) {
            named.put(key, routines);
        }
    }

    private static List<String> orEmpty(List<String> routines) {
        return routines == null ? List.of() : routines;
    }
}
