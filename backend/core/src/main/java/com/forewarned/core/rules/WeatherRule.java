package com.forewarned.core.rules;

import com.forewarned.core.model.Severity;

import java.util.Locale;

/**
 * Matches weather alerts by event-type substring and exact severity. A {@code null} component
 * means "any". The event type is only lower-cased, so surrounding whitespace takes part in the
 * substring match.
 */
public record WeatherRule(String eventType, Severity severity) implements ConditionRule {
    public static final String ANY = "any";

    public WeatherRule {
        if (eventType != null) {
            eventType = eventType.toLowerCase(Locale.ROOT);
            if (ANY.equals(eventType)) {
                eventType = null;
            }
        }
    }

    public static WeatherRule anyEventWithSeverity(Severity severity) {
        return new WeatherRule(null, severity);
    }

    public static WeatherRule eventOfAnySeverity(String eventType) {
        return new WeatherRule(eventType, null);
    }

    public boolean anyEventType() {
        return eventType == null;
    }

    public boolean anySeverity() {
        return severity == null;
    }
}
