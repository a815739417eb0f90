package com.forewarned.core.model;

import java.util.Locale;

public enum Severity {
    MINOR,
    MODERATE,
    SEVERE,
    EXTREME,
    UNKNOWN;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse for feed values such as "Severe" or "EXTREME"; anything unrecognised is
     * {@link #UNKNOWN}.
     */
    public static Severity fromText(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.name().equals(normalized)) {
                return severity;
            }
        }
        return UNKNOWN;
    }
}
