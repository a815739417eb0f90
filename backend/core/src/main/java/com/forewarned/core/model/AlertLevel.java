package com.forewarned.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Local alert levels in ascending priority. {@link #NONE} is the synthetic "nothing triggered" level
 * and never appears in a level table.
 */
public enum AlertLevel {
    NONE("none"),
    ADVISORY("advisory"),
    WATCH("watch"),
    WARNING("warning"),
    EMERGENCY("emergency");

    private static final List<AlertLevel> DESCENDING = List.of(EMERGENCY, WARNING, WATCH, ADVISORY);

    private final String key;

    AlertLevel(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public String label() {
        return key.toUpperCase(Locale.ROOT);
    }

    /**
     * Real levels from highest to lowest priority; the order both the classifier and the
     * override resolver check in.
     */
    public static List<AlertLevel> descending() {
        return DESCENDING;
    }

    public static Optional<AlertLevel> fromKey(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (AlertLevel level : values()) {
            if (level.key.equals(normalized)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
