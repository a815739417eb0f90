package com.forewarned.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Published operating states of an emergency operations center. Labels are the human-readable
 * words the LDMG pages use ("lean forward"), and parsing accepts either spaces or underscores.
 */
public enum EocState {
    INACTIVE("inactive"),
    ALERT("alert"),
    LEAN_FORWARD("lean forward"),
    STAND_UP("stand up"),
    STAND_DOWN("stand down");

    private final String label;

    EocState(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<EocState> fromText(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', ' ').replace('-', ' ');
        for (EocState state : values()) {
            if (state.label.equals(normalized)) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }
}
