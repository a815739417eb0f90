package com.forewarned.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record LocalAlertState(
        boolean active,
        AlertLevel level,
        String reason,
        List<String> triggeredBy,
        Instant timestamp
) {
    public static final String NO_ACTIVE_ALERTS = "No active alerts";

    public LocalAlertState {
        Objects.requireNonNull(level, "level is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        reason = reason == null ? "" : reason;
        triggeredBy = triggeredBy == null ? List.of() : List.copyOf(triggeredBy);
    }

    public static LocalAlertState initial(Instant timestamp) {
        return new LocalAlertState(false, AlertLevel.NONE, "", List.of(), timestamp);
    }

    /**
     * Only the (active, level) pair counts as a change; reason and triggers are descriptive.
     */
    public boolean sameOutcomeAs(LocalAlertState other) {
        return active == other.active && level == other.level;
    }
}
