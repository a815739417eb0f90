package com.forewarned.core.engine;

import com.forewarned.core.model.AlertLevel;
import com.forewarned.core.model.LocalAlertState;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record OverrideDecision(AlertLevel level, String reason) {
    public OverrideDecision {
        Objects.requireNonNull(level, "level is required");
        Objects.requireNonNull(reason, "reason is required");
    }

    public static OverrideDecision forLevel(AlertLevel level) {
        return new OverrideDecision(level, "Manual override: " + level.label());
    }

    public LocalAlertState toState(Instant timestamp) {
        return new LocalAlertState(true, level, reason, List.of(reason), timestamp);
    }
}
