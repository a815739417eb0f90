package com.forewarned.core.engine;

import com.forewarned.core.model.AlertLevel;
import com.forewarned.core.model.LocalAlertState;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record Classification(AlertLevel level, List<String> reasons) {
    private static final Classification NONE = new Classification(AlertLevel.NONE, List.of());

    public Classification {
        Objects.requireNonNull(level, "level is required");
        reasons = List.copyOf(reasons);
    }

    public static Classification none() {
        return NONE;
    }

    public boolean triggered() {
        return level != AlertLevel.NONE;
    }

    public String reasonText() {
        return reasons.isEmpty() ? LocalAlertState.NO_ACTIVE_ALERTS : String.join(", ", reasons);
    }

    public LocalAlertState toState(Instant timestamp) {
        return new LocalAlertState(triggered(), level, reasonText(), reasons, timestamp);
    }
}
