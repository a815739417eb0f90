package com.forewarned.core.model;

import java.util.Objects;

public record Transition(LocalAlertState previous, LocalAlertState current) {
    public Transition {
        Objects.requireNonNull(previous, "previous is required");
        Objects.requireNonNull(current, "current is required");
    }

    public boolean cleared() {
        return !current.active();
    }
}
