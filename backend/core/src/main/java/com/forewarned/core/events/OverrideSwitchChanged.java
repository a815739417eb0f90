package com.forewarned.core.events;

import com.forewarned.core.model.AlertLevel;

import java.time.Instant;

public record OverrideSwitchChanged(
        Instant timestamp,
        AlertLevel level,
        boolean on
) implements Event {
    @Override
    public String type() {
        return "OverrideSwitchChanged";
    }
}
