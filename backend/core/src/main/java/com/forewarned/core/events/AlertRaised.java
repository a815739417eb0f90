package com.forewarned.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An operational problem worth surfacing: a failed poll, an override lookup that errored, or a
 * side effect that could not be delivered. Category is one of {@code collector}, {@code override}
 * or {@code effect}.
 */
public record AlertRaised(
        Instant timestamp,
        String category,
        String message,
        Map<String, Object> details
) implements Event {
    public static final String COLLECTOR = "collector";
    public static final String OVERRIDE = "override";
    public static final String EFFECT = "effect";

    @Override
    public String type() {
        return "AlertRaised";
    }
}
