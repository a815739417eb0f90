package com.forewarned.core.effects;

import com.forewarned.core.model.AlertLevel;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record CallPlan(Map<AlertLevel, List<String>> destinations) {
    public CallPlan {
        Objects.requireNonNull(destinations, "destinations is required");
        EnumMap<AlertLevel, List<String>> copy = new EnumMap<>(AlertLevel.class);
        destinations.forEach((level, numbers) -> copy.put(level, PlanEntries.cleaned("voice call", level.key(), numbers)));
        destinations = Map.copyOf(copy);
    }

    public static CallPlan empty() {
        return new CallPlan(Map.of());
    }

    public List<String> destinationsFor(AlertLevel level) {
        return destinations.getOrDefault(level, List.of());
    }
}
