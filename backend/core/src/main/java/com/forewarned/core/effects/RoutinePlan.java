package com.forewarned.core.effects;

import com.forewarned.core.model.AlertLevel;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Scene and script identifiers to run when a level activates, the list for "alerts cleared", and
 * the named routines the weather and EOC feeds trigger on their own ({@code tornado_warning},
 * {@code severe_weather}, {@code eoc_<state>}, {@code eoc_activated}).
 */
public record RoutinePlan(
        Map<AlertLevel, List<String>> alertRoutines,
        List<String> clearedRoutines,
        Map<String, List<String>> namedRoutines
) {
    private static final String PLAN = "routine";

    public RoutinePlan {
        Objects.requireNonNull(alertRoutines, "alertRoutines is required");
        EnumMap<AlertLevel, List<String>> copy = new EnumMap<>(AlertLevel.class);
        alertRoutines.forEach((level, routines) -> copy.put(level, PlanEntries.cleaned(PLAN, level.key(), routines)));
        alertRoutines = Map.copyOf(copy);
        clearedRoutines = PlanEntries.cleaned(PLAN, "alert_cleared", clearedRoutines);

        Map<String, List<String>> named = new LinkedHashMap<>();
        if (namedRoutines != null) {
            namedRoutines.forEach((key, routines) -> {
                if (key != null && routines != null) {
                    named.put(key, PlanEntries.cleaned(PLAN, key, routines));
                }
            });
        }
        namedRoutines = Map.copyOf(named);
    }

    public RoutinePlan(Map<AlertLevel, List<String>> alertRoutines, List<String> clearedRoutines) {
        this(alertRoutines, clearedRoutines, Map.of());
    }

    public static RoutinePlan empty() {
        return new RoutinePlan(Map.of(), List.of(), Map.of());
    }

    public List<String> routinesFor(AlertLevel level) {
        return alertRoutines.getOrDefault(level, List.of());
    }

    /**
     * Empty when no routine of that name is configured, which is different from a configured
     * routine with no entries.
     */
    public Optional<List<String>> named(String key) {
        return Optional.ofNullable(namedRoutines.get(key));
    }
}
