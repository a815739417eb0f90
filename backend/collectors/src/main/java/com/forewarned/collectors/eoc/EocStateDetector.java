package com.forewarned.collectors.eoc;

import com.forewarned.core.model.EocState;

import java.util.List;
import java.util.Locale;

/**
 * Reads an EOC operating state out of page text by keyword. The most escalated phrase wins when a
 * page mentions several.
 */
public final class EocStateDetector {
    private static final List<Keywords> PRIORITY = List.of(
            new Keywords(EocState.STAND_UP, List.of("stand up", "standup")),
            new Keywords(EocState.LEAN_FORWARD, List.of("lean forward", "leanforward")),
            new Keywords(EocState.STAND_DOWN, List.of("stand down", "standdown")),
            new Keywords(EocState.ALERT, List.of("status:alert", "status: alert"))
    );

    private EocStateDetector() {
    }

    public static EocState detect(String text) {
        if (text == null || text.isBlank()) {
            return EocState.INACTIVE;
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        for (Keywords keywords : PRIORITY) {
            if (keywords.phrases().stream().anyMatch(lowered::contains)) {
                return keywords.state();
            }
        }
        return EocState.INACTIVE;
    }

    private record Keywords(EocState state, List<String> phrases) {
    }
}
