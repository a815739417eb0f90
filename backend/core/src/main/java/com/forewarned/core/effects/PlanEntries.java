package com.forewarned.core.effects;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

final class PlanEntries {
    private static final Logger LOGGER = Logger.getLogger(PlanEntries.class.getName());

    private PlanEntries() {
    }

    /**
     * Copies {@code entries} without null or blank items, warning once per skipped item.
     */
    static List<String> cleaned(String plan, String key, List<String> entries) {
        if (entries == null) {
            return List.of();
        }
        List<String> kept = new ArrayList<>(entries.size());
        for (String entry : entries) {
            if (entry == null || entry.isBlank()) {
                LOGGER.warning("Ignoring empty " + plan + " entry under " + key);
                continue;
            }
            kept.add(entry);
        }
        return List.copyOf(kept);
    }
}
