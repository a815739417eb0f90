package com.forewarned.core.engine;

import com.forewarned.core.model.AlertLevel;

/**
 * Registry of manual override switches, one per real alert level. Implementations may throw
 * when the backing store cannot be reached; callers treat that as "off".
 */
public interface OverrideSource {
    boolean isOn(AlertLevel level);

    String name();

    static OverrideSource none() {
        return new OverrideSource() {
            @Override
            public boolean isOn(AlertLevel level) {
                return false;
            }

            @Override
            public String name() {
                return "none";
            }
        };
    }
}
