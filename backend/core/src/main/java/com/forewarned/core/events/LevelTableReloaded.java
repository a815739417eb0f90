package com.forewarned.core.events;

import java.time.Instant;
import java.util.List;

public record LevelTableReloaded(
        Instant timestamp,
        List<String> configuredLevels
) implements Event {
    @Override
    public String type() {
        return "LevelTableReloaded";
    }
}
