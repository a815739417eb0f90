package com.forewarned.core.events;

import java.time.Instant;
import java.util.Map;

public record EocSnapshotReceived(
        Instant timestamp,
        int siteCount,
        int activatedCount,
        Map<String, String> states
) implements Event {
    @Override
    public String type() {
        return "EocSnapshotReceived";
    }
}
