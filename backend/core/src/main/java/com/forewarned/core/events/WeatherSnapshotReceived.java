package com.forewarned.core.events;

import java.time.Instant;
import java.util.List;

public record WeatherSnapshotReceived(
        Instant timestamp,
        int alertCount,
        List<String> events
) implements Event {
    @Override
    public String type() {
        return "WeatherSnapshotReceived";
    }
}
