package com.forewarned.collectors.api;

import java.util.Map;

/**
 * Outcome of one poll. {@code snapshotSubmitted} is true only when a complete snapshot reached the
 * engine during the poll.
 */
public record CollectorResult(boolean success, boolean snapshotSubmitted, String message, Map<String, Object> stats) {
    public static CollectorResult submitted(String message, Map<String, Object> stats) {
        return new CollectorResult(true, true, message, stats);
    }

    public static CollectorResult failure(String message, Map<String, Object> stats) {
        return new CollectorResult(false, false, message, stats);
    }
}
