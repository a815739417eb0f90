package com.forewarned.service.api;

import com.forewarned.core.bus.EventBus;
import com.forewarned.core.events.AlertRaised;
import com.forewarned.core.events.AlertStateChanged;
import com.forewarned.core.events.CollectorTickCompleted;
import com.forewarned.core.events.CollectorTickStarted;
import com.forewarned.core.model.AlertLevel;
import com.forewarned.core.model.LocalAlertState;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DiagnosticsTrackerTest {
    private static final Instant T0 = Instant.parse("2026-02-09T20:00:00Z");

    @Test
    void tracksCollectorRunsAndLastError() {
        EventBus bus = new EventBus();
        DiagnosticsTracker tracker = new DiagnosticsTracker(bus);

        bus.publish(new CollectorTickStarted(T0, "eocCollector"));
        bus.publish(new AlertRaised(T0.plusMillis(50), AlertRaised.COLLECTOR, "HTTP status 503 from https://example.com",
                Map.of("collector", "eocCollector", "siteId", "townsville")));
        bus.publish(new CollectorTickCompleted(T0.plusMillis(120), "eocCollector", false, false, 120));

        Map<String, Object> status = collector(tracker, "eocCollector");
        assertEquals(false, status.get("lastSuccess"));
        assertEquals(120L, status.get("lastDurationMillis"));
        assertEquals("HTTP status 503 from https://example.com", status.get("lastErrorMessage"));

        bus.publish(new CollectorTickCompleted(T0.plusSeconds(600), "eocCollector", true, true, 80));
        status = collector(tracker, "eocCollector");
        assertEquals(true, status.get("lastSuccess"));
        assertNull(status.get("lastErrorMessage"));
        assertEquals(T0.plusSeconds(600).toString(), status.get("lastRunAt"));
    }

    @Test
    void countsTransitionsAndEffectFailures() {
        EventBus bus = new EventBus();
        DiagnosticsTracker tracker = new DiagnosticsTracker(bus);
        LocalAlertState idle = LocalAlertState.initial(T0);
        LocalAlertState watch = new LocalAlertState(true, AlertLevel.WATCH, "Weather: Flood Watch", List.of("Weather: Flood Watch"), T0);

        bus.publish(new AlertStateChanged(T0, idle, watch));
        bus.publish(new AlertStateChanged(T0.plusSeconds(1), watch, idle));
        bus.publish(new AlertRaised(T0, AlertRaised.EFFECT, "Routine scene.storm_prep failed", Map.of()));
        bus.publish(new AlertRaised(T0, AlertRaised.OVERRIDE, "Override lookup failed for watch: 500", Map.of("level", "watch")));

        Map<String, Object> snapshot = tracker.snapshot();
        assertEquals(2L, snapshot.get("transitionsTotal"));
        assertEquals(1L, snapshot.get("effectFailuresTotal"));
        assertEquals(1L, snapshot.get("overrideErrorsTotal"));
        assertTrue(tracker.collectorsSnapshot().isEmpty());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> collector(DiagnosticsTracker tracker, String name) {
        return (Map<String, Object>) tracker.collectorsSnapshot().get(name);
    }
}
