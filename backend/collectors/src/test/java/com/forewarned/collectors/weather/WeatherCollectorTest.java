package com.forewarned.collectors.weather;

import com.forewarned.collectors.api.CollectorContext;
import com.forewarned.collectors.api.CollectorResult;
import com.forewarned.collectors.config.WeatherCollectorConfig;
import com.forewarned.collectors.support.EventCapture;
import com.forewarned.collectors.support.FixtureUtils;
import com.forewarned.collectors.support.RecordingSnapshotSink;
import com.forewarned.core.bus.EventBus;
import com.forewarned.core.events.AlertRaised;
import com.forewarned.core.events.CollectorTickCompleted;
import com.forewarned.core.events.WeatherSnapshotReceived;
import com.forewarned.core.model.Severity;
import com.forewarned.core.model.WeatherAlert;
import com.forewarned.core.model.WeatherSnapshot;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WeatherCollectorTest {
    private static final Instant NOW = Instant.parse("2026-02-09T20:00:00Z");

    @Test
    void submitsFilteredSnapshotFromFixture() {
        MockWeatherProvider provider = new MockWeatherProvider(FixtureUtils.fixturePath("fixtures/mock-weather-alerts.json"));
        EventBus bus = strictBus();
        EventCapture capture = new EventCapture(bus);
        RecordingSnapshotSink sink = new RecordingSnapshotSink();

        CollectorResult result = new WeatherCollector(provider)
                .poll(context(bus, sink, new WeatherCollectorConfig(Duration.ofMinutes(5), List.of("Townsville", "Ross River"))))
                .join();

        assertTrue(result.success());
        assertEquals(1, sink.weather().size());
        WeatherSnapshot snapshot = sink.weather().get(0);
        assertEquals(List.of("IDQ21035", "IDQ20885"), List.copyOf(snapshot.alerts().keySet()));
        assertEquals(Severity.SEVERE, snapshot.alerts().get("IDQ21035").severity());
        assertEquals(NOW, snapshot.receivedAt());

        WeatherSnapshotReceived received = capture.byType(WeatherSnapshotReceived.class).get(0);
        assertEquals(2, received.alertCount());
        CollectorTickCompleted completed = capture.byType(CollectorTickCompleted.class).get(0);
        assertTrue(completed.snapshotSubmitted());
    }

    @Test
    void withoutAreaKeywordsOnlyCancellationsAreDropped() {
        MockWeatherProvider provider = new MockWeatherProvider(FixtureUtils.fixturePath("fixtures/mock-weather-alerts.json"));
        RecordingSnapshotSink sink = new RecordingSnapshotSink();

        new WeatherCollector(provider)
                .poll(context(strictBus(), sink, new WeatherCollectorConfig(Duration.ofMinutes(5), List.of())))
                .join();

        assertEquals(
                List.of("IDQ21035", "IDQ20885", "IDQ20600"),
                List.copyOf(sink.weather().get(0).alerts().keySet())
        );
    }

    @Test
    void emptyFeedStillSubmitsEmptySnapshot() {
        RecordingSnapshotSink sink = new RecordingSnapshotSink();
        WeatherAlertProvider quiet = provider("quiet", Map.of());

        new WeatherCollector(quiet)
                .poll(context(strictBus(), sink, new WeatherCollectorConfig(Duration.ofMinutes(5), List.of())))
                .join();

        assertEquals(1, sink.weather().size());
        assertTrue(sink.weather().get(0).isEmpty());
    }

    @Test
    void providerFailureRaisesCollectorAlertAndSubmitsNothing() {
        EventBus bus = strictBus();
        EventCapture capture = new EventCapture(bus);
        RecordingSnapshotSink sink = new RecordingSnapshotSink();
        WeatherAlertProvider broken = new WeatherAlertProvider() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public Map<String, WeatherAlert> activeAlerts() {
                throw new IllegalStateException("feed returned HTTP 503");
            }
        };

        CollectorResult result = new WeatherCollector(broken)
                .poll(context(bus, sink, new WeatherCollectorConfig(Duration.ofMinutes(5), List.of())))
                .join();

        assertFalse(result.success());
        assertTrue(sink.weather().isEmpty());
        AlertRaised alert = capture.byType(AlertRaised.class).get(0);
        assertEquals(AlertRaised.COLLECTOR, alert.category());
        assertEquals("Weather fetch failed from broken: feed returned HTTP 503", alert.message());
        assertFalse(capture.byType(CollectorTickCompleted.class).get(0).success());
    }

    @Test
    void cancellationIsDetectedInEventOrHeadline() {
        WeatherAlert cancelledEvent = new WeatherAlert("Cancellation - Flood Warning", Severity.MINOR, "", "", null, null, "bom");
        WeatherAlert live = new WeatherAlert("Flood Warning", Severity.MINOR, "Flood Warning for Ross River", "", null, null, "bom");

        Map<String, WeatherAlert> kept = WeatherCollector.filter(Map.of("a", cancelledEvent, "b", live), List.of());

        assertEquals(List.of("b"), List.copyOf(kept.keySet()));
    }

    private static WeatherAlertProvider provider(String name, Map<String, WeatherAlert> alerts) {
        return new WeatherAlertProvider() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Map<String, WeatherAlert> activeAlerts() {
                return alerts;
            }
        };
    }

    private static EventBus strictBus() {
        return new EventBus((event, error) -> {
            throw new AssertionError("Unexpected handler error", error);
        });
    }

    private static CollectorContext context(EventBus bus, RecordingSnapshotSink sink, WeatherCollectorConfig cfg) {
        return new CollectorContext(
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(1)).build(),
                bus,
                sink,
                Clock.fixed(NOW, ZoneOffset.UTC),
                Duration.ofSeconds(2),
                Map.of(WeatherCollector.CONFIG_KEY, cfg)
        );
    }
}
