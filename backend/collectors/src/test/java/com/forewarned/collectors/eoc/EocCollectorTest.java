package com.forewarned.collectors.eoc;

import com.forewarned.collectors.api.CollectorContext;
import com.forewarned.collectors.api.CollectorResult;
import com.forewarned.collectors.config.EocCollectorConfig;
import com.forewarned.collectors.config.EocSiteConfig;
import com.forewarned.collectors.support.EventCapture;
import com.forewarned.collectors.support.RecordingSnapshotSink;
import com.forewarned.core.bus.EventBus;
import com.forewarned.core.events.AlertRaised;
import com.forewarned.core.events.CollectorTickCompleted;
import com.forewarned.core.events.EocSnapshotReceived;
import com.forewarned.core.model.EocSnapshot;
import com.forewarned.core.model.EocState;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EocCollectorTest {
    private static final Instant NOW = Instant.parse("2026-02-09T20:00:00Z");

    private HttpServer server;
    private ExecutorService serverExecutor;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
        if (serverExecutor != null) {
            serverExecutor.shutdownNow();
        }
    }

    @Test
    void submitsSnapshotWithDetectedStatesInConfigOrder() throws Exception {
        startServer();
        server.createContext("/townsville", exchange -> writeResponse(exchange, 200,
                "<html><body><h1>Townsville LDMG</h1><p>Status: <b>Lean Forward</b></p></body></html>"));
        server.createContext("/burdekin", exchange -> writeResponse(exchange, 200,
                "<html><body><script>var s='stand up';</script><p>No current activation</p></body></html>"));

        EventBus bus = strictBus();
        EventCapture capture = new EventCapture(bus);
        RecordingSnapshotSink sink = new RecordingSnapshotSink();

        CollectorResult result = new EocCollector().poll(context(bus, sink, List.of(
                new EocSiteConfig("townsville", url("/townsville")),
                new EocSiteConfig("burdekin", url("/burdekin"))
        ))).join();

        assertTrue(result.success());
        assertTrue(result.snapshotSubmitted());
        EocSnapshot snapshot = sink.eoc().get(0);
        assertEquals(List.of("townsville", "burdekin"), List.copyOf(snapshot.sites().keySet()));
        assertEquals(EocState.LEAN_FORWARD, snapshot.sites().get("townsville").state());
        assertTrue(snapshot.sites().get("townsville").activated());
        assertEquals("Townsville LDMG Status: Lean Forward", snapshot.sites().get("townsville").description());
        assertEquals(EocState.INACTIVE, snapshot.sites().get("burdekin").state());
        assertFalse(snapshot.sites().get("burdekin").activated());
        assertEquals(NOW, snapshot.sites().get("burdekin").lastCheck());

        EocSnapshotReceived received = capture.byType(EocSnapshotReceived.class).get(0);
        assertEquals(2, received.siteCount());
        assertEquals(1, received.activatedCount());
        assertEquals("lean forward", received.states().get("townsville"));
    }

    @Test
    void oneFailingSiteKeepsPreviousSnapshot() throws Exception {
        startServer();
        server.createContext("/ok", exchange -> writeResponse(exchange, 200, "<p>Stand Up</p>"));
        server.createContext("/down", exchange -> writeResponse(exchange, 503, "maintenance"));

        EventBus bus = strictBus();
        EventCapture capture = new EventCapture(bus);
        RecordingSnapshotSink sink = new RecordingSnapshotSink();

        CollectorResult result = new EocCollector().poll(context(bus, sink, List.of(
                new EocSiteConfig("ok", url("/ok")),
                new EocSiteConfig("down", url("/down"))
        ))).join();

        assertFalse(result.success());
        assertTrue(sink.eoc().isEmpty());
        List<AlertRaised> alerts = capture.byType(AlertRaised.class);
        assertEquals(1, alerts.size());
        assertEquals("HTTP status 503 from " + url("/down"), alerts.get(0).message());
        assertEquals("down", alerts.get(0).details().get("siteId"));
        CollectorTickCompleted completed = capture.byType(CollectorTickCompleted.class).get(0);
        assertFalse(completed.snapshotSubmitted());
    }

    @Test
    void slowSiteTimesOutWithoutBlockingTheOthers() throws Exception {
        startServer();
        server.createContext("/ok", exchange -> writeResponse(exchange, 200, "<p>Status: Alert</p>"));
        server.createContext("/hang", exchange -> {
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            writeResponse(exchange, 200, "<p>late</p>");
        });

        EventBus bus = strictBus();
        EventCapture capture = new EventCapture(bus);
        RecordingSnapshotSink sink = new RecordingSnapshotSink();

        CollectorContext ctx = new CollectorContext(
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(1)).build(),
                bus,
                sink,
                Clock.fixed(NOW, ZoneOffset.UTC),
                Duration.ofMillis(200),
                Map.of(EocCollector.CONFIG_KEY, new EocCollectorConfig(Duration.ofMinutes(5), List.of(
                        new EocSiteConfig("ok", url("/ok")),
                        new EocSiteConfig("hang", url("/hang"))
                )))
        );

        CollectorResult result = new EocCollector().poll(ctx).join();

        assertFalse(result.success());
        assertTrue(sink.eoc().isEmpty());
        AlertRaised alert = capture.byType(AlertRaised.class).get(0);
        assertEquals("hang", alert.details().get("siteId"));
        assertTrue(alert.message().contains("timed out"));
    }

    @Test
    void unreachableSiteIsReportedAsFetchFailure() {
        EventBus bus = strictBus();
        EventCapture capture = new EventCapture(bus);
        RecordingSnapshotSink sink = new RecordingSnapshotSink();

        CollectorResult result = new EocCollector().poll(context(bus, sink, List.of(
                new EocSiteConfig("nowhere", "http://localhost:1/status")
        ))).join();

        assertFalse(result.success());
        assertTrue(sink.eoc().isEmpty());
        assertEquals(AlertRaised.COLLECTOR, capture.byType(AlertRaised.class).get(0).category());
    }

    private void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        server.start();
    }

    private String url(String path) {
        return "http://localhost:" + server.getAddress().getPort() + path;
    }

    private static EventBus strictBus() {
        return new EventBus((event, error) -> {
            throw new AssertionError("Unexpected handler error", error);
        });
    }

    private static CollectorContext context(EventBus bus, RecordingSnapshotSink sink, List<EocSiteConfig> sites) {
        return new CollectorContext(
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(1)).build(),
                bus,
                sink,
                Clock.fixed(NOW, ZoneOffset.UTC),
                Duration.ofSeconds(2),
                Map.of(EocCollector.CONFIG_KEY, new EocCollectorConfig(Duration.ofMinutes(5), sites))
        );
    }

    private static void writeResponse(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
