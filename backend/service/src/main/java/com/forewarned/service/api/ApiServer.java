package com.forewarned.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.forewarned.collectors.api.Collector;
import com.forewarned.core.bus.EventBus;
import com.forewarned.core.effects.AlertCallMessages;
import com.forewarned.core.engine.AlertEngine;
import com.forewarned.core.events.Event;
import com.forewarned.core.events.OverrideSwitchChanged;
import com.forewarned.core.model.AlertLevel;
import com.forewarned.core.model.EocSnapshot;
import com.forewarned.core.model.LocalAlertState;
import com.forewarned.core.model.WeatherSnapshot;
import com.forewarned.core.util.JsonUtils;
import com.forewarned.service.config.LevelTableParser;
import com.forewarned.service.config.OverrideConfig;
import com.forewarned.service.store.EventStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-mostly HTTP surface over the engine: current state, latest snapshots, the event log,
 * collector diagnostics, the level table, and manual override switches.
 */
public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final DiagnosticsTracker EMPTY_DIAGNOSTICS = DiagnosticsTracker.empty();
    private static final String OVERRIDES_PREFIX = "/api/overrides/";

    private final int port;
    private final AlertEngine engine;
    private final EventStore eventStore;
    private final EventBus eventBus;
    private final List<Collector> collectors;
    private final DiagnosticsTracker diagnosticsTracker;
    private final OverrideConfig overrideConfig;
    private final Clock clock;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(
            int port,
            AlertEngine engine,
            EventStore eventStore,
            EventBus eventBus,
            List<Collector> collectors,
            DiagnosticsTracker diagnosticsTracker,
            OverrideConfig overrideConfig,
            Clock clock
    ) {
        this.port = port;
        this.engine = engine;
        this.eventStore = eventStore;
        this.eventBus = eventBus;
        this.collectors = collectors;
        this.diagnosticsTracker = diagnosticsTracker;
        this.overrideConfig = overrideConfig == null ? OverrideConfig.defaults() : overrideConfig;
        this.clock = clock;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newCachedThreadPool();
            server.setExecutor(executor);
            server.createContext("/api/health", this::handleHealth);
            server.createContext("/api/local_alert", this::handleLocalAlert);
            server.createContext("/api/status", this::handleStatus);
            server.createContext("/api/weather", this::handleWeather);
            server.createContext("/api/eoc", this::handleEoc);
            server.createContext("/api/events", this::handleEvents);
            server.createContext("/api/collectors", this::handleCollectors);
            server.createContext("/api/collectors/status", this::handleCollectorStatus);
            server.createContext("/api/alert-rules", this::handleAlertRules);
            server.createContext(OVERRIDES_PREFIX, this::handleOverride);
            server.createContext("/voip/status", this::handleVoipStatus);
            server.start();
            LOGGER.info("API server listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdown();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleLocalAlert(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, stateView(engine.currentState()));
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        WeatherSnapshot weather = engine.latestWeather();
        EocSnapshot eoc = engine.latestEoc();
        Map<String, Object> weatherSummary = new LinkedHashMap<>();
        weatherSummary.put("alertCount", weather.alerts().size());
        weatherSummary.put("receivedAt", weather.receivedAt().toString());
        Map<String, Object> eocSummary = new LinkedHashMap<>();
        eocSummary.put("siteCount", eoc.sites().size());
        eocSummary.put("activatedCount", eoc.activatedCount());
        eocSummary.put("receivedAt", eoc.receivedAt().toString());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("localAlert", stateView(engine.currentState()));
        body.put("weather", weatherSummary);
        body.put("eoc", eocSummary);
        body.put("configuredLevels", engine.levelTable().asMap().keySet().stream().map(AlertLevel::key).toList());
        writeJson(exchange, 200, body);
    }

    private void handleWeather(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, engine.latestWeather());
    }

    private void handleEoc(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, engine.latestEoc());
    }

    private void handleEvents(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }

        Instant since;
        Optional<String> type;
        int limit;
        try {
            Map<String, String> query = queryParams(exchange.getRequestURI());
            since = query.containsKey("since") ? Instant.parse(query.get("since")) : Instant.EPOCH;
            type = Optional.ofNullable(query.get("type")).filter(value -> !value.isBlank());
            limit = query.containsKey("limit") ? Integer.parseInt(query.get("limit")) : 200;
        } catch (RuntimeException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }

        List<Event> events = eventStore.query(since, type, Math.max(1, limit));
        writeJson(exchange, 200, events);
    }

    private void handleCollectors(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        List<Map<String, Object>> dto = new ArrayList<>();
        for (Collector collector : collectors) {
            dto.add(Map.of(
                    "name", collector.name(),
                    "intervalSeconds", collector.interval().toSeconds()
            ));
        }
        writeJson(exchange, 200, dto);
    }

    private void handleCollectorStatus(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, diagnostics().snapshot());
    }

    private void handleAlertRules(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET", "POST")) {
            return;
        }
        if ("GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            writeJson(exchange, 200, LevelTableParser.toDocument(engine.levelTable()));
            return;
        }
        LevelTableParser.Result parsed;
        try {
            parsed = LevelTableParser.parse(readBody(exchange));
        } catch (IOException | IllegalArgumentException invalidBody) {
            writeJson(exchange, 400, Map.of("error", "invalid_alert_rules"));
            return;
        }
        engine.reloadLevelTable(parsed.table());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("localAlert", stateView(engine.currentState()));
        body.put("warnings", parsed.warnings());
        writeJson(exchange, 200, body);
    }

    private void handleOverride(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "POST")) {
            return;
        }
        String levelKey = exchange.getRequestURI().getPath().substring(OVERRIDES_PREFIX.length());
        Optional<AlertLevel> level = AlertLevel.fromKey(levelKey).filter(candidate -> candidate != AlertLevel.NONE);
        if (level.isEmpty()) {
            writeJson(exchange, 404, Map.of("error", "unknown_level"));
            return;
        }
        if (overrideConfig.restMode()) {
            writeJson(exchange, 409, Map.of(
                    "error", "overrides_managed_by_home_assistant",
                    "entityId", overrideConfig.entityIdFor(level.get())
            ));
            return;
        }
        Boolean on;
        try {
            on = switchState(readBody(exchange));
        } catch (IOException invalidBody) {
            on = null;
        }
        if (on == null) {
            writeJson(exchange, 400, Map.of("error", "state_must_be_on_or_off"));
            return;
        }
        eventBus.publish(new OverrideSwitchChanged(clock.instant(), level.get(), on));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("level", level.get().key());
        body.put("state", on ? "on" : "off");
        body.put("localAlert", stateView(engine.currentState()));
        writeJson(exchange, 200, body);
    }

    private void handleVoipStatus(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        LocalAlertState state = engine.currentState();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("active", state.active());
        body.put("level", state.level().key());
        body.put("reason", state.reason());
        body.put("message", AlertCallMessages.statusMessage(state));
        writeJson(exchange, 200, body);
    }

    static Map<String, Object> stateView(LocalAlertState state) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("active", state.active());
        view.put("level", state.level().key());
        view.put("reason", state.reason());
        view.put("triggeredBy", state.triggeredBy());
        view.put("timestamp", state.timestamp().toString());
        return view;
    }

    private static Boolean switchState(JsonNode body) {
        String state = body.path("state").asText("");
        if ("on".equalsIgnoreCase(state)) {
            return true;
        }
        if ("off".equalsIgnoreCase(state)) {
            return false;
        }
        return null;
    }

    private static JsonNode readBody(HttpExchange exchange) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            JsonNode node = JsonUtils.objectMapper().readTree(in);
            if (node == null) {
                throw new IOException("Empty request body");
            }
            return node;
        }
    }

    private boolean ensureMethod(HttpExchange exchange, String... allowed) throws IOException {
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", String.join(",", allowed) + ",OPTIONS");
            exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return false;
        }
        for (String method : allowed) {
            if (method.equalsIgnoreCase(exchange.getRequestMethod())) {
                return true;
            }
        }
        exchange.sendResponseHeaders(405, -1);
        exchange.close();
        return false;
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload;
        try {
            payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed to serialize response for " + exchange.getRequestURI(), e);
            exchange.sendResponseHeaders(500, -1);
            exchange.close();
            return;
        }
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return query;
    }

    private DiagnosticsTracker diagnostics() {
        return diagnosticsTracker != null ? diagnosticsTracker : EMPTY_DIAGNOSTICS;
    }
}
