package com.forewarned.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forewarned.core.bus.EventBus;
import com.forewarned.core.events.AlertRaised;
import com.forewarned.core.events.AlertStateChanged;
import com.forewarned.core.events.CollectorTickCompleted;
import com.forewarned.core.events.CollectorTickStarted;
import com.forewarned.core.events.EocSnapshotReceived;
import com.forewarned.core.events.Event;
import com.forewarned.core.events.LevelTableReloaded;
import com.forewarned.core.events.OverrideSwitchChanged;
import com.forewarned.core.events.WeatherSnapshotReceived;
import com.forewarned.core.util.JsonUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * JSON line format for persisted events: {@code {"type": ..., "timestamp": ..., "event": {...}}}.
 */
public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = types();

    private EventCodec() {
    }

    private static Map<String, Class<? extends Event>> types() {
        Map<String, Class<? extends Event>> types = new LinkedHashMap<>();
        types.put("CollectorTickStarted", CollectorTickStarted.class);
        types.put("CollectorTickCompleted", CollectorTickCompleted.class);
        types.put("WeatherSnapshotReceived", WeatherSnapshotReceived.class);
        types.put("EocSnapshotReceived", EocSnapshotReceived.class);
        types.put("OverrideSwitchChanged", OverrideSwitchChanged.class);
        types.put("AlertStateChanged", AlertStateChanged.class);
        types.put("LevelTableReloaded", LevelTableReloaded.class);
        types.put("AlertRaised", AlertRaised.class);
        return Map.copyOf(types);
    }

    public static List<Class<? extends Event>> allEventTypes() {
        return List.copyOf(TYPES.values());
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event", e);
        }
    }

    public static Event fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = node.path("type").asText();
            Class<? extends Event> eventClass = TYPES.get(type);
            if (eventClass == null) {
                throw new IllegalArgumentException("Unsupported event type: " + type);
            }
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
    }

    public static void subscribeAll(EventBus bus, Consumer<Event> consumer) {
        for (Class<? extends Event> type : TYPES.values()) {
            subscribe(bus, type, consumer);
        }
    }

    private static <T extends Event> void subscribe(EventBus bus, Class<T> type, Consumer<Event> consumer) {
        bus.subscribe(type, consumer::accept);
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
