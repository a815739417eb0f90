package com.forewarned.service.overrides;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.forewarned.core.bus.EventBus;
import com.forewarned.core.events.OverrideSwitchChanged;
import com.forewarned.core.model.AlertLevel;
import com.forewarned.core.util.JsonUtils;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Override switches exposed to Home Assistant through MQTT discovery.
 *
 * <p>{@link #start()} announces one switch per level under
 * {@code homeassistant/switch/forewarned/manual_<level>/}, marks it OFF and subscribes to its
 * command topic. Commands are turned into {@link OverrideSwitchChanged} events, so the API and the
 * broker feed the same retained switch states. Every change, whatever its origin, is echoed to the
 * switch's state topic.
 */
public final class MqttOverrideSource implements ListenableOverrideSource, AutoCloseable {
    static final String TOPIC_ROOT = "homeassistant/switch/forewarned/";
    static final String ON = "ON";
    static final String OFF = "OFF";

    private static final Logger LOGGER = Logger.getLogger(MqttOverrideSource.class.getName());
    private static final String SWITCH_PREFIX = "manual_";
    private static final String ICON = "mdi:alert";

    private final MqttSwitchChannel channel;
    private final EventBus eventBus;
    private final Clock clock;
    private final BusOverrideSource switches;
    private volatile boolean started;

    public MqttOverrideSource(MqttSwitchChannel channel, EventBus eventBus, Clock clock) {
        this.channel = Objects.requireNonNull(channel, "channel is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.switches = new BusOverrideSource(eventBus);
        eventBus.subscribe(OverrideSwitchChanged.class, this::echoState);
    }

    /**
     * Connects and announces the switches. Throws {@link IllegalStateException} when the broker
     * refuses the connection or a discovery message cannot be published.
     */
    public void start() {
        channel.connect();
        List<AlertLevel> levels = AlertLevel.descending();
        for (AlertLevel level : levels) {
            String switchId = switchId(level);
            channel.publish(TOPIC_ROOT + switchId + "/config", discoveryPayload(level), true);
            channel.publish(stateTopic(level), OFF, true);
            channel.subscribe(commandTopic(level), this::onCommand);
        }
        started = true;
        LOGGER.info("Published MQTT discovery for " + levels.size() + " override switch(es)");
    }

    @Override
    public boolean isOn(AlertLevel level) {
        return switches.isOn(level);
    }

    @Override
    public String name() {
        return "mqtt";
    }

    @Override
    public void onChange(Runnable listener) {
        switches.onChange(listener);
    }

    @Override
    public Map<AlertLevel, Boolean> switches() {
        return switches.switches();
    }

    @Override
    public void close() {
        started = false;
        channel.close();
    }

    void onCommand(String topic, String payload) {
        Optional<AlertLevel> level = levelForCommandTopic(topic);
        if (level.isEmpty()) {
            LOGGER.warning("Ignoring MQTT command on unknown topic " + topic);
            return;
        }
        String state = payload == null ? "" : payload.trim().toUpperCase(Locale.ROOT);
        if (!ON.equals(state) && !OFF.equals(state)) {
            LOGGER.warning("Ignoring MQTT command '" + payload + "' for " + level.get().key());
            return;
        }
        LOGGER.info("Switch " + switchId(level.get()) + " state changed to " + state);
        eventBus.publish(new OverrideSwitchChanged(clock.instant(), level.get(), ON.equals(state)));
    }

    private void echoState(OverrideSwitchChanged event) {
        if (!started || event.level() == null || event.level() == AlertLevel.NONE) {
            return;
        }
        try {
            channel.publish(stateTopic(event.level()), event.on() ? ON : OFF, true);
        } catch (IllegalStateException e) {
            LOGGER.log(Level.WARNING, "Could not publish state for " + switchId(event.level()), e);
        }
    }

    static String switchId(AlertLevel level) {
        return SWITCH_PREFIX + level.key();
    }

    static String commandTopic(AlertLevel level) {
        return TOPIC_ROOT + switchId(level) + "/set";
    }

    static String stateTopic(AlertLevel level) {
        return TOPIC_ROOT + switchId(level) + "/state";
    }

    static Optional<AlertLevel> levelForCommandTopic(String topic) {
        if (topic == null || !topic.startsWith(TOPIC_ROOT + SWITCH_PREFIX) || !topic.endsWith("/set")) {
            return Optional.empty();
        }
        String key = topic.substring((TOPIC_ROOT + SWITCH_PREFIX).length(), topic.length() - "/set".length());
        return AlertLevel.fromKey(key).filter(level -> level != AlertLevel.NONE);
    }

    private static String discoveryPayload(AlertLevel level) {
        String switchId = switchId(level);
        Map<String, Object> device = new LinkedHashMap<>();
        device.put("identifiers", List.of("forewarned_addon"));
        device.put("name", "Forewarned");
        device.put("model", "Weather & EOC Alert System");
        device.put("manufacturer", "Forewarned");

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", "Forewarned Manual " + level.label().charAt(0) + level.key().substring(1));
        payload.put("unique_id", "forewarned_" + switchId);
        payload.put("command_topic", commandTopic(level));
        payload.put("state_topic", stateTopic(level));
        payload.put("payload_on", ON);
        payload.put("payload_off", OFF);
        payload.put("state_on", ON);
        payload.put("state_off", OFF);
        payload.put("icon", ICON);
        payload.put("device", device);
        try {
            return JsonUtils.objectMapper().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode discovery payload for " + switchId, e);
        }
    }
}
