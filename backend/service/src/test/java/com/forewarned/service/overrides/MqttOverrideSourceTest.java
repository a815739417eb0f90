package com.forewarned.service.overrides;

import com.fasterxml.jackson.databind.JsonNode;
import com.forewarned.core.bus.EventBus;
import com.forewarned.core.events.OverrideSwitchChanged;
import com.forewarned.core.model.AlertLevel;
import com.forewarned.core.util.JsonUtils;
import com.forewarned.service.support.RecordingMqttChannel;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MqttOverrideSourceTest {
    private static final Instant NOW = Instant.parse("2026-02-09T20:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void startAnnouncesOneRetainedSwitchPerLevel() throws Exception {
        RecordingMqttChannel channel = new RecordingMqttChannel();
        MqttOverrideSource source = new MqttOverrideSource(channel, new EventBus(), CLOCK);

        source.start();

        assertTrue(channel.connected());
        assertEquals(List.of(
                "homeassistant/switch/forewarned/manual_emergency/set",
                "homeassistant/switch/forewarned/manual_warning/set",
                "homeassistant/switch/forewarned/manual_watch/set",
                "homeassistant/switch/forewarned/manual_advisory/set"
        ), channel.subscribedTopics());
        assertEquals(8, channel.published().size());
        assertTrue(channel.published().stream().allMatch(RecordingMqttChannel.Published::retained));

        RecordingMqttChannel.Published discovery = channel.published().get(0);
        assertEquals("homeassistant/switch/forewarned/manual_emergency/config", discovery.topic());
        JsonNode payload = JsonUtils.objectMapper().readTree(discovery.payload());
        assertEquals("Forewarned Manual Emergency", payload.path("name").asText());
        assertEquals("forewarned_manual_emergency", payload.path("unique_id").asText());
        assertEquals("homeassistant/switch/forewarned/manual_emergency/set", payload.path("command_topic").asText());
        assertEquals("forewarned_addon", payload.path("device").path("identifiers").get(0).asText());
        assertEquals(new RecordingMqttChannel.Published(
                "homeassistant/switch/forewarned/manual_emergency/state", "OFF", true), channel.published().get(1));
    }

    @Test
    void commandFlipsSwitchPublishesEventAndEchoesState() {
        EventBus bus = new EventBus();
        List<OverrideSwitchChanged> events = new ArrayList<>();
        bus.subscribe(OverrideSwitchChanged.class, events::add);
        RecordingMqttChannel channel = new RecordingMqttChannel();
        MqttOverrideSource source = new MqttOverrideSource(channel, bus, CLOCK);
        AtomicInteger changes = new AtomicInteger();
        source.onChange(changes::incrementAndGet);
        source.start();

        channel.deliver("homeassistant/switch/forewarned/manual_warning/set", "on");

        assertTrue(source.isOn(AlertLevel.WARNING));
        assertFalse(source.isOn(AlertLevel.WATCH));
        assertEquals(1, changes.get());
        assertEquals(List.of(new OverrideSwitchChanged(NOW, AlertLevel.WARNING, true)), events);
        RecordingMqttChannel.Published last = channel.published().get(channel.published().size() - 1);
        assertEquals(new RecordingMqttChannel.Published(
                "homeassistant/switch/forewarned/manual_warning/state", "ON", true), last);
    }

    @Test
    void changesFromTheBusAreMirroredToStateTopics() {
        EventBus bus = new EventBus();
        RecordingMqttChannel channel = new RecordingMqttChannel();
        MqttOverrideSource source = new MqttOverrideSource(channel, bus, CLOCK);
        source.start();
        int announced = channel.published().size();

        bus.publish(new OverrideSwitchChanged(NOW, AlertLevel.ADVISORY, true));

        assertTrue(source.isOn(AlertLevel.ADVISORY));
        assertEquals(announced + 1, channel.published().size());
        assertEquals("homeassistant/switch/forewarned/manual_advisory/state",
                channel.published().get(announced).topic());
    }

    @Test
    void malformedCommandsAreIgnored() {
        EventBus bus = new EventBus();
        RecordingMqttChannel channel = new RecordingMqttChannel();
        MqttOverrideSource source = new MqttOverrideSource(channel, bus, CLOCK);
        AtomicInteger changes = new AtomicInteger();
        source.onChange(changes::incrementAndGet);
        source.start();

        channel.deliver("homeassistant/switch/forewarned/manual_watch/set", "toggle");
        source.onCommand("homeassistant/switch/forewarned/manual_none/set", "ON");
        source.onCommand("homeassistant/switch/other/manual_watch/set", "ON");

        assertEquals(0, changes.get());
        assertTrue(source.switches().isEmpty());
    }

    @Test
    void failedEchoDoesNotLoseTheSwitchState() {
        EventBus bus = new EventBus();
        RecordingMqttChannel channel = new RecordingMqttChannel();
        MqttOverrideSource source = new MqttOverrideSource(channel, bus, CLOCK);
        source.start();
        channel.failPublishesWith(new IllegalStateException("broker gone"));

        channel.deliver("homeassistant/switch/forewarned/manual_emergency/set", "ON");

        assertTrue(source.isOn(AlertLevel.EMERGENCY));
    }

    @Test
    void commandTopicParsing() {
        assertEquals(Optional.of(AlertLevel.WATCH),
                MqttOverrideSource.levelForCommandTopic("homeassistant/switch/forewarned/manual_watch/set"));
        assertEquals(Optional.empty(),
                MqttOverrideSource.levelForCommandTopic("homeassistant/switch/forewarned/manual_watch/state"));
        assertEquals(Optional.empty(), MqttOverrideSource.levelForCommandTopic(null));
    }

    @Test
    void closeReleasesTheChannel() {
        RecordingMqttChannel channel = new RecordingMqttChannel();
        MqttOverrideSource source = new MqttOverrideSource(channel, new EventBus(), CLOCK);
        source.start();

        source.close();

        assertTrue(channel.closed());
        assertEquals("mqtt", source.name());
    }
}
