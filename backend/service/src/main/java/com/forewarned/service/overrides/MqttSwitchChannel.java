package com.forewarned.service.overrides;

import java.util.function.BiConsumer;

/**
 * The slice of an MQTT client the override switches need. Every method may throw
 * {@link IllegalStateException} when the broker cannot be reached.
 */
public interface MqttSwitchChannel extends AutoCloseable {
    void connect();

    void publish(String topic, String payload, boolean retained);

    /**
     * Registers {@code handler} for messages on {@code topic}; it receives the topic and the UTF-8
     * payload.
     */
    void subscribe(String topic, BiConsumer<String, String> handler);

    @Override
    void close();
}
