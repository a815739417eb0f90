package com.forewarned.service.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.forewarned.core.model.AlertLevel;

import java.util.Locale;

/**
 * Where manual override switches live.
 *
 * <ul>
 *   <li>{@code bus}: switches are flipped through the API and retained in process.</li>
 *   <li>{@code rest}: switches are Home Assistant input_boolean entities.</li>
 *   <li>{@code mqtt}: switches are announced to Home Assistant over MQTT discovery and flipped on
 *   their command topics; API changes are mirrored back to the state topics.</li>
 * </ul>
 */
public record OverrideConfig(
        String mode,
        @JsonProperty("entity_prefix") String entityPrefix,
        MqttSettings mqtt
) {
    public static final String BUS = "bus";
    public static final String REST = "rest";
    public static final String MQTT = "mqtt";

    public OverrideConfig {
        mode = mode == null || mode.isBlank() ? BUS : mode.trim().toLowerCase(Locale.ROOT);
        entityPrefix = entityPrefix == null || entityPrefix.isBlank() ? "input_boolean.forewarned_manual_" : entityPrefix;
        mqtt = mqtt == null ? MqttSettings.defaults() : mqtt;
    }

    public static OverrideConfig defaults() {
        return new OverrideConfig(BUS, null, null);
    }

    public String entityIdFor(AlertLevel level) {
        return entityPrefix + level.key();
    }

    public boolean restMode() {
        return REST.equals(mode);
    }

    public record MqttSettings(String broker, Integer port, String username, String password) {
        public static final String DEFAULT_BROKER = "core-mosquitto";
        public static final int DEFAULT_PORT = 1883;

        public MqttSettings {
            broker = broker == null || broker.isBlank() ? DEFAULT_BROKER : broker.trim();
            port = port == null || port <= 0 ? DEFAULT_PORT : port;
            username = username == null ? "" : username;
            password = password == null ? "" : password;
        }

        public static MqttSettings defaults() {
            return new MqttSettings(null, null, null, null);
        }

        public String serverUri() {
            return "tcp://" + broker + ":" + port;
        }
    }
}
