package com.forewarned.service.overrides;

import com.forewarned.core.bus.EventBus;
import com.forewarned.core.engine.OverrideSource;
import com.forewarned.service.config.OverrideConfig;
import com.forewarned.service.homeassistant.HomeAssistantClient;

import java.time.Clock;

public final class OverrideSources {
    private OverrideSources() {
    }

    /**
     * Builds the configured source. An MQTT source is returned unconnected; call
     * {@link MqttOverrideSource#start()} once the engine is listening.
     */
    public static OverrideSource create(OverrideConfig config, EventBus eventBus, HomeAssistantClient client, Clock clock) {
        return switch (config.mode()) {
            case OverrideConfig.BUS -> new BusOverrideSource(eventBus);
            case OverrideConfig.REST -> new RestOverrideSource(client, config);
            case OverrideConfig.MQTT -> new MqttOverrideSource(
                    new PahoMqttSwitchChannel(config.mqtt(), "forewarned_addon_" + clock.instant().getEpochSecond()),
                    eventBus,
                    clock
            );
            default -> throw new IllegalStateException("Unknown override mode: " + config.mode());
        };
    }
}
