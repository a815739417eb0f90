package com.forewarned.service.overrides;

import com.fasterxml.jackson.databind.JsonNode;
import com.forewarned.core.engine.OverrideSource;
import com.forewarned.core.model.AlertLevel;
import com.forewarned.service.config.OverrideConfig;
import com.forewarned.service.homeassistant.HomeAssistantClient;

import java.util.Optional;

/**
 * Override switches backed by Home Assistant {@code input_boolean} entities. An entity that does
 * not exist is simply off; a failed request propagates so the resolver can report it.
 */
public final class RestOverrideSource implements OverrideSource {
    private final HomeAssistantClient client;
    private final OverrideConfig config;

    public RestOverrideSource(HomeAssistantClient client, OverrideConfig config) {
        this.client = client;
        this.config = config;
    }

    @Override
    public boolean isOn(AlertLevel level) {
        Optional<JsonNode> state = client.getState(config.entityIdFor(level));
        return state.map(node -> "on".equalsIgnoreCase(node.path("state").asText())).orElse(false);
    }

    @Override
    public String name() {
        return "rest";
    }
}
