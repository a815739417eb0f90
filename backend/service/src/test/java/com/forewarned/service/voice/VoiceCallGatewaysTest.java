package com.forewarned.service.voice;

import com.fasterxml.jackson.databind.JsonNode;
import com.forewarned.core.effects.VoiceCallGateway;
import com.forewarned.core.model.AlertLevel;
import com.forewarned.core.util.JsonUtils;
import com.forewarned.service.config.VoiceConfig;
import com.forewarned.service.homeassistant.HomeAssistantClient;
import com.forewarned.service.support.StubHttpServer;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VoiceCallGatewaysTest {
    private final HttpClient httpClient = HttpClient.newHttpClient();

    @Test
    void disabledConfigHasNoGateway() {
        assertTrue(VoiceCallGateways.create(VoiceConfig.disabled(), httpClient, null, Duration.ofSeconds(1)).isEmpty());
    }

    @Test
    void sipBackendIsUnsupported() {
        VoiceConfig config = new VoiceConfig(true, "SIP", null, null, null, null, null, null);

        assertTrue(VoiceCallGateways.create(config, httpClient, null, Duration.ofSeconds(1)).isEmpty());
    }

    @Test
    void webhookBackendIsBuilt() {
        VoiceConfig config = new VoiceConfig(true, "webhook", "http://pbx.local/originate", null, null, null, null, null);

        Optional<VoiceCallGateway> gateway = VoiceCallGateways.create(config, httpClient, null, Duration.ofSeconds(1));

        assertInstanceOf(WebhookVoiceCallGateway.class, gateway.orElseThrow());
    }

    @Test
    void notifyBackendCallsConfiguredService() throws Exception {
        try (StubHttpServer server = new StubHttpServer()) {
            server.respond("/services/notify/voip_phone", 200, "[]");
            HomeAssistantClient homeAssistant = new HomeAssistantClient(httpClient, server.baseUrl(), "token", Duration.ofSeconds(2));
            VoiceConfig config = new VoiceConfig(true, "ha_notify", null, null, null, null, null, Map.of());

            VoiceCallGateway gateway = VoiceCallGateways.create(config, httpClient, homeAssistant, Duration.ofSeconds(1)).orElseThrow();
            assertTrue(gateway.placeAlertCall("sip:100@pbx", AlertLevel.ADVISORY, "Flood Watch"));

            JsonNode body = JsonUtils.objectMapper().readTree(server.lastRequest().body());
            assertEquals("Advisory alert: Flood Watch", body.path("message").asText());
            assertEquals("sip:100@pbx", body.path("target").get(0).asText());
            assertEquals("advisory", body.path("data").path("alert_level").asText());
        }
    }
}
