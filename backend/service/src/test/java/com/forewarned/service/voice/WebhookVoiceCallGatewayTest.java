package com.forewarned.service.voice;

import com.fasterxml.jackson.databind.JsonNode;
import com.forewarned.core.model.AlertLevel;
import com.forewarned.core.util.JsonUtils;
import com.forewarned.service.config.VoiceConfig;
import com.forewarned.service.support.StubHttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URLDecoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebhookVoiceCallGatewayTest {
    private StubHttpServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new StubHttpServer();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void postsFilledTemplateWithBasicAuth() throws Exception {
        server.respond("/originate", 202, "{}");
        VoiceConfig config = config("POST", new VoiceConfig.WebhookAuth("basic", "pbx", "pw", null));

        boolean placed = gateway(config).placeAlertCall("100", AlertLevel.WARNING, "Severe Thunderstorm Warning");

        assertTrue(placed);
        StubHttpServer.RecordedRequest request = server.lastRequest();
        assertEquals("POST", request.method());
        assertEquals("Basic " + Base64.getEncoder().encodeToString("pbx:pw".getBytes(StandardCharsets.UTF_8)), request.authorization());
        JsonNode body = JsonUtils.objectMapper().readTree(request.body());
        assertEquals("PJSIP/100", body.path("channel").asText());
        assertEquals("Warning! Severe Thunderstorm Warning. Take precautions.", body.path("message").asText());
        assertEquals("warning", body.path("variables").path("level").asText());
        assertEquals(30, body.path("timeout").asInt());
    }

    @Test
    void getSendsTemplateAsQueryWithBearerToken() {
        server.respond("/originate", 200, "");
        VoiceConfig config = config("GET", new VoiceConfig.WebhookAuth("bearer", null, null, "abc"));

        assertTrue(gateway(config).placeAlertCall("101", AlertLevel.EMERGENCY, "Stand up"));

        StubHttpServer.RecordedRequest request = server.lastRequest();
        assertEquals("GET", request.method());
        assertEquals("Bearer abc", request.authorization());
        String query = URLDecoder.decode(request.query(), StandardCharsets.UTF_8);
        assertTrue(query.contains("channel=PJSIP/101"));
        assertTrue(query.contains("message=Emergency alert! Stand up. Take immediate action!"));
    }

    @Test
    void unacceptedStatusMeansCallRefused() {
        server.respond("/originate", 500, "{}");

        assertFalse(gateway(config("POST", null)).placeAlertCall("100", AlertLevel.WATCH, "Flood Watch"));
    }

    @Test
    void transportFailureThrows() {
        VoiceConfig config = new VoiceConfig(true, VoiceConfig.WEBHOOK, "http://127.0.0.1:1/originate",
                "POST", null, Map.of("channel", "{{extension}}"), null, Map.of());
        WebhookVoiceCallGateway gateway = new WebhookVoiceCallGateway(
                HttpClient.newBuilder().connectTimeout(Duration.ofMillis(300)).build(), config, Duration.ofMillis(500));

        assertThrows(IllegalStateException.class, () -> gateway.placeAlertCall("100", AlertLevel.WATCH, "x"));
    }

    @Test
    void missingUrlIsRejected() {
        VoiceConfig config = new VoiceConfig(true, VoiceConfig.WEBHOOK, null, null, null, null, null, null);

        assertThrows(IllegalStateException.class,
                () -> new WebhookVoiceCallGateway(HttpClient.newHttpClient(), config, Duration.ofSeconds(1)));
    }

    @Test
    void fillReplacesPlaceholdersInNestedValuesOnly() {
        Map<String, Object> filled = WebhookVoiceCallGateway.fill(
                Map.of("a", List.of("{{extension}}", 5), "b", Map.of("c", "{{alert_level}}"), "d", true),
                "100", "msg", "watch");

        assertEquals(List.of("100", 5), filled.get("a"));
        assertEquals(Map.of("c", "watch"), filled.get("b"));
        assertEquals(true, filled.get("d"));
    }

    private WebhookVoiceCallGateway gateway(VoiceConfig config) {
        return new WebhookVoiceCallGateway(HttpClient.newHttpClient(), config, Duration.ofSeconds(2));
    }

    private VoiceConfig config(String method, VoiceConfig.WebhookAuth auth) {
        Map<String, Object> template = new java.util.LinkedHashMap<>();
        template.put("channel", "PJSIP/{{extension}}");
        template.put("message", "{{message}}");
        if ("POST".equals(method)) {
            template.put("variables", Map.of("level", "{{alert_level}}"));
            template.put("timeout", 30);
        }
        return new VoiceConfig(true, VoiceConfig.WEBHOOK, server.baseUrl() + "/originate", method, auth, template, null, Map.of());
    }
}
