package com.forewarned.service.homeassistant;

import com.fasterxml.jackson.databind.JsonNode;
import com.forewarned.core.effects.HomeAutomationGateway;
import com.forewarned.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Home Assistant REST API client. Every call is synchronous and throws
 * {@link IllegalStateException} on transport errors or non-2xx answers.
 */
public final class HomeAssistantClient implements HomeAutomationGateway {
    public static final String DEFAULT_BASE_URL = "http://supervisor/core/api";
    static final String NOTIFICATION_ID = "forewarned_alert";

    private static final Logger LOGGER = Logger.getLogger(HomeAssistantClient.class.getName());

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String token;
    private final Duration timeout;

    public HomeAssistantClient(HttpClient httpClient, String baseUrl, String token, Duration timeout) {
        this.httpClient = httpClient;
        this.baseUrl = stripTrailingSlash(baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl);
        this.token = token == null ? "" : token;
        this.timeout = timeout;
        if (this.token.isBlank()) {
            LOGGER.warning("No Home Assistant token configured; API calls will likely be rejected");
        }
    }

    public void callService(String domain, String service, Map<String, Object> data) {
        send(post("/services/" + domain + "/" + service, data == null ? Map.of() : data), "call " + domain + "." + service);
        LOGGER.fine("Called service " + domain + "." + service);
    }

    public Optional<JsonNode> getState(String entityId) {
        HttpResponse<String> response = execute(
                request("/states/" + entityId).GET().build(),
                "read state of " + entityId
        );
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        requireSuccess(response, "read state of " + entityId);
        try {
            return Optional.of(JsonUtils.objectMapper().readTree(response.body()));
        } catch (IOException e) {
            throw new IllegalStateException("Invalid state payload for " + entityId, e);
        }
    }

    @Override
    public void sendNotification(String message, String title) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", message);
        data.put("title", title);
        data.put("notification_id", NOTIFICATION_ID);
        callService("persistent_notification", "create", data);
    }

    @Override
    public void triggerRoutine(String identifier) {
        int dot = identifier.indexOf('.');
        if (dot <= 0) {
            throw new IllegalArgumentException("Routine identifier must be <domain>.<name>: " + identifier);
        }
        callService(identifier.substring(0, dot), "turn_on", Map.of("entity_id", identifier));
    }

    @Override
    public void setSensorState(String entityId, String state, Map<String, Object> attributes) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("state", state);
        body.put("attributes", attributes == null ? Map.of() : attributes);
        send(post("/states/" + entityId, body), "set state of " + entityId);
    }

    private HttpRequest post(String path, Object body) {
        try {
            byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
            return request(path)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofByteArray(payload))
                    .build();
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize request for " + path, e);
        }
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Authorization", "Bearer " + token);
    }

    private void send(HttpRequest request, String action) {
        requireSuccess(execute(request, action), action);
    }

    private HttpResponse<String> execute(HttpRequest request, String action) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new IllegalStateException("Home Assistant request failed: " + action, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during Home Assistant request: " + action, e);
        }
    }

    private static void requireSuccess(HttpResponse<String> response, String action) {
        if (response.statusCode() / 100 != 2) {
            throw new IllegalStateException("Home Assistant returned " + response.statusCode() + " for " + action);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
