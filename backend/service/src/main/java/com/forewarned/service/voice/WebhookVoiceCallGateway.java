package com.forewarned.service.voice;

import com.forewarned.core.effects.AlertCallMessages;
import com.forewarned.core.effects.VoiceCallGateway;
import com.forewarned.core.model.AlertLevel;
import com.forewarned.core.util.JsonUtils;
import com.forewarned.service.config.VoiceConfig;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Places calls by hitting a PBX webhook (Asterisk AMI bridge, FreePBX and similar). The configured
 * payload template is filled per call; string values may use {@code {{extension}}},
 * {@code {{message}}} and {@code {{alert_level}}}.
 */
public final class WebhookVoiceCallGateway implements VoiceCallGateway {
    private static final Logger LOGGER = Logger.getLogger(WebhookVoiceCallGateway.class.getName());
    private static final Set<Integer> ACCEPTED = Set.of(200, 201, 202);

    private final HttpClient httpClient;
    private final VoiceConfig config;
    private final Duration timeout;

    public WebhookVoiceCallGateway(HttpClient httpClient, VoiceConfig config, Duration timeout) {
        if (config.webhookUrl() == null || config.webhookUrl().isBlank()) {
            throw new IllegalStateException("Webhook voice backend requires webhook_url");
        }
        this.httpClient = httpClient;
        this.config = config;
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return "webhook";
    }

    @Override
    public boolean placeAlertCall(String destination, AlertLevel level, String reason) {
        String message = AlertCallMessages.alertMessage(level, reason);
        Map<String, Object> payload = fill(config.webhookPayloadTemplate(), destination, message, level.key());
        HttpRequest request = buildRequest(payload);
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (ACCEPTED.contains(response.statusCode())) {
                LOGGER.info("Webhook call initiated successfully to " + destination);
                return true;
            }
            LOGGER.warning("Webhook call failed with status " + response.statusCode());
            return false;
        } catch (IOException e) {
            throw new IllegalStateException("Webhook call to " + destination + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted placing webhook call to " + destination, e);
        }
    }

    private HttpRequest buildRequest(Map<String, Object> payload) {
        HttpRequest.Builder builder;
        if ("GET".equals(config.webhookMethod())) {
            builder = HttpRequest.newBuilder(URI.create(config.webhookUrl() + queryString(payload))).GET();
        } else {
            try {
                builder = HttpRequest.newBuilder(URI.create(config.webhookUrl()))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofByteArray(JsonUtils.objectMapper().writeValueAsBytes(payload)));
            } catch (IOException e) {
                throw new IllegalStateException("Unable to serialize webhook payload", e);
            }
        }
        Optional<String> authorization = authorization();
        if (authorization.isPresent()) {
            builder.header("Authorization", authorization.get());
        }
        return builder.timeout(timeout).build();
    }

    private Optional<String> authorization() {
        VoiceConfig.WebhookAuth auth = config.webhookAuth();
        if (auth == null || auth.type() == null) {
            return Optional.empty();
        }
        if ("basic".equalsIgnoreCase(auth.type())) {
            String credentials = auth.username() + ":" + auth.password();
            return Optional.of("Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
        }
        if ("bearer".equalsIgnoreCase(auth.type())) {
            return Optional.of("Bearer " + auth.token());
        }
        LOGGER.warning("Unknown webhook auth type: " + auth.type());
        return Optional.empty();
    }

    static Map<String, Object> fill(Map<String, Object> template, String extension, String message, String alertLevel) {
        Map<String, Object> filled = new LinkedHashMap<>();
        template.forEach((key, value) -> filled.put(key, fillValue(value, extension, message, alertLevel)));
        return filled;
    }

    @SuppressWarnings("unchecked")
    private static Object fillValue(Object value, String extension, String message, String alertLevel) {
        if (value instanceof String text) {
            return text.replace("{{extension}}", extension)
                    .replace("{{message}}", message)
                    .replace("{{alert_level}}", alertLevel);
        }
        if (value instanceof Map<?, ?> nested) {
            return fill((Map<String, Object>) nested, extension, message, alertLevel);
        }
        if (value instanceof List<?> list) {
            List<Object> filled = new ArrayList<>();
            for (Object item : list) {
                filled.add(fillValue(item, extension, message, alertLevel));
            }
            return filled;
        }
        return value;
    }

    private static String queryString(Map<String, Object> payload) {
        if (payload.isEmpty()) {
            return "";
        }
        return "?" + payload.entrySet().stream()
                .map(entry -> encode(entry.getKey()) + "=" + encode(String.valueOf(entry.getValue())))
                .collect(Collectors.joining("&"));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
