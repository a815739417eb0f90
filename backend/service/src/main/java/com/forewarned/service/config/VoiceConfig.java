package com.forewarned.service.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.forewarned.core.effects.CallPlan;
import com.forewarned.core.model.AlertLevel;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Contents of {@code voice.json}: which call backend to use and which destinations to ring per
 * alert level.
 */
public record VoiceConfig(
        boolean enabled,
        String backend,
        @JsonProperty("webhook_url") String webhookUrl,
        @JsonProperty("webhook_method") String webhookMethod,
        @JsonProperty("webhook_auth") WebhookAuth webhookAuth,
        @JsonProperty("webhook_payload_template") Map<String, Object> webhookPayloadTemplate,
        @JsonProperty("ha_notify_service") String haNotifyService,
        Map<String, List<String>> destinations
) {
    public static final String WEBHOOK = "webhook";
    public static final String HA_NOTIFY = "ha_notify";
    public static final String SIP = "sip";

    private static final Logger LOGGER = Logger.getLogger(VoiceConfig.class.getName());

    public VoiceConfig {
        backend = backend == null || backend.isBlank() ? WEBHOOK : backend.trim().toLowerCase(Locale.ROOT);
        webhookMethod = webhookMethod == null || webhookMethod.isBlank() ? "POST" : webhookMethod.trim().toUpperCase(Locale.ROOT);
        webhookPayloadTemplate = webhookPayloadTemplate == null ? Map.of() : webhookPayloadTemplate;
        haNotifyService = haNotifyService == null || haNotifyService.isBlank() ? "notify.voip_phone" : haNotifyService;
        destinations = destinations == null ? Map.of() : destinations;
    }

    public static VoiceConfig disabled() {
        return new VoiceConfig(false, null, null, null, null, null, null, null);
    }

    public CallPlan toCallPlan() {
        Map<AlertLevel, List<String>> byLevel = new EnumMap<>(AlertLevel.class);
        destinations.forEach((key, numbers) -> AlertLevel.fromKey(key)
                .filter(level -> level != AlertLevel.NONE)
                .ifPresentOrElse(
                        level -> byLevel.put(level, numbers == null ? List.of() : numbers),
                        () -> LOGGER.warning("Ignoring voice destinations for unknown level: " + key)
                ));
        return new CallPlan(byLevel);
    }

    public record WebhookAuth(String type, String username, String password, String token) {
    }
}
