package com.forewarned.service.voice;

import com.forewarned.core.effects.VoiceCallGateway;
import com.forewarned.service.config.VoiceConfig;
import com.forewarned.service.homeassistant.HomeAssistantClient;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;
import java.util.logging.Logger;

public final class VoiceCallGateways {
    private static final Logger LOGGER = Logger.getLogger(VoiceCallGateways.class.getName());

    private VoiceCallGateways() {
    }

    /**
     * Returns the configured call backend, or empty when voice calls are off or unsupported.
     */
    public static Optional<VoiceCallGateway> create(
            VoiceConfig config,
            HttpClient httpClient,
            HomeAssistantClient homeAssistant,
            Duration timeout
    ) {
        if (!config.enabled()) {
            return Optional.empty();
        }
        switch (config.backend()) {
            case VoiceConfig.WEBHOOK:
                return Optional.of(new WebhookVoiceCallGateway(httpClient, config, timeout));
            case VoiceConfig.HA_NOTIFY:
                return Optional.of(new NotifyServiceVoiceCallGateway(homeAssistant, config.haNotifyService()));
            case VoiceConfig.SIP:
                LOGGER.warning("Direct SIP calling is not supported; use the webhook or ha_notify backend. Voice calls disabled.");
                return Optional.empty();
            default:
                LOGGER.warning("Unknown voice backend '" + config.backend() + "'; voice calls disabled");
                return Optional.empty();
        }
    }
}
