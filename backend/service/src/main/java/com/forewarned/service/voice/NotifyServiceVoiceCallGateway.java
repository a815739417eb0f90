package com.forewarned.service.voice;

import com.forewarned.core.effects.AlertCallMessages;
import com.forewarned.core.effects.VoiceCallGateway;
import com.forewarned.core.model.AlertLevel;
import com.forewarned.service.homeassistant.HomeAssistantClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hands calls to a Home Assistant notify service (e.g. {@code notify.voip_phone}) that knows how to
 * ring a phone.
 */
public final class NotifyServiceVoiceCallGateway implements VoiceCallGateway {
    private final HomeAssistantClient client;
    private final String domain;
    private final String service;

    public NotifyServiceVoiceCallGateway(HomeAssistantClient client, String notifyService) {
        int dot = notifyService.indexOf('.');
        if (dot <= 0 || dot == notifyService.length() - 1) {
            throw new IllegalStateException("Notify service must be <domain>.<service>: " + notifyService);
        }
        this.client = client;
        this.domain = notifyService.substring(0, dot);
        this.service = notifyService.substring(dot + 1);
    }

    @Override
    public String name() {
        return "ha_notify";
    }

    @Override
    public boolean placeAlertCall(String destination, AlertLevel level, String reason) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", AlertCallMessages.alertMessage(level, reason));
        data.put("target", List.of(destination));
        data.put("data", Map.of("alert_level", level.key()));
        client.callService(domain, service, data);
        return true;
    }
}
