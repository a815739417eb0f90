package com.forewarned.core.effects;

import com.forewarned.core.model.AlertLevel;

public interface VoiceCallGateway {
    String name();

    /**
     * Starts an outbound alert call. Returns false when the transport refused the call.
     */
    boolean placeAlertCall(String destination, AlertLevel level, String reason);
}
