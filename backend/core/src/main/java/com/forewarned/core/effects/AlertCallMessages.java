package com.forewarned.core.effects;

import com.forewarned.core.model.AlertLevel;
import com.forewarned.core.model.LocalAlertState;

/**
 * Spoken text for outbound alert calls and for inbound status lines.
 */
public final class AlertCallMessages {
    private AlertCallMessages() {
    }

    public static String alertMessage(AlertLevel level, String reason) {
        return switch (level) {
            case ADVISORY -> "Advisory alert: " + reason;
            case WATCH -> "Watch alert: " + reason + ". Monitor conditions.";
            case WARNING -> "Warning! " + reason + ". Take precautions.";
            case EMERGENCY -> "Emergency alert! " + reason + ". Take immediate action!";
            case NONE -> "Alert: " + reason;
        };
    }

    public static String statusMessage(LocalAlertState state) {
        if (state == null || !state.active()) {
            return "There are currently no active alerts. All systems normal.";
        }
        String message = "Current alert level is " + state.level().label() + ". " + state.reason() + ". ";
        return message + switch (state.level()) {
            case EMERGENCY -> "This is an emergency. Take immediate action.";
            case WARNING -> "This is a warning. Take appropriate precautions.";
            case WATCH -> "This is a watch alert. Monitor conditions closely.";
            case ADVISORY -> "This is an advisory. Be aware of conditions.";
            case NONE -> "";
        };
    }
}
