package com.forewarned.core.effects;

import java.util.Map;

/**
 * Calls into the home-automation platform. Every method may throw; the dispatcher logs and moves on.
 */
public interface HomeAutomationGateway {
    void sendNotification(String message, String title);

    /**
     * Activates a {@code scene.*} or runs a {@code script.*} entity.
     */
    void triggerRoutine(String identifier);

    void setSensorState(String entityId, String state, Map<String, Object> attributes);
}
