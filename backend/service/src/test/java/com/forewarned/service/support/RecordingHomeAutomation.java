package com.forewarned.service.support;

import com.forewarned.core.effects.HomeAutomationGateway;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingHomeAutomation implements HomeAutomationGateway {
    private final List<String> notifications = new CopyOnWriteArrayList<>();
    private final List<String> routines = new CopyOnWriteArrayList<>();
    private final List<String> sensorStates = new CopyOnWriteArrayList<>();

    @Override
    public void sendNotification(String message, String title) {
        notifications.add(message);
    }

    @Override
    public void triggerRoutine(String identifier) {
        routines.add(identifier);
    }

    @Override
    public void setSensorState(String entityId, String state, Map<String, Object> attributes) {
        sensorStates.add(state);
    }

    public List<String> notifications() {
        return List.copyOf(notifications);
    }

    public List<String> routines() {
        return List.copyOf(routines);
    }

    public List<String> sensorStates() {
        return List.copyOf(sensorStates);
    }
}
