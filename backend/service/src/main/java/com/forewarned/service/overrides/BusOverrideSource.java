package com.forewarned.service.overrides;

import com.forewarned.core.bus.EventBus;
import com.forewarned.core.events.OverrideSwitchChanged;
import com.forewarned.core.model.AlertLevel;

import java.util.EnumMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Override switches whose state arrives as {@link OverrideSwitchChanged} events. The last value
 * per level is retained; every change notifies the registered listener so the engine can
 * re-evaluate.
 */
public final class BusOverrideSource implements ListenableOverrideSource {
    private static final Logger LOGGER = Logger.getLogger(BusOverrideSource.class.getName());

    private final Map<AlertLevel, Boolean> retained = new EnumMap<>(AlertLevel.class);
    private volatile Runnable changeListener = () -> {
    };

    public BusOverrideSource(EventBus eventBus) {
        eventBus.subscribe(OverrideSwitchChanged.class, this::onSwitchChanged);
    }

    @Override
    public void onChange(Runnable listener) {
        this.changeListener = listener;
    }

    @Override
    public boolean isOn(AlertLevel level) {
        synchronized (retained) {
            return retained.getOrDefault(level, false);
        }
    }

    @Override
    public String name() {
        return "bus";
    }

    @Override
    public Map<AlertLevel, Boolean> switches() {
        synchronized (retained) {
            return Map.copyOf(retained);
        }
    }

    private void onSwitchChanged(OverrideSwitchChanged event) {
        if (event.level() == null || event.level() == AlertLevel.NONE) {
            LOGGER.warning("Ignoring override switch without a real level");
            return;
        }
        Boolean previous;
        synchronized (retained) {
            previous = retained.put(event.level(), event.on());
        }
        LOGGER.info("Manual override " + event.level().key() + " switched " + (event.on() ? "on" : "off"));
        if (previous == null || previous != event.on()) {
            changeListener.run();
        }
    }
}
