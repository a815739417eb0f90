package com.forewarned.service.overrides;

import com.forewarned.core.engine.OverrideSource;
import com.forewarned.core.model.AlertLevel;

import java.util.Map;

/**
 * An override source that holds its switch states locally and announces changes, so the engine
 * can re-evaluate without polling.
 */
public interface ListenableOverrideSource extends OverrideSource {
    void onChange(Runnable listener);

    Map<AlertLevel, Boolean> switches();
}
