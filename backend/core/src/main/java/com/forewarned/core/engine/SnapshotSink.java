package com.forewarned.core.engine;

import com.forewarned.core.model.EocSnapshot;
import com.forewarned.core.model.WeatherSnapshot;

/**
 * Entry points the pollers push complete snapshots into.
 */
public interface SnapshotSink {
    void submitWeatherSnapshot(WeatherSnapshot snapshot);

    void submitEocSnapshot(EocSnapshot snapshot);
}
