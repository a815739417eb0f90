package com.forewarned.collectors.config;

import java.time.Duration;
import java.util.List;

public record EocCollectorConfig(Duration interval, List<EocSiteConfig> sites) {
    public EocCollectorConfig {
        sites = sites == null ? List.of() : List.copyOf(sites);
    }
}
