package com.forewarned.collectors.config;

import java.util.Objects;

public record EocSiteConfig(String id, String url) {
    public EocSiteConfig {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(url, "url is required");
    }
}
