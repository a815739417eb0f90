package com.forewarned.service.config;

public record CollectorConfig(String name, boolean enabled, int intervalSeconds) {
}
