package com.forewarned.collectors.weather;

import com.forewarned.core.model.Severity;
import com.forewarned.core.model.WeatherAlert;
import com.forewarned.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class MockWeatherProvider implements WeatherAlertProvider {
    private final Map<String, WeatherAlert> alerts;

    public MockWeatherProvider(Path jsonFile) {
        try (InputStream in = Files.newInputStream(jsonFile)) {
            WeatherFixture fixture = JsonUtils.objectMapper().readValue(in, WeatherFixture.class);
            Map<String, WeatherAlert> loaded = new LinkedHashMap<>();
            List<AlertEntry> entries = fixture.alerts() == null ? List.of() : fixture.alerts();
            for (AlertEntry entry : entries) {
                loaded.put(entry.id(), new WeatherAlert(
                        entry.event(),
                        Severity.fromText(entry.severity()),
                        entry.headline(),
                        entry.areas(),
                        entry.onset(),
                        entry.expires(),
                        name()
                ));
            }
            this.alerts = Collections.unmodifiableMap(loaded);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed reading weather fixture: " + jsonFile, e);
        }
    }

    @Override
    public String name() {
        return "mock";
    }

    @Override
    public Map<String, WeatherAlert> activeAlerts() {
        return alerts;
    }

    private record WeatherFixture(List<AlertEntry> alerts) {
    }

    private record AlertEntry(
            String id,
            String event,
            String severity,
            String headline,
            String areas,
            Instant onset,
            Instant expires
    ) {
    }
}
