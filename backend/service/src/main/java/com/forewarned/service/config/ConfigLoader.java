package com.forewarned.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.forewarned.collectors.config.EocCollectorConfig;
import com.forewarned.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;
import java.util.logging.Logger;

public final class ConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    private ConfigLoader() {
    }

    public static List<CollectorConfig> loadCollectors(Path configDir) {
        return read(configDir.resolve("collectors.json"), new TypeReference<>() {
        });
    }

    public static WeatherSourceConfig loadWeather(Path configDir) {
        return read(configDir.resolve("weather.json"), new TypeReference<>() {
        });
    }

    public static EocCollectorConfig loadEoc(Path configDir) {
        return read(configDir.resolve("eoc.json"), new TypeReference<>() {
        });
    }

    /**
     * The level table is the one piece of configuration the service cannot start without.
     */
    public static LevelTableParser.Result loadLevelTable(Path configDir) {
        Path path = configDir.resolve("alert-rules.json");
        if (!Files.exists(path)) {
            throw new IllegalStateException("Missing alert level table: " + path);
        }
        JsonNode document = read(path, new TypeReference<>() {
        });
        try {
            return LevelTableParser.parse(document);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid alert level table in " + path + ": " + e.getMessage(), e);
        }
    }

    public static RoutinesConfig loadRoutines(Path configDir) {
        return readOptional(configDir.resolve("routines.json"), new TypeReference<>() {
        }, RoutinesConfig::none);
    }

    public static VoiceConfig loadVoice(Path configDir) {
        return readOptional(configDir.resolve("voice.json"), new TypeReference<>() {
        }, VoiceConfig::disabled);
    }

    public static OverrideConfig loadOverrides(Path configDir) {
        return readOptional(configDir.resolve("overrides.json"), new TypeReference<>() {
        }, OverrideConfig::defaults);
    }

    private static <T> T readOptional(Path path, TypeReference<T> ref, Supplier<T> fallback) {
        if (!Files.exists(path)) {
            LOGGER.info("No " + path.getFileName() + " found; using defaults");
            return fallback.get();
        }
        return read(path, ref);
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
