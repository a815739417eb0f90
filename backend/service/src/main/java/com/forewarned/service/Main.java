package com.forewarned.service;

import com.forewarned.collectors.api.Collector;
import com.forewarned.collectors.api.CollectorContext;
import com.forewarned.collectors.config.EocCollectorConfig;
import com.forewarned.collectors.config.WeatherCollectorConfig;
import com.forewarned.collectors.eoc.EocCollector;
import com.forewarned.collectors.weather.MockWeatherProvider;
import com.forewarned.collectors.weather.WeatherAlertProvider;
import com.forewarned.collectors.weather.WeatherCollector;
import com.forewarned.core.bus.EventBus;
import com.forewarned.core.effects.EffectDispatcher;
import com.forewarned.core.effects.FeedEffectDispatcher;
import com.forewarned.core.effects.RoutinePlan;
import com.forewarned.core.effects.VoiceCallGateway;
import com.forewarned.core.engine.AlertEngine;
import com.forewarned.core.engine.OverrideSource;
import com.forewarned.service.api.ApiServer;
import com.forewarned.service.api.DiagnosticsTracker;
import com.forewarned.service.config.CollectorConfig;
import com.forewarned.service.config.ConfigLoader;
import com.forewarned.service.config.LevelTableParser;
import com.forewarned.service.config.OverrideConfig;
import com.forewarned.service.config.RoutinesConfig;
import com.forewarned.service.config.VoiceConfig;
import com.forewarned.service.config.WeatherSourceConfig;
import com.forewarned.service.homeassistant.HomeAssistantClient;
import com.forewarned.service.overrides.ListenableOverrideSource;
import com.forewarned.service.overrides.MqttOverrideSource;
import com.forewarned.service.overrides.OverrideSources;
import com.forewarned.service.runtime.SchedulerService;
import com.forewarned.service.store.EventCodec;
import com.forewarned.service.store.JsonlEventStore;
import com.forewarned.service.voice.VoiceCallGateways;
import com.forewarned.service.weather.NoaaAlertsClient;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    private static final String DEFAULT_NOAA_USER_AGENT = "forewarned/0.1 (contact: support@example.com)";
    static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        Map<String, String> env = System.getenv();
        Path configDir = Path.of(args.length > 0 ? args[0] : "config");
        Path eventLogFile = Path.of("logs/events.jsonl");
        Clock clock = Clock.systemUTC();

        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(eventLogFile);
        EventCodec.subscribeAll(eventBus, eventStore::append);
        DiagnosticsTracker diagnosticsTracker = new DiagnosticsTracker(eventBus);

        LevelTableParser.Result levelTable = ConfigLoader.loadLevelTable(configDir);
        List<CollectorConfig> collectorConfigs = ConfigLoader.loadCollectors(configDir);
        WeatherSourceConfig weatherConfig = ConfigLoader.loadWeather(configDir);
        EocCollectorConfig eocConfig = ConfigLoader.loadEoc(configDir);
        RoutinesConfig routinesConfig = ConfigLoader.loadRoutines(configDir);
        VoiceConfig voiceConfig = ConfigLoader.loadVoice(configDir);
        OverrideConfig overrideConfig = ConfigLoader.loadOverrides(configDir);

        Map<String, CollectorConfig> collectorConfigByName = new HashMap<>();
        for (CollectorConfig cfg : collectorConfigs) {
            collectorConfigByName.put(cfg.name(), cfg);
        }

        HttpClient sharedHttpClient = HttpClient.newBuilder().connectTimeout(REQUEST_TIMEOUT).build();
        HomeAssistantClient homeAssistant = new HomeAssistantClient(
                sharedHttpClient,
                env.getOrDefault("HA_BASE_URL", HomeAssistantClient.DEFAULT_BASE_URL),
                env.getOrDefault("SUPERVISOR_TOKEN", ""),
                REQUEST_TIMEOUT
        );
        VoiceCallGateway voiceCalls = VoiceCallGateways.create(
                voiceConfig,
                sharedHttpClient,
                homeAssistant,
                REQUEST_TIMEOUT
        ).orElse(null);

        ExecutorService effectExecutor = Executors.newFixedThreadPool(4);
        ExecutorService sensorExecutor = Executors.newSingleThreadExecutor();
        RoutinePlan routinePlan = routinesConfig.toPlan();
        EffectDispatcher dispatcher = new EffectDispatcher(
                homeAssistant,
                routinePlan,
                voiceCalls,
                voiceConfig.toCallPlan(),
                effectExecutor,
                sensorExecutor,
                eventBus,
                clock
        );
        OverrideSource overrideSource = OverrideSources.create(overrideConfig, eventBus, homeAssistant, clock);
        AlertEngine engine = new AlertEngine(levelTable.table(), overrideSource, dispatcher, eventBus, clock);
        if (overrideSource instanceof ListenableOverrideSource listenable) {
            listenable.onChange(engine::reevaluate);
        }
        FeedEffectDispatcher feedEffects = new FeedEffectDispatcher(
                engine,
                homeAssistant,
                routinePlan,
                effectExecutor,
                sensorExecutor,
                eventBus,
                clock
        );

        WeatherCollector weatherCollector = new WeatherCollector(
                weatherProvider(weatherConfig, configDir, sharedHttpClient, env),
                intervalFor(collectorConfigByName, "weatherCollector", weatherConfig.interval())
        );
        EocCollector eocCollector = new EocCollector(intervalFor(collectorConfigByName, "eocCollector", eocConfig.interval()));

        CollectorContext context = new CollectorContext(
                sharedHttpClient,
                eventBus,
                feedEffects,
                clock,
                REQUEST_TIMEOUT,
                Map.of(
                        WeatherCollector.CONFIG_KEY, new WeatherCollectorConfig(weatherConfig.interval(), weatherConfig.areaKeywords()),
                        EocCollector.CONFIG_KEY, eocConfig
                )
        );
        SchedulerService scheduler = new SchedulerService(List.of(
                new SchedulerService.ScheduledCollector(
                        weatherCollector,
                        weatherCollector.interval(),
                        isEnabled(collectorConfigByName, "weatherCollector", true)
                ),
                new SchedulerService.ScheduledCollector(
                        eocCollector,
                        eocCollector.interval(),
                        isEnabled(collectorConfigByName, "eocCollector", true)
                )
        ), context);

        List<Collector> collectors = List.of(weatherCollector, eocCollector);
        ApiServer apiServer = new ApiServer(
                Integer.parseInt(env.getOrDefault("PORT", "8080")),
                engine,
                eventStore,
                eventBus,
                collectors,
                diagnosticsTracker,
                overrideConfig,
                clock
        );

        LOGGER.info("Starting Forewarned with " + levelTable.table().asMap().size() + " configured level(s), overrides via "
                + overrideSource.name() + ", voice calls " + (voiceCalls == null ? "disabled" : "via " + voiceCalls.name()));
        if (overrideSource instanceof MqttOverrideSource mqttOverrides) {
            startMqtt(mqttOverrides);
        }
        scheduler.start();
        apiServer.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.shutdown();
            apiServer.stop();
            if (overrideSource instanceof MqttOverrideSource mqttOverrides) {
                mqttOverrides.close();
            }
            effectExecutor.shutdown();
            sensorExecutor.shutdown();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static WeatherAlertProvider weatherProvider(
            WeatherSourceConfig config,
            Path configDir,
            HttpClient httpClient,
            Map<String, String> env
    ) {
        switch (config.provider()) {
            case WeatherSourceConfig.MOCK:
                if (config.fixturePath() == null || config.fixturePath().isBlank()) {
                    throw new IllegalStateException("weather.json: the mock provider requires fixturePath");
                }
                return new MockWeatherProvider(configDir.resolve(config.fixturePath()));
            case WeatherSourceConfig.NOAA:
                if (config.latitude() == null || config.longitude() == null) {
                    throw new IllegalStateException("weather.json: the noaa provider requires latitude and longitude");
                }
                return new NoaaAlertsClient(
                        httpClient,
                        config.noaaBaseUrl(),
                        config.latitude(),
                        config.longitude(),
                        REQUEST_TIMEOUT,
                        env.getOrDefault("NOAA_USER_AGENT", DEFAULT_NOAA_USER_AGENT)
                );
            default:
                throw new IllegalStateException("weather.json: unknown provider " + config.provider());
        }
    }

    /**
     * A broker that cannot be reached leaves every MQTT switch off; the rest of the service runs.
     */
    private static void startMqtt(MqttOverrideSource mqttOverrides) {
        try {
            mqttOverrides.start();
        } catch (IllegalStateException e) {
            LOGGER.log(Level.SEVERE, "MQTT override switches unavailable: " + e.getMessage(), e);
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Unable to read logging.properties: " + e.getMessage());
        }
    }

    private static Duration intervalFor(Map<String, CollectorConfig> map, String name, Duration fallback) {
        CollectorConfig config = map.get(name);
        if (config == null) {
            return fallback;
        }
        return Duration.ofSeconds(Math.max(1, config.intervalSeconds()));
    }

    private static boolean isEnabled(Map<String, CollectorConfig> map, String name, boolean fallback) {
        CollectorConfig config = map.get(name);
        return config == null ? fallback : config.enabled();
    }
}
