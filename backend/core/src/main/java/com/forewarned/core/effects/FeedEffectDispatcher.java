package com.forewarned.core.effects;

import com.forewarned.core.bus.EventBus;
import com.forewarned.core.engine.SnapshotSink;
import com.forewarned.core.model.EocSiteState;
import com.forewarned.core.model.EocSnapshot;
import com.forewarned.core.model.EocState;
import com.forewarned.core.model.WeatherAlert;
import com.forewarned.core.model.WeatherSnapshot;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Passes every snapshot on to the engine, then runs the effects each feed owns on its own.
 *
 * <p>Weather: each alert that appears gets a notification and, by event type, the
 * {@code tornado_warning} or {@code severe_weather} routine; each alert that disappears gets an
 * "Alert cleared" notification. EOC: each site whose state changed gets a notification, and an
 * activated site runs {@code eoc_<state>}, falling back to {@code eoc_activated}. Both feeds keep a
 * summary sensor current.
 */
public class FeedEffectDispatcher implements SnapshotSink {
    public static final String WEATHER_SENSOR_ENTITY_ID = "binary_sensor.forewarned_weather_alert";
    public static final String EOC_SENSOR_ENTITY_ID = "binary_sensor.forewarned_eoc_active";
    static final String TORNADO_ROUTINE = "tornado_warning";
    static final String SEVERE_WEATHER_ROUTINE = "severe_weather";
    static final String EOC_ACTIVATED_ROUTINE = "eoc_activated";
    static final int PREVIEW_CHARS = 200;

    private static final Logger LOGGER = Logger.getLogger(FeedEffectDispatcher.class.getName());
    private static final List<EocState> EOC_STATE_PRIORITY = List.of(
            EocState.STAND_UP, EocState.LEAN_FORWARD, EocState.ALERT, EocState.STAND_DOWN, EocState.INACTIVE
    );

    private final SnapshotSink engine;
    private final HomeAutomationGateway homeAutomation;
    private final RoutinePlan routines;
    private final Executor executor;
    private final Executor sensorExecutor;
    private final EffectRunner runner;
    private final ReentrantLock weatherLock = new ReentrantLock();
    private final ReentrantLock eocLock = new ReentrantLock();

    private Map<String, WeatherAlert> knownAlerts = Map.of();
    private final Map<String, EocState> knownSiteStates = new HashMap<>();

    public FeedEffectDispatcher(
            SnapshotSink engine,
            HomeAutomationGateway homeAutomation,
            RoutinePlan routines,
            Executor executor,
            Executor sensorExecutor,
            EventBus eventBus,
            Clock clock
    ) {
        this.engine = Objects.requireNonNull(engine, "engine is required");
        this.homeAutomation = Objects.requireNonNull(homeAutomation, "homeAutomation is required");
        this.routines = Objects.requireNonNull(routines, "routines is required");
        this.executor = Objects.requireNonNull(executor, "executor is required");
        this.sensorExecutor = Objects.requireNonNull(sensorExecutor, "sensorExecutor is required");
        this.runner = new EffectRunner(eventBus, clock);
    }

    @Override
    public void submitWeatherSnapshot(WeatherSnapshot snapshot) {
        weatherLock.lock();
        try {
            engine.submitWeatherSnapshot(snapshot);
            Map<String, WeatherAlert> current = snapshot.alerts();
            current.forEach((id, alert) -> {
                if (!knownAlerts.containsKey(id)) {
                    onNewAlert(alert);
                }
            });
            knownAlerts.forEach((id, alert) -> {
                if (!current.containsKey(id)) {
                    onClearedAlert(alert);
                }
            });
            knownAlerts = current;
            runner.fire(sensorExecutor, "weather sensor update", () -> homeAutomation.setSensorState(
                    WEATHER_SENSOR_ENTITY_ID,
                    current.isEmpty() ? "off" : "on",
                    weatherSensorAttributes(snapshot)
            ));
        } finally {
            weatherLock.unlock();
        }
    }

    @Override
    public void submitEocSnapshot(EocSnapshot snapshot) {
        eocLock.lock();
        try {
            engine.submitEocSnapshot(snapshot);
            snapshot.sites().forEach((siteId, site) -> {
                EocState previous = knownSiteStates.getOrDefault(siteId, EocState.INACTIVE);
                knownSiteStates.put(siteId, site.state());
                if (previous != site.state()) {
                    onEocStateChange(siteId, previous, site);
                }
            });
            runner.fire(sensorExecutor, "EOC sensor update", () -> homeAutomation.setSensorState(
                    EOC_SENSOR_ENTITY_ID,
                    snapshot.activatedCount() > 0 ? "on" : "off",
                    eocSensorAttributes(snapshot)
            ));
        } finally {
            eocLock.unlock();
        }
    }

    private void onNewAlert(WeatherAlert alert) {
        LOGGER.warning("New weather alert: " + alert.event() + " - " + alert.headline());
        runner.fire(executor, "weather alert notification", () -> homeAutomation.sendNotification(
                alert.event() + "\n" + alert.headline() + "\nAreas: " + alert.areas(),
                "Weather Alert: " + alert.event()
        ));
        routineKeyFor(alert.event())
                .flatMap(key -> routines.named(key).map(entries -> Map.entry(key, entries)))
                .ifPresent(routine -> triggerRoutines(routine.getKey(), routine.getValue()));
    }

    private void onClearedAlert(WeatherAlert alert) {
        LOGGER.info("Weather alert cleared: " + alert.event());
        runner.fire(executor, "weather cleared notification", () -> homeAutomation.sendNotification(
                "Alert cleared: " + alert.event(),
                "Weather Alert Cleared"
        ));
    }

    private void onEocStateChange(String siteId, EocState previous, EocSiteState site) {
        LOGGER.warning("EOC state change: " + siteId + " - " + previous.label() + " -> " + site.state().label());
        runner.fire(executor, "EOC state notification", () -> homeAutomation.sendNotification(
                "EOC state changed: " + previous.label() + " -> " + site.state().label() + "\n" + siteId
                        + "\n\nPreview: " + preview(site.description()),
                "EOC: " + site.state().label().toUpperCase(Locale.ROOT)
        ));
        if (site.state() == EocState.INACTIVE) {
            return;
        }
        String stateKey = eocRoutineKey(site.state());
        Optional<List<String>> specific = routines.named(stateKey);
        if (specific.isPresent()) {
            triggerRoutines(stateKey, specific.get());
        } else {
            routines.named(EOC_ACTIVATED_ROUTINE).ifPresent(entries -> triggerRoutines(EOC_ACTIVATED_ROUTINE, entries));
        }
    }

    private void triggerRoutines(String key, List<String> routineIds) {
        for (String routine : routineIds) {
            if (!EffectDispatcher.isRoutine(routine)) {
                LOGGER.warning("Skipping routine with unknown type: " + routine);
                continue;
            }
            runner.fire(executor, "routine " + routine, () -> homeAutomation.triggerRoutine(routine));
        }
        LOGGER.info("Triggered routine: " + key);
    }

    static Optional<String> routineKeyFor(String event) {
        String lower = event.toLowerCase(Locale.ROOT);
        if (lower.contains("tornado")) {
            return Optional.of(TORNADO_ROUTINE);
        }
        if (lower.contains("severe") || lower.contains("thunderstorm") || lower.contains("flood")) {
            return Optional.of(SEVERE_WEATHER_ROUTINE);
        }
        return Optional.empty();
    }

    static String eocRoutineKey(EocState state) {
        return "eoc_" + state.label().replace(' ', '_');
    }

    /**
     * The highest-priority state any site reports, {@code stand up} first.
     */
    static EocState currentEocState(EocSnapshot snapshot) {
        for (EocState candidate : EOC_STATE_PRIORITY) {
            if (snapshot.sites().values().stream().anyMatch(site -> site.state() == candidate)) {
                return candidate;
            }
        }
        return EocState.INACTIVE;
    }

    static Map<String, Object> weatherSensorAttributes(WeatherSnapshot snapshot) {
        List<Map<String, Object>> alerts = new ArrayList<>();
        snapshot.alerts().forEach((id, alert) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", id);
            entry.put("event", alert.event());
            entry.put("severity", alert.severity().key());
            entry.put("headline", alert.headline());
            entry.put("areas", alert.areas());
            alerts.add(entry);
        });
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("friendly_name", "Forewarned Weather Alert");
        attributes.put("alert_count", snapshot.alerts().size());
        attributes.put("alerts", alerts);
        attributes.put("last_check", snapshot.receivedAt().toString());
        return attributes;
    }

    static Map<String, Object> eocSensorAttributes(EocSnapshot snapshot) {
        Map<String, Object> sites = new LinkedHashMap<>();
        snapshot.sites().forEach((id, site) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("state", site.state().label());
            entry.put("activated", site.activated());
            entry.put("last_check", site.lastCheck().toString());
            entry.put("content_preview", preview(site.description()));
            sites.put(id, entry);
        });
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("friendly_name", "Forewarned EOC Active");
        attributes.put("monitored_sites", snapshot.sites().size());
        attributes.put("activated_sites", snapshot.activatedCount());
        attributes.put("current_state", currentEocState(snapshot).label());
        attributes.put("sites", sites);
        attributes.put("last_check", snapshot.receivedAt().toString());
        return attributes;
    }

    private static String preview(String description) {
        return description.length() <= PREVIEW_CHARS ? description : description.substring(0, PREVIEW_CHARS);
    }
}
