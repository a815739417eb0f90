package com.forewarned.collectors.weather;

import com.forewarned.collectors.api.Collector;
import com.forewarned.collectors.api.CollectorContext;
import com.forewarned.collectors.api.CollectorResult;
import com.forewarned.collectors.config.WeatherCollectorConfig;
import com.forewarned.core.events.AlertRaised;
import com.forewarned.core.events.CollectorTickCompleted;
import com.forewarned.core.events.CollectorTickStarted;
import com.forewarned.core.events.WeatherSnapshotReceived;
import com.forewarned.core.model.WeatherAlert;
import com.forewarned.core.model.WeatherSnapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Pulls the active alert list from a provider, filters it to the local area and pushes the result
 * to the engine as one complete snapshot.
 */
public class WeatherCollector implements Collector {
    public static final String CONFIG_KEY = "weatherCollector";

    private static final Logger LOGGER = Logger.getLogger(WeatherCollector.class.getName());
    private static final String CANCELLATION = "cancellation";

    private final WeatherAlertProvider provider;
    private final Duration interval;

    public WeatherCollector(WeatherAlertProvider provider) {
        this(provider, Duration.ofMinutes(5));
    }

    public WeatherCollector(WeatherAlertProvider provider, Duration interval) {
        this.provider = provider;
        this.interval = interval;
    }

    @Override
    public String name() {
        return "weatherCollector";
    }

    @Override
    public Duration interval() {
        return interval;
    }

    @Override
    public CompletableFuture<CollectorResult> poll(CollectorContext ctx) {
        Instant tickStartedAt = ctx.clock().instant();
        ctx.eventBus().publish(new CollectorTickStarted(tickStartedAt, name()));

        WeatherCollectorConfig cfg = ctx.requiredConfig(CONFIG_KEY, WeatherCollectorConfig.class);
        CompletableFuture<CollectorResult> pipeline = CompletableFuture
                .supplyAsync(provider::activeAlerts)
                .orTimeout(ctx.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(alerts -> submit(filter(alerts, cfg.areaKeywords()), ctx));

        return pipeline.handle((result, error) -> {
            long durationMillis = Duration.between(tickStartedAt, ctx.clock().instant()).toMillis();
            if (error != null) {
                String message = "Weather fetch failed from " + provider.name() + ": " + rootMessage(error);
                LOGGER.warning(message);
                ctx.eventBus().publish(new AlertRaised(
                        ctx.clock().instant(),
                        AlertRaised.COLLECTOR,
                        message,
                        Map.of("collector", name(), "provider", provider.name())
                ));
                ctx.eventBus().publish(new CollectorTickCompleted(ctx.clock().instant(), name(), false, false, durationMillis));
                return CollectorResult.failure(message, Map.of());
            }
            ctx.eventBus().publish(new CollectorTickCompleted(
                    ctx.clock().instant(),
                    name(),
                    result.success(),
                    result.snapshotSubmitted(),
                    durationMillis
            ));
            return result;
        });
    }

    private CollectorResult submit(Map<String, WeatherAlert> alerts, CollectorContext ctx) {
        WeatherSnapshot snapshot = new WeatherSnapshot(alerts, ctx.clock().instant());
        ctx.snapshotSink().submitWeatherSnapshot(snapshot);

        List<String> events = alerts.values().stream().map(WeatherAlert::event).toList();
        ctx.eventBus().publish(new WeatherSnapshotReceived(ctx.clock().instant(), alerts.size(), events));
        LOGGER.fine("Submitted weather snapshot with " + alerts.size() + " alert(s)");

        Map<String, Object> stats = new HashMap<>();
        stats.put("provider", provider.name());
        stats.put("alerts", alerts.size());
        return CollectorResult.submitted("Weather polling completed", stats);
    }

    static Map<String, WeatherAlert> filter(Map<String, WeatherAlert> alerts, List<String> areaKeywords) {
        List<String> keywords = areaKeywords.stream()
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .toList();
        Map<String, WeatherAlert> kept = new LinkedHashMap<>();
        alerts.forEach((id, alert) -> {
            if (isCancellation(alert)) {
                LOGGER.fine("Skipping cancellation message: " + id);
                return;
            }
            if (!keywords.isEmpty() && !mentionsAny(alert, keywords)) {
                return;
            }
            kept.put(id, alert);
        });
        return kept;
    }

    private static boolean isCancellation(WeatherAlert alert) {
        return alert.event().toLowerCase(Locale.ROOT).contains(CANCELLATION)
                || alert.headline().toLowerCase(Locale.ROOT).contains(CANCELLATION);
    }

    private static boolean mentionsAny(WeatherAlert alert, List<String> keywords) {
        String haystack = (alert.event() + " " + alert.headline() + " " + alert.areas()).toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(haystack::contains);
    }

    private String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
