package com.forewarned.service.api;

import com.forewarned.core.bus.EventBus;
import com.forewarned.core.events.AlertRaised;
import com.forewarned.core.events.AlertStateChanged;
import com.forewarned.core.events.CollectorTickCompleted;
import com.forewarned.core.events.CollectorTickStarted;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

public final class DiagnosticsTracker {
    private final LongAdder transitionsTotal = new LongAdder();
    private final LongAdder effectFailuresTotal = new LongAdder();
    private final LongAdder overrideErrorsTotal = new LongAdder();
    private final ConcurrentHashMap<String, CollectorStatus> collectorStatuses = new ConcurrentHashMap<>();

    public DiagnosticsTracker(EventBus eventBus) {
        eventBus.subscribe(CollectorTickStarted.class, this::onTickStarted);
        eventBus.subscribe(CollectorTickCompleted.class, this::onTickCompleted);
        eventBus.subscribe(AlertRaised.class, this::onAlertRaised);
        eventBus.subscribe(AlertStateChanged.class, event -> transitionsTotal.increment());
    }

    private DiagnosticsTracker() {
    }

    public static DiagnosticsTracker empty() {
        return new DiagnosticsTracker();
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> snapshot = new HashMap<>();
        snapshot.put("transitionsTotal", transitionsTotal.longValue());
        snapshot.put("effectFailuresTotal", effectFailuresTotal.longValue());
        snapshot.put("overrideErrorsTotal", overrideErrorsTotal.longValue());
        snapshot.put("collectors", collectorsSnapshot());
        return snapshot;
    }

    public Map<String, Object> collectorsSnapshot() {
        Map<String, Object> collectors = new TreeMap<>();
        for (Map.Entry<String, CollectorStatus> entry : collectorStatuses.entrySet()) {
            collectors.put(entry.getKey(), entry.getValue().toMap());
        }
        return collectors;
    }

    private void onTickStarted(CollectorTickStarted event) {
        collectorStatuses.compute(event.collectorName(), (name, current) -> {
            CollectorStatus status = current == null ? CollectorStatus.empty() : current;
            return status.withLastRunAt(event.timestamp());
        });
    }

    private void onTickCompleted(CollectorTickCompleted event) {
        collectorStatuses.compute(event.collectorName(), (name, current) -> {
            CollectorStatus status = current == null ? CollectorStatus.empty() : current;
            return status.withCompletion(event.timestamp(), event.durationMillis(), event.success());
        });
    }

    private void onAlertRaised(AlertRaised event) {
        if (AlertRaised.EFFECT.equals(event.category())) {
            effectFailuresTotal.increment();
            return;
        }
        if (AlertRaised.OVERRIDE.equals(event.category())) {
            overrideErrorsTotal.increment();
            return;
        }
        if (!AlertRaised.COLLECTOR.equals(event.category()) || event.details() == null) {
            return;
        }
        Object collector = event.details().get("collector");
        if (!(collector instanceof String collectorName) || collectorName.isBlank()) {
            return;
        }
        collectorStatuses.compute(collectorName, (name, current) -> {
            CollectorStatus status = current == null ? CollectorStatus.empty() : current;
            return status.withLastErrorMessage(event.message());
        });
    }

    private record CollectorStatus(
            Instant lastRunAt,
            Long lastDurationMillis,
            Boolean lastSuccess,
            String lastErrorMessage
    ) {
        private static CollectorStatus empty() {
            return new CollectorStatus(null, null, null, null);
        }

        private CollectorStatus withLastRunAt(Instant runAt) {
            return new CollectorStatus(runAt, lastDurationMillis, lastSuccess, lastErrorMessage);
        }

        private CollectorStatus withCompletion(Instant runAt, long durationMillis, boolean success) {
            return new CollectorStatus(runAt, durationMillis, success, success ? null : lastErrorMessage);
        }

        private CollectorStatus withLastErrorMessage(String message) {
            return new CollectorStatus(lastRunAt, lastDurationMillis, lastSuccess, message);
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("lastRunAt", lastRunAt == null ? null : lastRunAt.toString());
            map.put("lastDurationMillis", lastDurationMillis);
            map.put("lastSuccess", lastSuccess);
            map.put("lastErrorMessage", lastErrorMessage);
            return map;
        }
    }
}
