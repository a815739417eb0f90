package com.forewarned.service.runtime;

import com.forewarned.collectors.api.Collector;
import com.forewarned.collectors.api.CollectorContext;
import com.forewarned.collectors.api.CollectorResult;
import com.forewarned.core.events.AlertRaised;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Drives each enabled collector on its own fixed interval. A single timer thread only hands runs
 * off to the collector pool, so a slow poll never delays another collector's tick.
 */
public class SchedulerService {
    private static final Logger LOGGER = Logger.getLogger(SchedulerService.class.getName());

    private final List<ScheduledCollector> collectors;
    private final CollectorContext context;
    private final long minIntervalMillis;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor();
    private final ExecutorService collectorExecutor = Executors.newCachedThreadPool();

    public SchedulerService(List<ScheduledCollector> collectors, CollectorContext context) {
        this(collectors, context, 100);
    }

    SchedulerService(List<ScheduledCollector> collectors, CollectorContext context, long minIntervalMillis) {
        this.collectors = List.copyOf(collectors);
        this.context = context;
        this.minIntervalMillis = minIntervalMillis;
    }

    public void start() {
        for (ScheduledCollector scheduled : collectors) {
            if (!scheduled.enabled()) {
                LOGGER.info("Collector " + scheduled.collector().name() + " is disabled");
                continue;
            }
            long intervalMillis = Math.max(minIntervalMillis, scheduled.interval().toMillis());
            timerExecutor.scheduleAtFixedRate(
                    () -> collectorExecutor.submit(() -> runCollectorSafely(scheduled.collector())),
                    0,
                    intervalMillis,
                    TimeUnit.MILLISECONDS
            );
            LOGGER.info("Scheduled " + scheduled.collector().name() + " every " + intervalMillis + "ms");
        }
    }

    public List<CollectorResult> runOnceAllCollectors() {
        List<CompletableFuture<CollectorResult>> runs = new ArrayList<>();
        for (ScheduledCollector scheduled : collectors) {
            if (!scheduled.enabled()) {
                continue;
            }
            runs.add(CompletableFuture.supplyAsync(() -> runCollectorSafely(scheduled.collector()), collectorExecutor));
        }
        List<CollectorResult> results = new ArrayList<>();
        for (CompletableFuture<CollectorResult> run : runs) {
            results.add(run.join());
        }
        return results;
    }

    public void shutdown() {
        timerExecutor.shutdown();
        collectorExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
            collectorExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private CollectorResult runCollectorSafely(Collector collector) {
        try {
            return collector.poll(context).join();
        } catch (Exception ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            String detail = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
            context.eventBus().publish(new AlertRaised(
                    context.clock().instant(),
                    AlertRaised.COLLECTOR,
                    "Collector run failed: " + collector.name() + " - " + detail,
                    Map.of("collector", collector.name())
            ));
            return CollectorResult.failure(
                    "Collector run failed: " + collector.name(),
                    Map.of("collector", collector.name())
            );
        }
    }

    public record ScheduledCollector(Collector collector, Duration interval, boolean enabled) {
        public ScheduledCollector {
            Objects.requireNonNull(collector, "collector is required");
            Objects.requireNonNull(interval, "interval is required");
        }
    }
}
