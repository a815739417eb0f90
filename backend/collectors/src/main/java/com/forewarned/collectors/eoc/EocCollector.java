package com.forewarned.collectors.eoc;

import com.forewarned.collectors.api.Collector;
import com.forewarned.collectors.api.CollectorContext;
import com.forewarned.collectors.api.CollectorResult;
import com.forewarned.collectors.config.EocCollectorConfig;
import com.forewarned.collectors.config.EocSiteConfig;
import com.forewarned.core.events.AlertRaised;
import com.forewarned.core.events.CollectorTickCompleted;
import com.forewarned.core.events.CollectorTickStarted;
import com.forewarned.core.events.EocSnapshotReceived;
import com.forewarned.core.model.EocSiteState;
import com.forewarned.core.model.EocSnapshot;
import com.forewarned.core.model.EocState;
import com.forewarned.core.util.HtmlUtils;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpTimeoutException;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Polls every configured EOC status page in parallel. A snapshot is only submitted when every site
 * answered; one failing site leaves the engine on its previous EOC snapshot.
 */
public class EocCollector implements Collector {
    public static final String CONFIG_KEY = "eocCollector";
    static final int DESCRIPTION_CHARS = 200;

    private static final Logger LOGGER = Logger.getLogger(EocCollector.class.getName());

    private final Duration interval;

    public EocCollector() {
        this(Duration.ofMinutes(5));
    }

    public EocCollector(Duration interval) {
        this.interval = interval;
    }

    @Override
    public String name() {
        return "eocCollector";
    }

    @Override
    public Duration interval() {
        return interval;
    }

    @Override
    public CompletableFuture<CollectorResult> poll(CollectorContext ctx) {
        Instant tickStartedAt = ctx.clock().instant();
        ctx.eventBus().publish(new CollectorTickStarted(tickStartedAt, name()));

        EocCollectorConfig cfg = ctx.requiredConfig(CONFIG_KEY, EocCollectorConfig.class);
        List<CompletableFuture<SitePollOutcome>> tasks = cfg.sites().stream()
                .map(site -> pollSite(site, ctx))
                .toList();

        CompletableFuture<CollectorResult> pipeline = CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> submitIfComplete(tasks.stream().map(CompletableFuture::join).toList(), ctx));

        return pipeline.handle((result, error) -> {
            long durationMillis = Duration.between(tickStartedAt, ctx.clock().instant()).toMillis();
            if (error != null) {
                ctx.eventBus().publish(new CollectorTickCompleted(ctx.clock().instant(), name(), false, false, durationMillis));
                return CollectorResult.failure("EOC collector failed: " + rootCause(error).getMessage(), Map.of());
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

    private CompletableFuture<SitePollOutcome> pollSite(EocSiteConfig site, CollectorContext ctx) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(site.url()))
                .GET()
                .timeout(ctx.requestTimeout())
                .header("User-Agent", "Forewarned/1.0")
                .build();

        return ctx.httpClient().sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .orTimeout(ctx.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error != null) {
                        return failed(site, describeFailure(site.url(), error), Map.of(), ctx);
                    }
                    if (response.statusCode() >= 400) {
                        return failed(
                                site,
                                "HTTP status " + response.statusCode() + " from " + site.url(),
                                Map.of("status", response.statusCode()),
                                ctx
                        );
                    }
                    String text = HtmlUtils.visibleText(response.body());
                    EocState state = EocStateDetector.detect(text);
                    LOGGER.fine("EOC site " + site.id() + " reports " + state.label());
                    return new SitePollOutcome(
                            site,
                            EocSiteState.observed(state, ctx.clock().instant(), HtmlUtils.preview(text, DESCRIPTION_CHARS))
                    );
                });
    }

    private SitePollOutcome failed(EocSiteConfig site, String message, Map<String, Object> extra, CollectorContext ctx) {
        LOGGER.warning(message);
        Map<String, Object> details = new HashMap<>(extra);
        details.put("collector", name());
        details.put("siteId", site.id());
        details.put("url", site.url());
        ctx.eventBus().publish(new AlertRaised(ctx.clock().instant(), AlertRaised.COLLECTOR, message, details));
        return new SitePollOutcome(site, null);
    }

    private CollectorResult submitIfComplete(List<SitePollOutcome> outcomes, CollectorContext ctx) {
        long failures = outcomes.stream().filter(outcome -> !outcome.success()).count();
        Map<String, Object> stats = new HashMap<>();
        stats.put("sites", outcomes.size());
        stats.put("failures", failures);
        if (failures > 0) {
            return CollectorResult.failure(
                    "EOC polling had " + failures + " failed site(s); keeping previous snapshot",
                    stats
            );
        }

        Map<String, EocSiteState> sites = new LinkedHashMap<>();
        Map<String, String> states = new LinkedHashMap<>();
        for (SitePollOutcome outcome : outcomes) {
            sites.put(outcome.site().id(), outcome.state());
            states.put(outcome.site().id(), outcome.state().state().label());
        }
        EocSnapshot snapshot = new EocSnapshot(sites, ctx.clock().instant());
        ctx.snapshotSink().submitEocSnapshot(snapshot);
        ctx.eventBus().publish(new EocSnapshotReceived(
                ctx.clock().instant(),
                sites.size(),
                (int) snapshot.activatedCount(),
                states
        ));
        stats.put("activated", snapshot.activatedCount());
        return CollectorResult.submitted("Processed " + outcomes.size() + " EOC site(s)", stats);
    }

    private String describeFailure(String url, Throwable error) {
        Throwable root = rootCause(error);
        if (root instanceof TimeoutException || root instanceof HttpTimeoutException) {
            return "Request timed out while fetching " + url;
        }
        String rootText = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
        return "Fetch failure for " + url + ": " + rootText;
    }

    private Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private record SitePollOutcome(EocSiteConfig site, EocSiteState state) {
        boolean success() {
            return state != null;
        }
    }
}
