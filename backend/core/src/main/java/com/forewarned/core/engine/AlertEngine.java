package com.forewarned.core.engine;

import com.forewarned.core.bus.EventBus;
import com.forewarned.core.effects.EffectDispatcher;
import com.forewarned.core.events.AlertRaised;
import com.forewarned.core.events.AlertStateChanged;
import com.forewarned.core.events.LevelTableReloaded;
import com.forewarned.core.model.AlertLevel;
import com.forewarned.core.model.EocSnapshot;
import com.forewarned.core.model.LocalAlertState;
import com.forewarned.core.model.Transition;
import com.forewarned.core.model.WeatherSnapshot;
import com.forewarned.core.rules.LevelTable;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Evaluates the local alert level whenever a poller pushes a snapshot.
 *
 * <p>Each push runs snapshot replacement, override resolution, classification and commit as one
 * critical section, so pushes from the weather and EOC pollers cannot interleave. Effects for a
 * resulting transition are dispatched after the lock is released. Transitions are announced in
 * commit order: the announcing lock is taken before the evaluation lock is let go.
 */
public class AlertEngine implements SnapshotSink {
    private static final Logger LOGGER = Logger.getLogger(AlertEngine.class.getName());

    private final AlertClassifier classifier = new AlertClassifier();
    private final StateTransitionTracker tracker;
    private final OverrideResolver overrideResolver;
    private final EffectDispatcher dispatcher;
    private final EventBus eventBus;
    private final Clock clock;
    private final ReentrantLock evaluationLock = new ReentrantLock();
    private final ReentrantLock announceLock = new ReentrantLock();

    private volatile LevelTable levelTable;
    private volatile WeatherSnapshot weather = WeatherSnapshot.empty();
    private volatile EocSnapshot eoc = EocSnapshot.empty();

    public AlertEngine(
            LevelTable levelTable,
            OverrideSource overrideSource,
            EffectDispatcher dispatcher,
            EventBus eventBus,
            Clock clock
    ) {
        if (levelTable == null) {
            throw new IllegalStateException("Alert engine requires a level table");
        }
        this.levelTable = levelTable;
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.overrideResolver = new OverrideResolver(
                Objects.requireNonNull(overrideSource, "overrideSource is required"),
                this::reportOverrideLookupError
        );
        this.tracker = new StateTransitionTracker(LocalAlertState.initial(clock.instant()));
    }

    @Override
    public void submitWeatherSnapshot(WeatherSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot is required");
        evaluate(() -> weather = snapshot);
    }

    @Override
    public void submitEocSnapshot(EocSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot is required");
        evaluate(() -> eoc = snapshot);
    }

    /**
     * Re-runs evaluation against the latest snapshots, e.g. after an override switch flipped.
     */
    public Optional<Transition> reevaluate() {
        return evaluate(() -> {
        });
    }

    /**
     * Swaps in a new rule table and evaluates the latest snapshots against it.
     */
    public Optional<Transition> reloadLevelTable(LevelTable newTable) {
        Objects.requireNonNull(newTable, "newTable is required");
        Optional<Transition> transition = evaluate(() -> levelTable = newTable);
        eventBus.publish(new LevelTableReloaded(
                clock.instant(),
                newTable.asMap().keySet().stream().map(AlertLevel::key).toList()
        ));
        LOGGER.info("Reloaded alert level table with " + newTable.asMap().size() + " level(s)");
        return transition;
    }

    public LocalAlertState currentState() {
        return tracker.current();
    }

    public WeatherSnapshot latestWeather() {
        return weather;
    }

    public EocSnapshot latestEoc() {
        return eoc;
    }

    public LevelTable levelTable() {
        return levelTable;
    }

    private Optional<Transition> evaluate(Runnable applyInput) {
        Optional<Transition> transition;
        evaluationLock.lock();
        try {
            applyInput.run();
            transition = tracker.update(candidateState());
            if (transition.isPresent()) {
                announceLock.lock();
            }
        } finally {
            evaluationLock.unlock();
        }

        if (transition.isPresent()) {
            try {
                announce(transition.get());
            } finally {
                announceLock.unlock();
            }
        }
        return transition;
    }

    private LocalAlertState candidateState() {
        Optional<OverrideDecision> override = overrideResolver.resolve();
        if (override.isPresent()) {
            return override.get().toState(clock.instant());
        }
        return classifier.classify(weather, eoc, levelTable).toState(clock.instant());
    }

    private void announce(Transition transition) {
        LOGGER.info("Local alert state changed: " + transition.previous().level().key()
                + " -> " + transition.current().level().key());
        LOGGER.info("Reason: " + transition.current().reason());
        eventBus.publish(AlertStateChanged.of(transition));
        dispatcher.dispatch(transition);
    }

    private void reportOverrideLookupError(AlertLevel level, RuntimeException error) {
        eventBus.publish(new AlertRaised(
                clock.instant(),
                AlertRaised.OVERRIDE,
                "Override lookup failed for " + level.key() + ": "
                        + (error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage()),
                Map.of("level", level.key())
        ));
    }
}
