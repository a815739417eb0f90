package com.forewarned.core.effects;

import com.forewarned.core.bus.EventBus;
import com.forewarned.core.events.AlertRaised;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one named effect on an executor. A failure, including a rejected schedule, is logged and
 * published as {@link AlertRaised} in the {@code effect} category.
 */
final class EffectRunner {
    private static final Logger LOGGER = Logger.getLogger(EffectRunner.class.getName());

    private final EventBus eventBus;
    private final Clock clock;

    EffectRunner(EventBus eventBus, Clock clock) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    void fire(Executor executor, String effect, Runnable action) {
        try {
            executor.execute(() -> run(effect, action));
        } catch (RuntimeException rejected) {
            LOGGER.log(Level.WARNING, "Could not schedule " + effect, rejected);
            reportFailure(effect, rejected);
        }
    }

    private void run(String effect, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Effect failed: " + effect, e);
            reportFailure(effect, e);
        }
    }

    private void reportFailure(String effect, RuntimeException error) {
        eventBus.publish(new AlertRaised(
                clock.instant(),
                AlertRaised.EFFECT,
                "Effect failed: " + effect + " - " + describe(error),
                Map.of("effect", effect)
        ));
    }

    private static String describe(RuntimeException error) {
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }
}
