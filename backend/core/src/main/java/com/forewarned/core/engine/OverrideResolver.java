package com.forewarned.core.engine;

import com.forewarned.core.model.AlertLevel;

import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class OverrideResolver {
    private static final Logger LOGGER = Logger.getLogger(OverrideResolver.class.getName());

    private final OverrideSource source;
    private final BiConsumer<AlertLevel, RuntimeException> onLookupError;

    public OverrideResolver(OverrideSource source) {
        this(source, (level, error) -> {
        });
    }

    public OverrideResolver(OverrideSource source, BiConsumer<AlertLevel, RuntimeException> onLookupError) {
        this.source = source;
        this.onLookupError = onLookupError;
    }

    /**
     * Returns the highest level whose switch is on. A switch that cannot be read counts as off and
     * the lookup moves on to the next level down.
     */
    public Optional<OverrideDecision> resolve() {
        for (AlertLevel level : AlertLevel.descending()) {
            try {
                if (source.isOn(level)) {
                    return Optional.of(OverrideDecision.forLevel(level));
                }
            } catch (RuntimeException e) {
                LOGGER.log(Level.FINE, "Could not read " + level.key() + " override from " + source.name(), e);
                onLookupError.accept(level, e);
            }
        }
        return Optional.empty();
    }

    public OverrideSource source() {
        return source;
    }
}
