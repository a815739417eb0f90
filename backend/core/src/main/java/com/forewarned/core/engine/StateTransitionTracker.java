package com.forewarned.core.engine;

import com.forewarned.core.model.LocalAlertState;
import com.forewarned.core.model.Transition;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owner of the single committed {@link LocalAlertState}. All writes go through {@link #update},
 * which compares and commits under one lock.
 */
public final class StateTransitionTracker {
    private final ReentrantLock lock = new ReentrantLock();
    private volatile LocalAlertState committed;

    public StateTransitionTracker(LocalAlertState initial) {
        this.committed = Objects.requireNonNull(initial, "initial state is required");
    }

    /**
     * Commits the candidate. Returns a transition only when (active, level) changed; otherwise the
     * committed state is still replaced so its reason and triggers stay current.
     */
    public Optional<Transition> update(LocalAlertState candidate) {
        Objects.requireNonNull(candidate, "candidate is required");
        lock.lock();
        try {
            LocalAlertState previous = committed;
            committed = candidate;
            if (previous.sameOutcomeAs(candidate)) {
                return Optional.empty();
            }
            return Optional.of(new Transition(previous, candidate));
        } finally {
            lock.unlock();
        }
    }

    public LocalAlertState current() {
        return committed;
    }
}
