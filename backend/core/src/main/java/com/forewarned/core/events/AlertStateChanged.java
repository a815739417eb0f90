package com.forewarned.core.events;

import com.forewarned.core.model.LocalAlertState;
import com.forewarned.core.model.Transition;

import java.time.Instant;

public record AlertStateChanged(
        Instant timestamp,
        LocalAlertState previous,
        LocalAlertState current
) implements Event {
    public static AlertStateChanged of(Transition transition) {
        return new AlertStateChanged(transition.current().timestamp(), transition.previous(), transition.current());
    }

    public Transition transition() {
        return new Transition(previous, current);
    }

    @Override
    public String type() {
        return "AlertStateChanged";
    }
}
