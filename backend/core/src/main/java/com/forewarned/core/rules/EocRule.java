package com.forewarned.core.rules;

import com.forewarned.core.model.EocState;

import java.util.Objects;

public record EocRule(EocState state) implements ConditionRule {
    public EocRule {
        Objects.requireNonNull(state, "state is required");
    }
}
