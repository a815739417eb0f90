package com.forewarned.core.rules;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

public record ConditionSet(Operator operator, List<ConditionRule> rules) {
    private static final ConditionSet EMPTY = new ConditionSet(Operator.OR, List.of());

    public ConditionSet {
        operator = operator == null ? Operator.OR : operator;
        Objects.requireNonNull(rules, "rules is required");
        rules = List.copyOf(rules);
    }

    public static ConditionSet empty() {
        return EMPTY;
    }

    public static ConditionSet anyOf(ConditionRule... rules) {
        return new ConditionSet(Operator.OR, List.of(rules));
    }

    public static ConditionSet allOf(ConditionRule... rules) {
        return new ConditionSet(Operator.AND, List.of(rules));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return rules.isEmpty();
    }
}
