package com.forewarned.core.rules;

import com.forewarned.core.model.AlertLevel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable mapping from each real alert level to the rule that triggers it. Levels without an
 * entry never trigger.
 */
public final class LevelTable {
    private final Map<AlertLevel, AlertLevelRule> rules;

    private LevelTable(Map<AlertLevel, AlertLevelRule> rules) {
        this.rules = Collections.unmodifiableMap(rules);
    }

    public static LevelTable of(Map<AlertLevel, AlertLevelRule> rules) {
        Objects.requireNonNull(rules, "rules is required");
        EnumMap<AlertLevel, AlertLevelRule> copy = new EnumMap<>(AlertLevel.class);
        rules.forEach((level, rule) -> {
            if (level == AlertLevel.NONE) {
                throw new IllegalArgumentException("Level table cannot contain a rule for 'none'");
            }
            copy.put(level, Objects.requireNonNull(rule, "rule for " + level.key() + " is required"));
        });
        return new LevelTable(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public AlertLevelRule ruleFor(AlertLevel level) {
        return rules.getOrDefault(level, AlertLevelRule.never());
    }

    public Map<AlertLevel, AlertLevelRule> asMap() {
        return rules;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof LevelTable table && rules.equals(table.rules);
    }

    @Override
    public int hashCode() {
        return rules.hashCode();
    }

    @Override
    public String toString() {
        return "LevelTable" + rules;
    }

    public static final class Builder {
        private final EnumMap<AlertLevel, AlertLevelRule> rules = new EnumMap<>(AlertLevel.class);

        private Builder() {
        }

        public Builder level(AlertLevel level, AlertLevelRule rule) {
            rules.put(level, rule);
            return this;
        }

        public Builder level(AlertLevel level, ConditionSet weather, ConditionSet eoc, Operator combineLogic) {
            return level(level, new AlertLevelRule(weather, eoc, combineLogic));
        }

        public LevelTable build() {
            return LevelTable.of(rules);
        }
    }
}
