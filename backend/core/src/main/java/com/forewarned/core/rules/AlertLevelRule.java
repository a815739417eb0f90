package com.forewarned.core.rules;

public record AlertLevelRule(
        ConditionSet weatherConditions,
        ConditionSet eocConditions,
        Operator combineLogic
) {
    private static final AlertLevelRule NEVER = new AlertLevelRule(ConditionSet.empty(), ConditionSet.empty(), Operator.OR);

    public AlertLevelRule {
        weatherConditions = weatherConditions == null ? ConditionSet.empty() : weatherConditions;
        eocConditions = eocConditions == null ? ConditionSet.empty() : eocConditions;
        combineLogic = combineLogic == null ? Operator.OR : combineLogic;
    }

    /**
     * A rule whose both sides are empty and therefore never triggers.
     */
    public static AlertLevelRule never() {
        return NEVER;
    }
}
