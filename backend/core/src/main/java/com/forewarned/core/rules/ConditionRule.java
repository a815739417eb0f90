package com.forewarned.core.rules;

/**
 * One atom of a {@link ConditionSet}: either a match against weather alerts or a match against
 * EOC site states.
 */
public sealed interface ConditionRule permits WeatherRule, EocRule {
}
