package com.forewarned.core.engine;

import com.forewarned.core.model.EocSiteState;
import com.forewarned.core.model.EocSnapshot;
import com.forewarned.core.model.WeatherAlert;
import com.forewarned.core.model.WeatherSnapshot;
import com.forewarned.core.rules.ConditionRule;
import com.forewarned.core.rules.ConditionSet;
import com.forewarned.core.rules.EocRule;
import com.forewarned.core.rules.Operator;
import com.forewarned.core.rules.WeatherRule;

import java.util.List;
import java.util.Locale;

/**
 * Evaluates condition sets against the latest snapshots. Stateless; every method is a pure
 * function of its arguments.
 */
public final class ConditionEvaluator {
    private ConditionEvaluator() {
    }

    /**
     * Combines the per-rule results with the set's operator. A set with no rules is false under
     * both operators.
     */
    public static boolean evaluate(ConditionSet conditions, WeatherSnapshot weather, EocSnapshot eoc) {
        if (conditions.isEmpty()) {
            return false;
        }
        if (conditions.operator() == Operator.AND) {
            return conditions.rules().stream().allMatch(rule -> matches(rule, weather, eoc));
        }
        return conditions.rules().stream().anyMatch(rule -> matches(rule, weather, eoc));
    }

    public static boolean matches(ConditionRule rule, WeatherSnapshot weather, EocSnapshot eoc) {
        if (rule instanceof WeatherRule weatherRule) {
            return weather.alerts().values().stream().anyMatch(alert -> matchesAlert(weatherRule, alert));
        }
        if (rule instanceof EocRule eocRule) {
            return eoc.sites().values().stream().anyMatch(site -> matchesSite(eocRule, site));
        }
        throw new IllegalArgumentException("Unsupported condition rule: " + rule);
    }

    public static boolean matchesAlert(WeatherRule rule, WeatherAlert alert) {
        boolean typeMatch = rule.anyEventType()
                || alert.event().toLowerCase(Locale.ROOT).contains(rule.eventType());
        boolean severityMatch = rule.anySeverity() || rule.severity() == alert.severity();
        return typeMatch && severityMatch;
    }

    public static boolean matchesSite(EocRule rule, EocSiteState site) {
        return site.activated() && site.state() == rule.state();
    }

    /**
     * Alerts that satisfy at least one weather rule of the set, in snapshot order.
     */
    public static List<WeatherAlert> contributingAlerts(ConditionSet conditions, WeatherSnapshot weather) {
        List<WeatherRule> weatherRules = conditions.rules().stream()
                .filter(WeatherRule.class::isInstance)
                .map(WeatherRule.class::cast)
                .toList();
        return weather.alerts().values().stream()
                .filter(alert -> weatherRules.stream().anyMatch(rule -> matchesAlert(rule, alert)))
                .toList();
    }
}
