package com.forewarned.core.engine;

import com.forewarned.core.model.AlertLevel;
import com.forewarned.core.model.EocSiteState;
import com.forewarned.core.model.EocSnapshot;
import com.forewarned.core.model.WeatherAlert;
import com.forewarned.core.model.WeatherSnapshot;
import com.forewarned.core.rules.AlertLevelRule;
import com.forewarned.core.rules.LevelTable;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Picks the highest-priority level whose rule holds for the current snapshots and explains why.
 */
public final class AlertClassifier {
    static final String WEATHER_PREFIX = "Weather: ";
    static final String EOC_PREFIX = "LDMG: ";

    private static final String AREA_DELIMITER = " for ";
    private static final String DETAIL_DELIMITER = " - ";

    public Classification classify(WeatherSnapshot weather, EocSnapshot eoc, LevelTable table) {
        for (AlertLevel level : AlertLevel.descending()) {
            AlertLevelRule rule = table.ruleFor(level);
            boolean weatherMatch = ConditionEvaluator.evaluate(rule.weatherConditions(), weather, eoc);
            boolean eocMatch = ConditionEvaluator.evaluate(rule.eocConditions(), weather, eoc);
            if (!rule.combineLogic().combine(weatherMatch, eocMatch)) {
                continue;
            }

            Set<String> reasons = new LinkedHashSet<>();
            if (weatherMatch) {
                for (WeatherAlert alert : ConditionEvaluator.contributingAlerts(rule.weatherConditions(), weather)) {
                    reasons.add(WEATHER_PREFIX + shortEventName(alert.event()));
                }
            }
            if (eocMatch) {
                for (EocSiteState site : eoc.sites().values()) {
                    if (site.activated()) {
                        reasons.add(EOC_PREFIX + site.state().label().toUpperCase(Locale.ROOT));
                    }
                }
            }
            return new Classification(level, reasons.stream().toList());
        }
        return Classification.none();
    }

    /**
     * Strips the trailing area list or detail from an event name, e.g.
     * "Severe Heatwave Warning for the Peninsula" becomes "Severe Heatwave Warning".
     */
    static String shortEventName(String event) {
        String shortened = event;
        int areaIndex = shortened.indexOf(AREA_DELIMITER);
        if (areaIndex >= 0) {
            shortened = shortened.substring(0, areaIndex);
        }
        int detailIndex = shortened.indexOf(DETAIL_DELIMITER);
        if (detailIndex >= 0) {
            shortened = shortened.substring(0, detailIndex);
        }
        return shortened;
    }
}
