package com.forewarned.service.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.forewarned.core.model.AlertLevel;
import com.forewarned.core.model.EocState;
import com.forewarned.core.model.Severity;
import com.forewarned.core.rules.AlertLevelRule;
import com.forewarned.core.rules.ConditionRule;
import com.forewarned.core.rules.ConditionSet;
import com.forewarned.core.rules.EocRule;
import com.forewarned.core.rules.LevelTable;
import com.forewarned.core.rules.Operator;
import com.forewarned.core.rules.WeatherRule;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Reads the alert-rules document into a {@link LevelTable}.
 *
 * <p>The document maps level names to objects with {@code weather_conditions},
 * {@code eoc_conditions} (each {@code {operator, rules}}) and {@code condition_logic}. A rule with a
 * {@code severity} key is a weather rule; a rule with a {@code state} key is an EOC rule.
 *
 * <p>Parsing is lenient. A bad operator becomes OR. A rule list that is not an array, or that holds
 * an unrecognised rule, becomes an empty OR set, which never matches. Every such repair is reported
 * in {@link Result#warnings()}.
 */
public final class LevelTableParser {
    static final String WEATHER_CONDITIONS = "weather_conditions";
    static final String EOC_CONDITIONS = "eoc_conditions";
    static final String CONDITION_LOGIC = "condition_logic";

    private static final Logger LOGGER = Logger.getLogger(LevelTableParser.class.getName());
    private static final String ANY = "any";
    private static final String UNKNOWN = "unknown";

    private LevelTableParser() {
    }

    public static Result parse(JsonNode document) {
        if (document == null || !document.isObject()) {
            throw new IllegalArgumentException("Alert rules must be a JSON object keyed by level");
        }
        List<String> warnings = new ArrayList<>();
        LevelTable.Builder builder = LevelTable.builder();

        Iterator<Map.Entry<String, JsonNode>> fields = document.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Optional<AlertLevel> level = AlertLevel.fromKey(field.getKey()).filter(found -> found != AlertLevel.NONE);
            if (level.isEmpty()) {
                warnings.add("Unknown alert level '" + field.getKey() + "' ignored");
                continue;
            }
            builder.level(level.get(), parseLevel(level.get().key(), field.getValue(), warnings));
        }

        warnings.forEach(warning -> LOGGER.warning("Alert rules: " + warning));
        return new Result(builder.build(), List.copyOf(warnings));
    }

    /**
     * Inverse of {@link #parse}: renders the table in the same document shape.
     */
    public static Map<String, Object> toDocument(LevelTable table) {
        Map<String, Object> document = new LinkedHashMap<>();
        table.asMap().forEach((level, rule) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(WEATHER_CONDITIONS, conditionsDocument(rule.weatherConditions()));
            entry.put(EOC_CONDITIONS, conditionsDocument(rule.eocConditions()));
            entry.put(CONDITION_LOGIC, rule.combineLogic().name().toLowerCase(Locale.ROOT));
            document.put(level.key(), entry);
        });
        return document;
    }

    private static AlertLevelRule parseLevel(String level, JsonNode node, List<String> warnings) {
        if (node == null || !node.isObject()) {
            warnings.add(level + ": rule must be an object; level never triggers");
            return AlertLevelRule.never();
        }
        ConditionSet weather = parseConditions(level + "." + WEATHER_CONDITIONS, node.get(WEATHER_CONDITIONS), warnings);
        ConditionSet eoc = parseConditions(level + "." + EOC_CONDITIONS, node.get(EOC_CONDITIONS), warnings);
        Operator combine = parseOperator(level + "." + CONDITION_LOGIC, node.get(CONDITION_LOGIC), warnings);
        return new AlertLevelRule(weather, eoc, combine);
    }

    private static ConditionSet parseConditions(String path, JsonNode node, List<String> warnings) {
        if (node == null || node.isNull()) {
            return ConditionSet.empty();
        }
        if (!node.isObject()) {
            warnings.add(path + ": expected an object; using no rules");
            return ConditionSet.empty();
        }
        Operator operator = parseOperator(path + ".operator", node.get("operator"), warnings);
        JsonNode rulesNode = node.get("rules");
        if (rulesNode == null || rulesNode.isNull()) {
            return new ConditionSet(operator, List.of());
        }
        if (!rulesNode.isArray()) {
            warnings.add(path + ".rules: expected an array; using no rules");
            return new ConditionSet(operator, List.of());
        }
        List<ConditionRule> rules = new ArrayList<>();
        for (int i = 0; i < rulesNode.size(); i++) {
            Optional<ConditionRule> rule = parseRule(path + ".rules[" + i + "]", rulesNode.get(i), warnings);
            if (rule.isEmpty()) {
                warnings.add(path + ": invalid rule; conditions never match");
                return ConditionSet.empty();
            }
            rules.add(rule.get());
        }
        return new ConditionSet(operator, rules);
    }

    private static Optional<ConditionRule> parseRule(String path, JsonNode node, List<String> warnings) {
        if (node == null || !node.isObject()) {
            warnings.add(path + ": rule must be an object");
            return Optional.empty();
        }
        if (node.has("severity")) {
            String severityText = node.path("severity").asText("");
            Severity severity = null;
            String normalized = severityText.trim();
            if (UNKNOWN.equalsIgnoreCase(normalized)) {
                severity = Severity.UNKNOWN;
            } else if (!ANY.equalsIgnoreCase(normalized)) {
                severity = Severity.fromText(severityText);
                if (severity == Severity.UNKNOWN) {
                    warnings.add(path + ": unrecognised severity '" + severityText + "'");
                    return Optional.empty();
                }
            }
            return Optional.of(new WeatherRule(node.path("type").asText(ANY), severity));
        }
        if (node.has("state")) {
            String stateText = node.path("state").asText("");
            Optional<EocState> state = EocState.fromText(stateText);
            if (state.isEmpty()) {
                warnings.add(path + ": unknown EOC state '" + stateText + "'");
                return Optional.empty();
            }
            return Optional.of(new EocRule(state.get()));
        }
        warnings.add(path + ": rule has neither 'severity' nor 'state'");
        return Optional.empty();
    }

    private static Operator parseOperator(String path, JsonNode node, List<String> warnings) {
        if (node == null || node.isNull()) {
            return Operator.OR;
        }
        Optional<Operator> operator = Operator.fromText(node.asText());
        if (operator.isEmpty()) {
            warnings.add(path + ": unknown operator '" + node.asText() + "'; using OR");
            return Operator.OR;
        }
        return operator.get();
    }

    private static Map<String, Object> conditionsDocument(ConditionSet conditions) {
        List<Map<String, Object>> rules = new ArrayList<>();
        for (ConditionRule rule : conditions.rules()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            if (rule instanceof WeatherRule weatherRule) {
                entry.put("type", weatherRule.anyEventType() ? ANY : weatherRule.eventType());
                entry.put("severity", weatherRule.anySeverity() ? ANY : weatherRule.severity().key());
            } else if (rule instanceof EocRule eocRule) {
                entry.put("state", eocRule.state().label());
            }
            rules.add(entry);
        }
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("operator", conditions.operator().name().toLowerCase(Locale.ROOT));
        document.put("rules", rules);
        return document;
    }

    public record Result(LevelTable table, List<String> warnings) {
    }
}
