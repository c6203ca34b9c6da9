package ai.robot.tidy.transform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Raw {@code name=value} pairs for one rule with typed, validating accessors.
 */
public final class RuleParameters {

    private static final List<String> BOOLEANS = List.of("True", "False");

    private final RuleKind rule;
    private final Map<String, String> values;

    public RuleParameters(RuleKind rule, Map<String, String> values) {
        this.rule = Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(values, "values");
        for (String name : values.keySet()) {
            if (!rule.accepts(name)) {
                throw ConfigurationException.unknownParameter(rule.ruleName(), name, rule.parameterNames());
            }
        }
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static RuleParameters defaults(RuleKind rule) {
        return new RuleParameters(rule, Map.of());
    }

    public RuleKind rule() {
        return rule;
    }

    public Map<String, String> values() {
        return values;
    }

    public boolean isEnabled() {
        return getBoolean(RuleKind.ENABLED, true);
    }

    public Optional<String> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public String getString(String name, String defaultValue) {
        return values.getOrDefault(name, defaultValue);
    }

    public boolean getBoolean(String name, boolean defaultValue) {
        String raw = values.get(name);
        if (raw == null) {
            return defaultValue;
        }
        if ("true".equalsIgnoreCase(raw.strip())) {
            return true;
        }
        if ("false".equalsIgnoreCase(raw.strip())) {
            return false;
        }
        throw ConfigurationException.invalidValue(rule.ruleName(), name, raw, BOOLEANS);
    }

    public int getInt(String name, int defaultValue, int min) {
        return getOptionalInt(name, min).orElse(defaultValue);
    }

    /**
     * Integer parameter that has no fixed default; empty when unset or blank.
     */
    public Optional<Integer> getOptionalInt(String name, int min) {
        String raw = values.get(name);
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        int parsed;
        try {
            parsed = Integer.parseInt(raw.strip());
        } catch (NumberFormatException ex) {
            throw ConfigurationException.invalidValue(rule.ruleName(), name, raw, "an integer >= " + min);
        }
        if (parsed < min) {
            throw ConfigurationException.invalidValue(rule.ruleName(), name, raw, "an integer >= " + min);
        }
        return Optional.of(parsed);
    }

    public <T> T getChoice(String name, String defaultChoice, Map<String, T> choices) {
        String raw = values.getOrDefault(name, defaultChoice);
        if (!choices.containsKey(raw)) {
            throw invalid(name, raw, List.copyOf(choices.keySet()));
        }
        return choices.get(raw);
    }

    public ConfigurationException invalid(String name, String value, List<String> accepted) {
        return ConfigurationException.invalidValue(rule.ruleName(), name, value, accepted);
    }

    @Override
    public String toString() {
        return rule.ruleName() + values;
    }
}
