package ai.robot.tidy.transform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A rule name with raw parameters, parsed from entries such as {@code AlignVariablesSection:up_to_column=3}.
 */
public record RuleSpec(String ruleName, Map<String, String> parameters) {

    public RuleSpec {
        Objects.requireNonNull(ruleName, "ruleName");
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(parameters, "parameters")));
    }

    public static RuleSpec of(String ruleName) {
        return new RuleSpec(ruleName, Map.of());
    }

    public static RuleSpec parse(String entry) {
        if (entry == null || entry.isBlank()) {
            throw ConfigurationException.malformed(String.valueOf(entry), "rule name is missing");
        }
        String[] parts = entry.strip().split(":");
        String name = parts[0].strip();
        if (name.isEmpty()) {
            throw ConfigurationException.malformed(entry, "rule name is missing");
        }
        Map<String, String> parameters = new LinkedHashMap<>();
        for (int i = 1; i < parts.length; i++) {
            String pair = parts[i];
            int separator = pair.indexOf('=');
            if (separator <= 0) {
                throw ConfigurationException.malformed(entry, "expected name=value but got '" + pair + "'");
            }
            parameters.put(pair.substring(0, separator).strip(), pair.substring(separator + 1).strip());
        }
        return new RuleSpec(name, parameters);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(ruleName);
        parameters.forEach((name, value) -> builder.append(':').append(name).append('=').append(value));
        return builder.toString();
    }
}
