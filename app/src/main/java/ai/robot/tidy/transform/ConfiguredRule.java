package ai.robot.tidy.transform;

import java.util.Objects;

/**
 * A rule instance bound to the registry entry it was created from.
 */
public record ConfiguredRule(RuleKind kind, Rule rule) {

    public ConfiguredRule {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(rule, "rule");
    }

    public String name() {
        return kind.ruleName();
    }
}
