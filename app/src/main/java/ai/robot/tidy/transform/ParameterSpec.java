package ai.robot.tidy.transform;

import java.util.Objects;

/**
 * Declared rule parameter with its default rendered as text.
 */
public record ParameterSpec(String name, String defaultValue, String description) {

    public ParameterSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(defaultValue, "defaultValue");
        Objects.requireNonNull(description, "description");
    }

    public static ParameterSpec of(String name, String defaultValue, String description) {
        return new ParameterSpec(name, defaultValue, description);
    }
}
