package ai.robot.tidy.config;

import ai.robot.tidy.transform.RuleSpec;
import java.util.List;
import java.util.Objects;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        List<RuleSpec> transforms,
        List<RuleSpec> configure,
        FormattingContext formatting,
        LogFormat logFormat,
        boolean verbose
) {

    public Config {
        transforms = List.copyOf(Objects.requireNonNull(transforms, "transforms"));
        configure = List.copyOf(Objects.requireNonNull(configure, "configure"));
        Objects.requireNonNull(formatting, "formatting");
        Objects.requireNonNull(logFormat, "logFormat");
    }
}
