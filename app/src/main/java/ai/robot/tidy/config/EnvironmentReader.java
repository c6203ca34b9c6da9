package ai.robot.tidy.config;

import java.util.Optional;

@FunctionalInterface
public interface EnvironmentReader {
    Optional<String> get(String key);
}
