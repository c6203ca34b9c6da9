package ai.robot.tidy.transform;

import java.util.Collection;

/**
 * Raised while building a pipeline from rule names and parameter strings. Always fatal for the run.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ConfigurationException unknownRule(String name, Collection<String> known) {
        return new ConfigurationException("Unknown rule '" + name + "'. Available rules: " + String.join(", ", known));
    }

    public static ConfigurationException unknownParameter(String rule, String parameter, Collection<String> accepted) {
        return new ConfigurationException("Rule " + rule + " has no parameter '" + parameter
                + "'. Accepted parameters: " + String.join(", ", accepted));
    }

    public static ConfigurationException invalidValue(String rule, String parameter, String value, String expected) {
        return new ConfigurationException("Invalid value '" + value + "' for parameter '" + parameter
                + "' of rule " + rule + ". Expected " + expected);
    }

    public static ConfigurationException invalidValue(String rule, String parameter, String value,
                                                      Collection<String> accepted) {
        return invalidValue(rule, parameter, value, "one of: " + String.join(", ", accepted));
    }

    public static ConfigurationException malformed(String entry, String reason) {
        return new ConfigurationException("Malformed rule entry '" + entry + "': " + reason);
    }
}
