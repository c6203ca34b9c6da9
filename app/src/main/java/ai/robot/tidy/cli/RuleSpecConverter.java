package ai.robot.tidy.cli;

import ai.robot.tidy.transform.ConfigurationException;
import ai.robot.tidy.transform.RuleSpec;
import picocli.CommandLine;

/**
 * Parses {@code Name:param=value} rule entries.
 */
public class RuleSpecConverter implements CommandLine.ITypeConverter<RuleSpec> {
    @Override
    public RuleSpec convert(String value) {
        try {
            return RuleSpec.parse(value);
        } catch (ConfigurationException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage());
        }
    }
}
