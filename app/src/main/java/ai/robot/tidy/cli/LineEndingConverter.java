package ai.robot.tidy.cli;

import ai.robot.tidy.config.LineEnding;
import picocli.CommandLine;

/**
 * Parses line separator CLI options.
 */
public class LineEndingConverter implements CommandLine.ITypeConverter<LineEnding> {
    @Override
    public LineEnding convert(String value) {
        return LineEnding.from(value);
    }
}
