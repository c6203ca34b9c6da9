package ai.robot.tidy.config;

import ai.robot.tidy.cli.CliArguments;
import ai.robot.tidy.transform.RuleSpec;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 * Command line values win; {@code ROBOTIDY_CONFIGURE} entries are applied before the command line ones.
 */
public class ConfigLoader {

    static final String ENV_SPACECOUNT = "ROBOTIDY_SPACECOUNT";
    static final String ENV_LINE_SEPARATOR = "ROBOTIDY_LINE_SEPARATOR";
    static final String ENV_LOG_FORMAT = "ROBOTIDY_LOG_FORMAT";
    static final String ENV_CONFIGURE = "ROBOTIDY_CONFIGURE";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        int spaceCount = resolveSpaceCount(arguments);
        LineEnding lineEnding = resolveLineEnding(arguments);
        Optional<SelectionWindow> selection = SelectionWindow.from(arguments.startLine(), arguments.endLine());
        FormattingContext formatting = new FormattingContext(spaceCount, lineEnding, selection);

        List<RuleSpec> configure = new ArrayList<>();
        environmentReader.get(ENV_CONFIGURE)
                .filter(ConfigLoader::isNotBlank)
                .map(ConfigLoader::parseConfigureEntries)
                .ifPresent(configure::addAll);
        configure.addAll(arguments.configure());

        return new Config(arguments.transforms(), configure, formatting, resolveLogFormat(arguments),
                arguments.verbose());
    }

    private int resolveSpaceCount(CliArguments arguments) {
        Integer cliValue = arguments.spaceCount();
        int spaceCount = cliValue != null
                ? cliValue
                : environmentReader.get(ENV_SPACECOUNT)
                        .filter(ConfigLoader::isNotBlank)
                        .map(String::trim)
                        .map(ConfigLoader::parseInteger)
                        .orElse(FormattingContext.DEFAULT_SPACE_COUNT);
        if (spaceCount < 1) {
            throw new IllegalArgumentException("--spacecount must be at least 1");
        }
        return spaceCount;
    }

    private LineEnding resolveLineEnding(CliArguments arguments) {
        LineEnding cliValue = arguments.lineEnding();
        if (cliValue != null) {
            return cliValue;
        }
        return environmentReader.get(ENV_LINE_SEPARATOR)
                .filter(ConfigLoader::isNotBlank)
                .map(LineEnding::from)
                .orElse(LineEnding.NATIVE);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private static List<RuleSpec> parseConfigureEntries(String raw) {
        return Arrays.stream(raw.split(";"))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .map(RuleSpec::parse)
                .collect(Collectors.toList());
    }

    private static int parseInteger(String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_SPACECOUNT + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
