package ai.robot.tidy.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.robot.tidy.cli.CliArguments;
import ai.robot.tidy.transform.RuleSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--transform", "NormalizeNewLines:section_lines=2",
                "--transform", "DiscardEmptySections",
                "--configure", "AlignVariablesSection:up_to_column=3",
                "--spacecount", "2",
                "--lineseparator", "windows",
                "--startline", "3",
                "--endline", "9",
                "--log-format", "json",
                "--verbose");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.transforms()).extracting(RuleSpec::ruleName)
                .containsExactly("NormalizeNewLines", "DiscardEmptySections");
        assertThat(config.transforms().get(0).parameters()).containsEntry("section_lines", "2");
        assertThat(config.configure()).extracting(RuleSpec::toString)
                .containsExactly("AlignVariablesSection:up_to_column=3");
        assertThat(config.formatting().spaceCount()).isEqualTo(2);
        assertThat(config.formatting().separator()).isEqualTo("  ");
        assertThat(config.formatting().eol()).isEqualTo("\r\n");
        assertThat(config.formatting().selection()).contains(SelectionWindow.of(3, 9));
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.verbose()).isTrue();
    }

    @Test
    void usesDefaultsWhenNothingIsSet() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.transforms()).isEmpty();
        assertThat(config.configure()).isEmpty();
        assertThat(config.formatting().spaceCount()).isEqualTo(4);
        assertThat(config.formatting().lineEnding()).isEqualTo(LineEnding.NATIVE);
        assertThat(config.formatting().selection()).isEmpty();
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.verbose()).isFalse();
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_SPACECOUNT, " 8 ",
                ConfigLoader.ENV_LINE_SEPARATOR, "unix",
                ConfigLoader.ENV_LOG_FORMAT, "json"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.formatting().spaceCount()).isEqualTo(8);
        assertThat(config.formatting().lineEnding()).isEqualTo(LineEnding.UNIX);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(environmentReader.requestedKeys()).contains(ConfigLoader.ENV_SPACECOUNT, ConfigLoader.ENV_CONFIGURE);
    }

    @Test
    void cliValuesWinOverEnvironment() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_SPACECOUNT, "8",
                ConfigLoader.ENV_LOG_FORMAT, "json"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--spacecount", "3", "--log-format", "text");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.formatting().spaceCount()).isEqualTo(3);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
    }

    @Test
    void environmentConfigureEntriesComeBeforeCliEntries() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_CONFIGURE, "NormalizeNewLines:section_lines=2 ; ;AssignmentNormalizer:equal_sign_type=remove"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--configure", "NormalizeNewLines:section_lines=3");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.configure()).extracting(RuleSpec::toString).containsExactly(
                "NormalizeNewLines:section_lines=2",
                "AssignmentNormalizer:equal_sign_type=remove",
                "NormalizeNewLines:section_lines=3");
    }

    @Test
    void rejectsSpaceCountBelowOne() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--spacecount", "0");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--spacecount");
    }

    @Test
    void rejectsNonNumericSpaceCountFromEnvironment() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_SPACECOUNT, "four"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Throwable thrown = catchThrowable(() -> new ConfigLoader(environmentReader).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_SPACECOUNT);
    }

    @Test
    void rejectsInvertedSelection() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--startline", "10", "--endline", "2");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class);
    }

    private static final class RecordingEnvironmentReader implements EnvironmentReader {

        private final Map<String, String> values;
        private final List<String> requestedKeys = new ArrayList<>();

        private RecordingEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            requestedKeys.add(key);
            return Optional.ofNullable(values.get(key));
        }

        List<String> requestedKeys() {
            return requestedKeys;
        }
    }
}
