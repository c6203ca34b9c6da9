package ai.robot.tidy.cli;

import ai.robot.tidy.config.Config;
import ai.robot.tidy.config.ConfigLoader;
import ai.robot.tidy.config.SystemEnvironmentReader;
import ai.robot.tidy.logging.LoggingConfigurator;
import ai.robot.tidy.transform.ConfigurationException;
import ai.robot.tidy.transform.FormattingPipeline;
import ai.robot.tidy.transform.ParameterSpec;
import ai.robot.tidy.transform.RuleKind;
import ai.robot.tidy.transform.RuleRegistry;
import java.io.PrintWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and rule registry.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    static final int EXIT_OK = 0;
    static final int EXIT_CONFIGURATION_ERROR = 1;

    private final ConfigLoader configLoader;
    private final RuleRegistry registry;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new RuleRegistry(),
                new PrintWriter(System.out, true), new PrintWriter(System.err, true));
    }

    CliApplication(ConfigLoader configLoader, RuleRegistry registry, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.registry = registry;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        try {
            Config config = configLoader.load(cliArguments);
            LoggingConfigurator.configure(config.logFormat(), config.verbose());
            if (cliArguments.list()) {
                listRules();
                return EXIT_OK;
            }
            if (cliArguments.describe() != null) {
                describe(registry.lookup(cliArguments.describe()));
                return EXIT_OK;
            }
            FormattingPipeline pipeline = registry.createPipeline(config.transforms(), config.configure());
            LOGGER.info("Pipeline ready with {} rules: {} (spacecount={}, lineseparator={})",
                    pipeline.rules().size(), String.join(", ", pipeline.ruleNames()),
                    config.formatting().spaceCount(), config.formatting().lineEnding());
            config.formatting().selection().ifPresent(window -> LOGGER.info("Restricted to lines {}-{}",
                    window.startLine().map(String::valueOf).orElse(""),
                    window.endLine().map(String::valueOf).orElse("")));
            return EXIT_OK;
        } catch (ConfigurationException | IllegalArgumentException ex) {
            err.println(ex.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        } finally {
            out.flush();
            err.flush();
        }
    }

    private void listRules() {
        out.println("Rules in default order:");
        for (RuleKind kind : RuleKind.values()) {
            out.println("  " + kind.ruleName() + " - " + kind.description());
        }
    }

    private void describe(RuleKind kind) {
        out.println(kind.ruleName());
        out.println("  " + kind.description());
        out.println("Parameters:");
        out.println("  " + RuleKind.ENABLED + " (default: True)");
        for (ParameterSpec parameter : kind.parameters()) {
            String defaultValue = parameter.defaultValue().isEmpty() ? "none" : parameter.defaultValue();
            out.println("  " + parameter.name() + " (default: " + defaultValue + ") " + parameter.description());
        }
    }
}
