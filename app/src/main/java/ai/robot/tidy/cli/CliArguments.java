package ai.robot.tidy.cli;

import ai.robot.tidy.config.LineEnding;
import ai.robot.tidy.config.LogFormat;
import ai.robot.tidy.transform.RuleSpec;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "robot-tidy", mixinStandardHelpOptions = true, version = "robot-tidy 0.1.0",
        description = "Rule pipeline that normalizes the layout of Robot Framework data")
public class CliArguments {

    @CommandLine.Option(names = "--transform", converter = RuleSpecConverter.class, paramLabel = "NAME[:PARAM=VALUE]...",
            description = "Run only the given rule; repeat to select several, in order")
    private List<RuleSpec> transforms = new ArrayList<>();

    @CommandLine.Option(names = "--configure", converter = RuleSpecConverter.class, paramLabel = "NAME:PARAM=VALUE...",
            description = "Parameters for a rule wherever it runs")
    private List<RuleSpec> configure = new ArrayList<>();

    @CommandLine.Option(names = "--spacecount", paramLabel = "COUNT", description = "Width of the default separator (default: 4)")
    private Integer spaceCount;

    @CommandLine.Option(names = "--lineseparator", converter = LineEndingConverter.class,
            description = "Line ending of generated lines: native, unix or windows")
    private LineEnding lineEnding;

    @CommandLine.Option(names = "--startline", paramLabel = "LINE", description = "First line that may be changed")
    private Integer startLine;

    @CommandLine.Option(names = "--endline", paramLabel = "LINE", description = "Last line that may be changed")
    private Integer endLine;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--verbose", description = "Log rule progress")
    private boolean verbose;

    @CommandLine.Option(names = "--list", description = "List available rules")
    private boolean list;

    @CommandLine.Option(names = "--desc", paramLabel = "NAME", description = "Describe a rule and its parameters")
    private String describe;

    public List<RuleSpec> transforms() {
        return transforms == null ? List.of() : transforms;
    }

    public List<RuleSpec> configure() {
        return configure == null ? List.of() : configure;
    }

    public Integer spaceCount() {
        return spaceCount;
    }

    public LineEnding lineEnding() {
        return lineEnding;
    }

    public Integer startLine() {
        return startLine;
    }

    public Integer endLine() {
        return endLine;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }

    public boolean list() {
        return list;
    }

    public String describe() {
        return describe;
    }
}
