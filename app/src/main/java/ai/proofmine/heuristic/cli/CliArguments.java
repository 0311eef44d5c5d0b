package ai.proofmine.heuristic.cli;

import ai.proofmine.heuristic.config.LogFormat;
import ai.proofmine.heuristic.config.OutputFormat;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "proofmine-heuristic", mixinStandardHelpOptions = true, version = "proofmine-heuristic 0.1.0",
        description = "Splits Coq sources into sentences and reports their proof structure")
public class CliArguments {

    @CommandLine.Parameters(paramLabel = "FILE", arity = "1..*", description = "Coq source files to parse")
    private List<Path> files = new ArrayList<>();

    @CommandLine.Option(names = "--glom", negatable = true,
            description = "Join each proof into a single sentence (default: true)")
    private Boolean glom;

    @CommandLine.Option(names = "--format", converter = OutputFormatConverter.class,
            description = "Output format: text, json or sentences", paramLabel = "FORMAT")
    private OutputFormat format;

    @CommandLine.Option(names = "--encoding", description = "Source file encoding (default: UTF-8)",
            paramLabel = "CHARSET")
    private String encoding;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json",
            converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--extra-tactics", split = ",", paramLabel = "NAME",
            description = "Additional tactic names treated as built in")
    private List<String> extraTactics;

    public List<Path> files() {
        return files;
    }

    public Boolean glom() {
        return glom;
    }

    public OutputFormat format() {
        return format;
    }

    public String encoding() {
        return encoding;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public List<String> extraTactics() {
        return extraTactics;
    }
}
