package ai.proofmine.heuristic.cli;

import ai.proofmine.heuristic.config.Config;
import ai.proofmine.heuristic.config.ConfigLoader;
import ai.proofmine.heuristic.config.SystemEnvironmentReader;
import ai.proofmine.heuristic.logging.LoggingConfigurator;
import ai.proofmine.heuristic.logging.SimpleJsonLayout;
import ai.proofmine.heuristic.parser.HeuristicParser;
import ai.proofmine.heuristic.parser.ParsedDocument;
import ai.proofmine.heuristic.report.JsonStatisticsWriter;
import ai.proofmine.heuristic.report.StatisticsReportWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and heuristic parser.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_IO_ERROR = 1;

    private final ConfigLoader configLoader;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()));
    }

    CliApplication(ConfigLoader configLoader) {
        this.configLoader = configLoader;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        return run(args, new PrintWriter(System.out, true), new PrintWriter(System.err, true));
    }

    int run(String[] args, PrintWriter out, PrintWriter err) {
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

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Parsing {} file(s) (glom={}, format={})", config.files().size(), config.glom(), config.format());

        HeuristicParser parser = HeuristicParser.withExtraTactics(config.extraTactics());
        int exitCode = 0;
        for (Path file : config.files()) {
            MDC.put(SimpleJsonLayout.DOCUMENT_KEY, file.toString());
            try {
                ParsedDocument document = parser.parse(file.toString(), read(file, config), config.glom());
                render(document, config, out);
            } catch (UncheckedIOException ex) {
                LOGGER.error("Failed to read {}", file, ex.getCause());
                err.println("Cannot read " + file + ": " + ex.getCause().getMessage());
                exitCode = EXIT_IO_ERROR;
            } finally {
                MDC.remove(SimpleJsonLayout.DOCUMENT_KEY);
            }
        }
        return exitCode;
    }

    private String read(Path file, Config config) {
        try {
            return Files.readString(file, config.encoding());
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    private void render(ParsedDocument document, Config config, PrintWriter out) {
        switch (config.format()) {
            case TEXT -> new StatisticsReportWriter().write(document, out);
            case JSON -> new JsonStatisticsWriter().write(document, out);
            case SENTENCES -> {
                document.sentences().forEach(out::println);
                out.flush();
            }
        }
    }
}
