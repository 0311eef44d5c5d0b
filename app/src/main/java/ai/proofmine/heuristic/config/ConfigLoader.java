package ai.proofmine.heuristic.config;

import ai.proofmine.heuristic.cli.CliArguments;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_GLOM = "PROOFMINE_GLOM";
    static final String ENV_FORMAT = "PROOFMINE_FORMAT";
    static final String ENV_ENCODING = "PROOFMINE_ENCODING";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_EXTRA_TACTICS = "PROOFMINE_EXTRA_TACTICS";

    private static final Charset DEFAULT_ENCODING = StandardCharsets.UTF_8;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        boolean glom = resolveGlom(arguments);
        OutputFormat format = resolveFormat(arguments);
        Charset encoding = resolveEncoding(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);
        List<String> extraTactics = resolveExtraTactics(arguments);
        return new Config(arguments.files(), glom, format, encoding, logFormat, extraTactics);
    }

    private boolean resolveGlom(CliArguments arguments) {
        Boolean cliGlom = arguments.glom();
        if (cliGlom != null) {
            return cliGlom;
        }
        return environmentReader.get(ENV_GLOM)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(ConfigLoader::parseBoolean)
                .orElse(true);
    }

    private OutputFormat resolveFormat(CliArguments arguments) {
        OutputFormat cliFormat = arguments.format();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(OutputFormat::from)
                .orElse(OutputFormat.TEXT);
    }

    private Charset resolveEncoding(CliArguments arguments) {
        String name = isNotBlank(arguments.encoding())
                ? arguments.encoding()
                : environmentReader.get(ENV_ENCODING).filter(ConfigLoader::isNotBlank).orElse(null);
        if (name == null) {
            return DEFAULT_ENCODING;
        }
        try {
            return Charset.forName(name.trim());
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported encoding: " + name, ex);
        }
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

    private List<String> resolveExtraTactics(CliArguments arguments) {
        List<String> cliTactics = arguments.extraTactics();
        if (cliTactics != null && !cliTactics.isEmpty()) {
            return cliTactics;
        }
        return environmentReader.get(ENV_EXTRA_TACTICS)
                .filter(ConfigLoader::isNotBlank)
                .map(ConfigLoader::parseList)
                .orElse(List.of());
    }

    private static boolean parseBoolean(String raw) {
        if (raw.equalsIgnoreCase("true") || raw.equals("1")) {
            return true;
        }
        if (raw.equalsIgnoreCase("false") || raw.equals("0")) {
            return false;
        }
        throw new IllegalArgumentException(ENV_GLOM + " must be true, false, 1 or 0");
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static List<String> parseList(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .collect(Collectors.toList());
    }
}
