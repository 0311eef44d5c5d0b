package ai.proofmine.heuristic.config;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        List<Path> files,
        boolean glom,
        OutputFormat format,
        Charset encoding,
        LogFormat logFormat,
        List<String> extraTactics
) {

    public Config {
        files = List.copyOf(Objects.requireNonNull(files, "files"));
        if (files.isEmpty()) {
            throw new IllegalArgumentException("At least one source file must be given");
        }
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(encoding, "encoding");
        Objects.requireNonNull(logFormat, "logFormat");
        extraTactics = extraTactics == null
                ? List.of()
                : extraTactics.stream()
                .map(String::trim)
                .filter(value -> !value.isBlank())
                .distinct()
                .collect(Collectors.toUnmodifiableList());
        for (String tactic : extraTactics) {
            if (tactic.chars().anyMatch(Character::isWhitespace)) {
                throw new IllegalArgumentException("Extra tactic names must not contain whitespace: " + tactic);
            }
        }
    }
}
