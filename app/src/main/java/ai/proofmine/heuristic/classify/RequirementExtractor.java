package ai.proofmine.heuristic.classify;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the logical library names loaded by {@code Require} and {@code From ... Require} commands.
 *
 * <p>A {@code From} directory path is prepended to every loaded name, so {@code From Coq Require Import List.}
 * yields {@code Coq.List}.
 */
public final class RequirementExtractor {

    private static final Pattern FROM = Pattern.compile("From\\s+(\\S+)\\s+(Require\\b.*)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private RequirementExtractor() {
    }

    public static Set<String> extract(String command) {
        if (command == null || command.isBlank()) {
            return Set.of();
        }
        String text = command.strip();
        if (text.endsWith(".")) {
            text = text.substring(0, text.length() - 1);
        }
        String dirpath = "";
        if (Vocabulary.startsWithKeyword(text, "From")) {
            Matcher matcher = FROM.matcher(text);
            if (!matcher.matches()) {
                return Set.of();
            }
            dirpath = matcher.group(1);
            text = matcher.group(2);
        }
        if (!Vocabulary.startsWithKeyword(text, "Require")) {
            return Set.of();
        }
        text = text.substring("Require".length()).strip();
        for (String modifier : new String[] {"Import", "Export"}) {
            if (Vocabulary.startsWithKeyword(text, modifier)) {
                text = text.substring(modifier.length()).strip();
            }
        }
        Set<String> requirements = new LinkedHashSet<>();
        for (String token : WHITESPACE.split(text)) {
            // import categories such as -(notations) are not library names
            if (token.isEmpty() || token.startsWith("(") || token.startsWith("-(")) {
                continue;
            }
            requirements.add(dirpath.isEmpty() ? token : dirpath + "." + token);
        }
        return Collections.unmodifiableSet(requirements);
    }
}
