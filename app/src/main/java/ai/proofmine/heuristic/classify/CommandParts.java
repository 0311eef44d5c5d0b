package ai.proofmine.heuristic.classify;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A sentence with its control prefixes and attributes stripped from the command they modify.
 *
 * @param sentence the sentence as written
 * @param command the sentence without controls and attributes
 * @param declaration {@code command} without a leading {@code Program}
 * @param program whether a {@code Program} keyword or attribute was present
 * @param failed whether a {@code Fail} control wraps the command
 */
record CommandParts(
        String sentence,
        String command,
        String declaration,
        boolean program,
        boolean failed
) {

    private static final String PROGRAM = "Program";
    private static final Pattern HASH_ATTRIBUTE = Pattern.compile("#\\[[^\\]]*\\]\\s*");
    private static final Pattern PROGRAM_ATTRIBUTE = Pattern.compile("\\bprogram\\b");
    private static final Pattern REDIRECT = Pattern.compile("Redirect\\s+\"[^\"]*\"\\s*");
    private static final Pattern TIMEOUT = Pattern.compile("Timeout\\s+\\d+\\s*");

    CommandParts {
        Objects.requireNonNull(sentence, "sentence");
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(declaration, "declaration");
    }

    static CommandParts parse(String sentence) {
        String rest = sentence.strip();
        boolean program = false;
        boolean failed = false;
        while (true) {
            Matcher hash = HASH_ATTRIBUTE.matcher(rest);
            if (hash.lookingAt() && hash.end() < rest.length()) {
                program |= PROGRAM_ATTRIBUTE.matcher(hash.group()).find();
                rest = rest.substring(hash.end());
                continue;
            }
            String current = rest;
            Optional<String> prefixed = matchPrefix(REDIRECT, current).or(() -> matchPrefix(TIMEOUT, current));
            if (prefixed.isPresent()) {
                rest = rest.substring(prefixed.get().length());
                continue;
            }
            String word = Vocabulary.leadingWord(rest);
            String remainder = rest.substring(word.length()).stripLeading();
            if (remainder.isEmpty() || remainder.equals(".")) {
                break;
            }
            if (word.equals("Time") || word.equals("Fail") || word.equals("Succeed")) {
                failed |= word.equals("Fail");
                rest = remainder;
                continue;
            }
            if (Vocabulary.ATTRIBUTE_KEYWORDS.contains(word)) {
                rest = remainder;
                continue;
            }
            break;
        }
        String declaration = rest;
        if (Vocabulary.startsWithKeyword(rest, PROGRAM)) {
            program = true;
            declaration = rest.substring(PROGRAM.length()).stripLeading();
        }
        return new CommandParts(sentence, rest, declaration, program, failed);
    }

    Optional<String> leadingIdentifier() {
        String word = Vocabulary.leadingWord(command);
        if (word.isEmpty() || Character.isDigit(word.charAt(0)) || word.charAt(0) == '\'') {
            return Optional.empty();
        }
        return Optional.of(word);
    }

    private static Optional<String> matchPrefix(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (matcher.lookingAt() && matcher.end() < text.length()) {
            return Optional.of(matcher.group());
        }
        return Optional.empty();
    }
}
