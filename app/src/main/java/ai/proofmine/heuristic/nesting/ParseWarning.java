package ai.proofmine.heuristic.nesting;

import java.util.Objects;

/**
 * Advisory, non-fatal problem found while folding a document.
 *
 * @param kind what went wrong
 * @param sentenceIndex index of the offending sentence, or the sentence count for end-of-document problems
 * @param message human readable description
 */
public record ParseWarning(Kind kind, int sentenceIndex, String message) {

    public enum Kind {
        MALFORMED_PROOF,
        UNTERMINATED_PROOF,
        UNKNOWN_COMMAND
    }

    public ParseWarning {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        if (sentenceIndex < 0) {
            throw new IllegalArgumentException("sentenceIndex must not be negative");
        }
    }
}
