package ai.proofmine.heuristic.sentence;

import java.util.Objects;

/**
 * A single normalized sentence together with its location in the original source.
 */
public record Sentence(String text, int beginOffset, int endOffset, int lineNumber) {

    public Sentence {
        Objects.requireNonNull(text, "text");
        if (beginOffset < 0 || endOffset < beginOffset) {
            throw new IllegalArgumentException("Invalid sentence boundaries");
        }
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be positive");
        }
    }

    @Override
    public String toString() {
        return text;
    }
}
