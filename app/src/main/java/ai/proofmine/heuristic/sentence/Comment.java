package ai.proofmine.heuristic.sentence;

import java.util.Objects;

/**
 * An outermost comment removed from the source, delimiters included.
 */
public record Comment(String text, int beginOffset, int endOffset) {

    public Comment {
        Objects.requireNonNull(text, "text");
        if (beginOffset < 0 || endOffset < beginOffset) {
            throw new IllegalArgumentException("Invalid comment boundaries");
        }
    }

    /**
     * Returns whether the comment was closed before the end of the source.
     */
    public boolean terminated() {
        return text.endsWith("*)") && text.length() >= 4;
    }
}
