package ai.proofmine.heuristic.sentence;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Sentences and comments extracted from one source document.
 */
public record SplitResult(List<Sentence> sentences, List<Comment> comments) {

    public SplitResult {
        sentences = List.copyOf(Objects.requireNonNull(sentences, "sentences"));
        comments = List.copyOf(Objects.requireNonNull(comments, "comments"));
    }

    public static SplitResult empty() {
        return new SplitResult(List.of(), List.of());
    }

    public List<String> texts() {
        return sentences.stream()
                .map(Sentence::text)
                .collect(Collectors.toUnmodifiableList());
    }

    public boolean isEmpty() {
        return sentences.isEmpty();
    }
}
