package ai.proofmine.heuristic.parser;

import ai.proofmine.heuristic.nesting.SentenceStatistics;
import ai.proofmine.heuristic.sentence.SplitResult;
import java.util.List;
import java.util.Objects;

/**
 * Everything the parser derives from one source document.
 *
 * @param documentId identifier used in log messages and reports
 * @param split the sentences and comments of the source
 * @param statistics structural statistics over {@code split}'s sentences
 * @param sentences the output stream, with proofs glommed when requested
 */
public record ParsedDocument(String documentId, SplitResult split, SentenceStatistics statistics,
        List<String> sentences) {

    public ParsedDocument {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(split, "split");
        Objects.requireNonNull(statistics, "statistics");
        sentences = List.copyOf(sentences);
    }
}
