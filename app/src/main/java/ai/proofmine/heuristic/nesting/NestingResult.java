package ai.proofmine.heuristic.nesting;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of folding one document: its statistics and the discharged sentence stream.
 */
public record NestingResult(SentenceStatistics statistics, List<String> discharged) {

    public NestingResult {
        Objects.requireNonNull(statistics, "statistics");
        discharged = List.copyOf(discharged);
    }
}
