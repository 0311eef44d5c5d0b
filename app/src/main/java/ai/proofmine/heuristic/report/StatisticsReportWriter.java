package ai.proofmine.heuristic.report;

import ai.proofmine.heuristic.nesting.ParseWarning;
import ai.proofmine.heuristic.nesting.SentenceStatistics;
import ai.proofmine.heuristic.parser.ParsedDocument;
import ai.proofmine.heuristic.sentence.Sentence;
import java.io.PrintWriter;
import java.util.List;
import java.util.Objects;

/**
 * Renders a parsed document as a per-sentence table followed by a summary.
 */
public class StatisticsReportWriter {

    private static final int MAX_SENTENCE_WIDTH = 72;

    public void write(ParsedDocument document, PrintWriter out) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(out, "out");
        SentenceStatistics statistics = document.statistics();
        List<Sentence> sentences = document.split().sentences();

        out.printf("== %s%n", document.documentId());
        out.printf("%5s %5s %5s %-22s %s%n", "index", "line", "depth", "roles", "sentence");
        for (int i = 0; i < sentences.size(); i++) {
            String roles = String.join(",", statistics.rolesOf(i));
            if (statistics.nestingAllowed().get(i)) {
                roles = roles.isEmpty() ? "nest" : roles + ",nest";
            }
            out.printf("%5d %5d %5d %-22s %s%n", i, sentences.get(i).lineNumber(), statistics.depths().get(i),
                    roles.isEmpty() ? "-" : roles, abbreviate(sentences.get(i).text()));
        }
        out.printf("sentences=%d comments=%d theorems=%d proofs-closed=%d programs=%d obligations=%d"
                        + " queries=%d fails=%d%n",
                sentences.size(), document.split().comments().size(), statistics.theoremIndices().size(),
                statistics.enderIndices().size(), statistics.programIndices().size(),
                statistics.obligationIndices().size(), statistics.queryIndices().size(),
                statistics.failIndices().size());
        if (!statistics.customTactics().isEmpty()) {
            out.printf("custom tactics: %s%n", String.join(", ", statistics.customTactics()));
        }
        if (!statistics.requirements().isEmpty()) {
            out.printf("requirements: %s%n", String.join(", ", statistics.requirements()));
        }
        for (ParseWarning warning : statistics.warnings()) {
            out.printf("warning [%s] at %d: %s%n", warning.kind(), warning.sentenceIndex(), warning.message());
        }
        if (statistics.partial()) {
            out.println("statistics are partial");
        }
        out.flush();
    }

    static String abbreviate(String text) {
        if (text.length() <= MAX_SENTENCE_WIDTH) {
            return text;
        }
        return text.substring(0, MAX_SENTENCE_WIDTH - 3) + "...";
    }
}
