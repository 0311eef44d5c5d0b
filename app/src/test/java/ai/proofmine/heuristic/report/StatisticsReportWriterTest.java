package ai.proofmine.heuristic.report;

import static org.assertj.core.api.Assertions.assertThat;

import ai.proofmine.heuristic.parser.HeuristicParser;
import ai.proofmine.heuristic.parser.ParsedDocument;
import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.Test;

class StatisticsReportWriterTest {

    private final HeuristicParser parser = new HeuristicParser();

    private String render(ParsedDocument document) {
        StringWriter buffer = new StringWriter();
        new StatisticsReportWriter().write(document, new PrintWriter(buffer));
        return buffer.toString();
    }

    @Test
    void rendersOneRowPerSentenceAndSummary() {
        ParsedDocument document = parser.parse("t.v", "Theorem t : True.\nProof.\n  trivial.\nQed.\n", true);

        String report = render(document);

        assertThat(report).startsWith("== t.v");
        assertThat(report.lines().filter(line -> line.matches("\\s+\\d+ .*"))).hasSize(4);
        assertThat(report).contains("theorem").contains("starter").contains("tactic").contains("ender");
        assertThat(report).contains("sentences=4 comments=0 theorems=1 proofs-closed=1");
        assertThat(report).doesNotContain("warning").doesNotContain("partial");
    }

    @Test
    void listsWarningsAndPartialFlag() {
        ParsedDocument document = parser.parse("bad.v", "Qed.\nFrobnicate.\nmytac.\n", true);

        String report = render(document);

        assertThat(report).contains("warning [MALFORMED_PROOF] at 0");
        assertThat(report).contains("warning [UNKNOWN_COMMAND] at 1");
        assertThat(report).contains("custom tactics: mytac");
        assertThat(report).contains("statistics are partial");
    }

    @Test
    void abbreviatesLongSentences() {
        String sentence = "Definition x : nat := " + "1 + ".repeat(40) + "1.";

        assertThat(StatisticsReportWriter.abbreviate(sentence)).hasSize(72).endsWith("...");
        assertThat(StatisticsReportWriter.abbreviate("Check x.")).isEqualTo("Check x.");
    }
}
