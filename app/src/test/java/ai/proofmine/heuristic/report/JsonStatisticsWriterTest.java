package ai.proofmine.heuristic.report;

import static org.assertj.core.api.Assertions.assertThat;

import ai.proofmine.heuristic.parser.HeuristicParser;
import ai.proofmine.heuristic.parser.ParsedDocument;
import org.junit.jupiter.api.Test;

class JsonStatisticsWriterTest {

    private final HeuristicParser parser = new HeuristicParser();
    private final JsonStatisticsWriter writer = new JsonStatisticsWriter();

    @Test
    void writesStatisticsAsJsonObject() {
        ParsedDocument document = parser.parse("t.v", "Theorem t : True.\nProof.\n  trivial.\nQed.\n", true);

        String json = writer.toJson(document);

        assertThat(json).startsWith("{\"document\":\"t.v\"").endsWith("}");
        assertThat(json).contains("\"sentenceCount\":4");
        assertThat(json).contains("\"depths\":[1,1,1,1]");
        assertThat(json).contains("\"theoremIndices\":[0]");
        assertThat(json).contains("\"enderIndices\":[3]");
        assertThat(json).contains("\"proofIndices\":[0,1,2,3]");
        assertThat(json).contains("\"nestingAllowed\":[false,false,false,false]");
        assertThat(json).contains("\"warnings\":[]");
        assertThat(json).contains("\"partial\":false");
    }

    @Test
    void escapesStringsAndSerializesWarnings() {
        ParsedDocument document = parser.parse("dir\\\"quoted\".v", "Qed.\n", true);

        String json = writer.toJson(document);

        assertThat(json).contains("\"document\":\"dir\\\\\\\"quoted\\\".v\"");
        assertThat(json).contains("{\"kind\":\"MALFORMED_PROOF\",\"index\":0,\"message\":\"Proof ender 'Qed.'");
        assertThat(json).contains("\"partial\":true");
    }
}
