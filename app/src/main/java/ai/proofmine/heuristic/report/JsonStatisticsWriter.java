package ai.proofmine.heuristic.report;

import static ai.proofmine.heuristic.logging.JsonText.quote;

import ai.proofmine.heuristic.nesting.ParseWarning;
import ai.proofmine.heuristic.nesting.SentenceStatistics;
import ai.proofmine.heuristic.parser.ParsedDocument;
import java.io.PrintWriter;
import java.util.Collection;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Writes a parsed document's statistics as a single-line JSON object.
 */
public class JsonStatisticsWriter {

    public void write(ParsedDocument document, PrintWriter out) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(out, "out");
        out.println(toJson(document));
        out.flush();
    }

    public String toJson(ParsedDocument document) {
        SentenceStatistics statistics = document.statistics();
        StringBuilder builder = new StringBuilder(512);
        builder.append('{');
        builder.append(quote("document")).append(':').append(quote(document.documentId()));
        field(builder, "sentenceCount", String.valueOf(statistics.sentenceCount()));
        field(builder, "depths", numbers(statistics.depths()));
        field(builder, "theoremIndices", numbers(statistics.theoremIndices()));
        field(builder, "starterIndices", numbers(statistics.starterIndices()));
        field(builder, "tacticIndices", numbers(statistics.tacticIndices()));
        field(builder, "enderIndices", numbers(statistics.enderIndices()));
        field(builder, "programIndices", numbers(statistics.programIndices()));
        field(builder, "obligationIndices", numbers(statistics.obligationIndices()));
        field(builder, "queryIndices", numbers(statistics.queryIndices()));
        field(builder, "failIndices", numbers(statistics.failIndices()));
        field(builder, "proofIndices", numbers(statistics.proofIndices()));
        field(builder, "nestingAllowed", array(statistics.nestingAllowed().stream().map(String::valueOf)
                .collect(Collectors.toList())));
        field(builder, "customTactics", strings(statistics.customTactics()));
        field(builder, "requirements", strings(statistics.requirements()));
        field(builder, "warnings", array(statistics.warnings().stream()
                .map(JsonStatisticsWriter::warning)
                .collect(Collectors.toList())));
        field(builder, "partial", String.valueOf(statistics.partial()));
        builder.append('}');
        return builder.toString();
    }

    private static void field(StringBuilder builder, String name, String rawValue) {
        builder.append(',').append(quote(name)).append(':').append(rawValue);
    }

    private static String warning(ParseWarning warning) {
        return "{" + quote("kind") + ':' + quote(warning.kind().name())
                + ',' + quote("index") + ':' + warning.sentenceIndex()
                + ',' + quote("message") + ':' + quote(warning.message()) + '}';
    }

    private static String numbers(Collection<Integer> values) {
        return array(values.stream().map(String::valueOf).collect(Collectors.toList()));
    }

    private static String strings(Collection<String> values) {
        return array(values.stream().map(value -> quote(value)).collect(Collectors.toList()));
    }

    private static String array(Collection<String> rawValues) {
        return rawValues.stream().collect(Collectors.joining(",", "[", "]"));
    }
}
