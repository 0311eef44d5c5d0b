package ai.proofmine.heuristic.parser;

import ai.proofmine.heuristic.classify.LexicalClassifier;
import ai.proofmine.heuristic.classify.Vocabulary;
import ai.proofmine.heuristic.nesting.NestingEngine;
import ai.proofmine.heuristic.nesting.NestingResult;
import ai.proofmine.heuristic.nesting.SentenceStatistics;
import ai.proofmine.heuristic.sentence.DefaultSentenceSplitter;
import ai.proofmine.heuristic.sentence.SentenceSplitter;
import ai.proofmine.heuristic.sentence.SplitResult;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fast, approximate parser for Coq sources that needs neither a Coq installation nor compilation.
 *
 * <p>Sentence and proof boundaries are found by heuristics only. With glomming enabled nested proofs are
 * emitted before the proof enclosing them, so the output is not in source order in that case.
 */
public class HeuristicParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(HeuristicParser.class);

    private final SentenceSplitter splitter;
    private final NestingEngine engine;

    public HeuristicParser() {
        this(new DefaultSentenceSplitter(), new NestingEngine());
    }

    public HeuristicParser(SentenceSplitter splitter, NestingEngine engine) {
        this.splitter = Objects.requireNonNull(splitter, "splitter");
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /**
     * Creates a parser whose classifier also treats {@code extraTactics} as built-in tactics.
     */
    public static HeuristicParser withExtraTactics(Collection<String> extraTactics) {
        Vocabulary vocabulary = Vocabulary.standard().withExtraTactics(extraTactics);
        return new HeuristicParser(new DefaultSentenceSplitter(),
                new NestingEngine(new LexicalClassifier(vocabulary)));
    }

    public SplitResult split(String source) {
        return splitter.split(source);
    }

    public SentenceStatistics computeStatistics(List<String> sentences) {
        return engine.statistics(sentences);
    }

    public List<String> parseSentences(String source, boolean glomProofs) {
        return parse("<source>", source, glomProofs).sentences();
    }

    public ParsedDocument parse(String documentId, String source, boolean glomProofs) {
        SplitResult split = splitter.split(source);
        List<String> texts = split.texts();
        NestingResult result = engine.fold(texts, glomProofs, documentId);
        List<String> sentences = glomProofs ? result.discharged() : texts;
        LOGGER.debug("Parsed {}: {} sentences, {} comments, {} warnings", documentId, texts.size(),
                split.comments().size(), result.statistics().warnings().size());
        return new ParsedDocument(documentId, split, result.statistics(), sentences);
    }
}
