package ai.proofmine.heuristic.sentence;

import java.util.List;

/**
 * Splits raw proof-script source into comment-free, normalized sentences.
 */
public interface SentenceSplitter {

    SplitResult split(String source);

    default List<String> splitSentences(String source) {
        return split(source).texts();
    }
}
