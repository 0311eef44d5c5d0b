package ai.proofmine.heuristic.classify;

/**
 * Maps a single sentence to its structural facets without looking at any other sentence.
 */
public interface SentenceClassifier {

    Classification classify(String sentence);

    /**
     * Returns whether {@code sentence} closes proof mode. Fail-wrapped enders never do.
     */
    default boolean isProofEnder(String sentence) {
        Classification classification = classify(sentence);
        return classification.has(Facet.PROOF_ENDER) && !classification.has(Facet.FAIL);
    }
}
