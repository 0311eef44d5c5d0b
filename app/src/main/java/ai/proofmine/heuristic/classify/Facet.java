package ai.proofmine.heuristic.classify;

/**
 * Structural facets a single sentence may carry. Several facets can hold for the same sentence.
 */
public enum Facet {
    BULLET_OR_BRACE,
    PROGRAM_STARTER,
    THEOREM_STARTER,
    OBLIGATION,
    PROOF_STARTER,
    PROOF_ENDER,
    TACTIC,
    CUSTOM_TACTIC,
    FAIL,
    TACTIC_DEFINITION,
    REQUIREMENT,
    NESTED_PROOFS_ON,
    NESTED_PROOFS_OFF,
    QUERY,
    UNKNOWN_COMMAND;

    /**
     * Facets that change or depend on the proof-mode nesting of a document.
     */
    public boolean isStructural() {
        return switch (this) {
            case BULLET_OR_BRACE, PROGRAM_STARTER, THEOREM_STARTER, OBLIGATION, PROOF_STARTER, PROOF_ENDER, TACTIC -> true;
            default -> false;
        };
    }
}
