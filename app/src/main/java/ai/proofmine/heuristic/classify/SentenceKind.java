package ai.proofmine.heuristic.classify;

import java.util.List;
import java.util.Set;

/**
 * The single variant the nesting engine dispatches on, chosen from a sentence's facets by fixed precedence.
 */
public enum SentenceKind {
    BULLET_OR_BRACE(Facet.BULLET_OR_BRACE),
    FAIL(Facet.FAIL),
    PROGRAM_STARTER(Facet.PROGRAM_STARTER),
    THEOREM_STARTER(Facet.THEOREM_STARTER),
    PROOF_STARTER(Facet.PROOF_STARTER),
    PROOF_ENDER(Facet.PROOF_ENDER),
    TACTIC(Facet.TACTIC),
    QUERY(Facet.QUERY),
    OTHER(null);

    private static final List<SentenceKind> PRECEDENCE = List.of(values());

    private final Facet facet;

    SentenceKind(Facet facet) {
        this.facet = facet;
    }

    public static SentenceKind of(Set<Facet> facets) {
        for (SentenceKind kind : PRECEDENCE) {
            if (kind.facet != null && facets.contains(kind.facet)) {
                return kind;
            }
        }
        return OTHER;
    }
}
