package ai.proofmine.heuristic.classify;

import java.util.Objects;
import java.util.Set;

/**
 * One entry of the classifier's ordered rule table: the facet it grants and the test deciding it.
 *
 * <p>Rules run in table order and each test sees the facets granted by the rules before it.
 */
record ClassificationRule(Facet facet, Test test) {

    @FunctionalInterface
    interface Test {
        boolean matches(CommandParts parts, Set<Facet> matchedSoFar);
    }

    ClassificationRule {
        Objects.requireNonNull(facet, "facet");
        Objects.requireNonNull(test, "test");
    }

    boolean matches(CommandParts parts, Set<Facet> matchedSoFar) {
        return test.matches(parts, matchedSoFar);
    }
}
