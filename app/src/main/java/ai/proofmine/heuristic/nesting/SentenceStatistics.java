package ai.proofmine.heuristic.nesting;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Per-document structural statistics, one entry per sentence for {@code depths} and {@code nestingAllowed}.
 *
 * <p>Index sets iterate in ascending order. {@code proofIndices} is the union of the theorem, starter, tactic,
 * ender, program and obligation indices.
 */
public record SentenceStatistics(
        List<Integer> depths,
        Set<Integer> theoremIndices,
        Set<Integer> starterIndices,
        Set<Integer> tacticIndices,
        List<Integer> enderIndices,
        Set<Integer> programIndices,
        Set<Integer> obligationIndices,
        Set<Integer> queryIndices,
        Set<Integer> failIndices,
        Set<Integer> proofIndices,
        List<Boolean> nestingAllowed,
        Set<String> customTactics,
        Set<String> requirements,
        List<ParseWarning> warnings,
        boolean partial
) {

    public SentenceStatistics {
        depths = List.copyOf(depths);
        theoremIndices = sorted(theoremIndices);
        starterIndices = sorted(starterIndices);
        tacticIndices = sorted(tacticIndices);
        enderIndices = List.copyOf(enderIndices);
        programIndices = sorted(programIndices);
        obligationIndices = sorted(obligationIndices);
        queryIndices = sorted(queryIndices);
        failIndices = sorted(failIndices);
        proofIndices = sorted(proofIndices);
        nestingAllowed = List.copyOf(nestingAllowed);
        customTactics = Collections.unmodifiableSet(new LinkedHashSet<>(customTactics));
        requirements = Collections.unmodifiableSet(new LinkedHashSet<>(requirements));
        warnings = List.copyOf(warnings);
        if (depths.size() != nestingAllowed.size()) {
            throw new IllegalArgumentException("depths and nestingAllowed must cover the same sentences");
        }
    }

    public int sentenceCount() {
        return depths.size();
    }

    /**
     * Short role labels of one sentence, for reports.
     */
    public List<String> rolesOf(int index) {
        List<String> roles = new ArrayList<>();
        addIf(roles, programIndices.contains(index), "program");
        addIf(roles, theoremIndices.contains(index), "theorem");
        addIf(roles, obligationIndices.contains(index), "obligation");
        addIf(roles, starterIndices.contains(index), "starter");
        addIf(roles, tacticIndices.contains(index), "tactic");
        addIf(roles, enderIndices.contains(index), "ender");
        addIf(roles, queryIndices.contains(index), "query");
        addIf(roles, failIndices.contains(index), "fail");
        return roles;
    }

    private static void addIf(List<String> roles, boolean condition, String role) {
        if (condition) {
            roles.add(role);
        }
    }

    private static Set<Integer> sorted(Collection<Integer> indices) {
        Objects.requireNonNull(indices, "indices");
        return Collections.unmodifiableSet(new TreeSet<>(indices));
    }
}
