package ai.proofmine.heuristic.assertion;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Open assertions, innermost last, plus the bullets and braces not yet attached to a proof.
 */
public final class NestingStack {

    private final List<Assertion> open = new ArrayList<>();
    private final List<String> pending = new ArrayList<>();

    public void push(Assertion assertion) {
        open.add(assertion);
    }

    public Assertion pop() {
        if (open.isEmpty()) {
            throw new IllegalStateException("No open assertion");
        }
        return open.remove(open.size() - 1);
    }

    public Optional<Assertion> top() {
        return open.isEmpty() ? Optional.empty() : Optional.of(open.get(open.size() - 1));
    }

    public boolean isEmpty() {
        return open.isEmpty();
    }

    public int size() {
        return open.size();
    }

    public List<Assertion> assertions() {
        return List.copyOf(open);
    }

    public void buffer(String bulletOrBrace) {
        pending.add(bulletOrBrace);
    }

    public boolean hasPending() {
        return !pending.isEmpty();
    }

    /**
     * Returns and clears the buffered bullets and braces.
     */
    public List<String> drainPending() {
        List<String> drained = List.copyOf(pending);
        pending.clear();
        return drained;
    }

    /**
     * Routes a finished assertion's output to the nearest open assertion that is not mid-proof, or to
     * {@code result} when every open assertion is mid-proof.
     */
    public boolean discharge(Assertion assertion, List<String> result, boolean glom, String documentId) {
        List<String> output = new ArrayList<>();
        boolean continueGlom = assertion.discharge(output, glom, documentId);
        Optional<Assertion> target = Optional.empty();
        for (int i = open.size() - 1; i >= 0; i--) {
            if (!open.get(i).inProof()) {
                target = Optional.of(open.get(i));
                break;
            }
        }
        if (target.isPresent()) {
            output.forEach(target.get()::appendLoose);
        } else {
            result.addAll(output);
        }
        return continueGlom;
    }

    /**
     * Discharges every open assertion, innermost first, then any leftover bullets and braces.
     */
    public boolean dischargeAll(List<String> result, boolean glom, String documentId) {
        boolean continueGlom = glom;
        while (!open.isEmpty()) {
            continueGlom = discharge(pop(), result, continueGlom, documentId);
        }
        result.addAll(drainPending());
        return continueGlom;
    }
}
