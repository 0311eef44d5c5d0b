package ai.proofmine.heuristic.assertion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A theorem, lemma, program or anonymous goal under construction together with its proofs.
 *
 * <p>Besides proofs the assertion keeps runs of loose sentences (queries, nested discharges) so that its output
 * can be emitted in source order. An ordinary assertion holds at most one proof; a program holds one per
 * obligation.
 */
public final class Assertion {

    private static final Logger LOGGER = LoggerFactory.getLogger(Assertion.class);

    private final String statement;
    private final boolean program;
    private final Predicate<String> enderRecognizer;
    private final List<Fragment> fragments = new ArrayList<>();
    private int openBraces;

    public Assertion(String statement, boolean program, Predicate<String> enderRecognizer) {
        this.statement = statement;
        this.program = program;
        this.enderRecognizer = Objects.requireNonNull(enderRecognizer, "enderRecognizer");
    }

    public Optional<String> statement() {
        return Optional.ofNullable(statement);
    }

    public boolean isProgram() {
        return program;
    }

    /**
     * A program without a statement, opened by an obligation that no program starter preceded.
     */
    public boolean isBareProgram() {
        return program && statement == null;
    }

    public List<List<String>> proofs() {
        List<List<String>> proofs = new ArrayList<>();
        for (Fragment fragment : fragments) {
            if (fragment.proof()) {
                proofs.add(List.copyOf(fragment.sentences()));
            }
        }
        return Collections.unmodifiableList(proofs);
    }

    public boolean hasProof() {
        return lastProof() != null;
    }

    /**
     * True iff the last proof is non-empty and does not end with a recognized ender.
     */
    public boolean inProof() {
        Fragment proof = lastProof();
        if (proof == null || proof.aborted() || proof.sentences().isEmpty()) {
            return false;
        }
        List<String> sentences = proof.sentences();
        return !enderRecognizer.test(sentences.get(sentences.size() - 1));
    }

    public void startProof(String starter, List<String> pending) {
        begin(starter, pending, false);
    }

    /**
     * Starts the proof of one of a program's obligations.
     */
    public void startObligation(String starter, List<String> pending) {
        begin(starter, pending, true);
    }

    /**
     * True while a proof is in progress, or before the first proof, which a tactic or ender may open
     * implicitly.
     */
    public boolean canContinueProof() {
        return inProof() || !hasProof();
    }

    /**
     * True iff the proof in progress belongs to a program obligation.
     */
    public boolean inObligation() {
        return inProof() && lastProof().obligation();
    }

    public void applyTactic(String tactic, List<String> pending) {
        Objects.requireNonNull(tactic, "tactic");
        Fragment proof = continueProof();
        proof.sentences().addAll(pending);
        proof.sentences().add(tactic);
    }

    public void endProof(String ender, List<String> pending) {
        Objects.requireNonNull(ender, "ender");
        Fragment proof = continueProof();
        proof.sentences().addAll(pending);
        proof.sentences().add(ender);
    }

    /**
     * Gives up the proof in progress, which then counts as finished without an ender of its own.
     */
    public void abort() {
        if (!inProof()) {
            return;
        }
        int last = lastProofIndex();
        Fragment proof = fragments.get(last);
        fragments.set(last, new Fragment(proof.sentences(), true, proof.obligation(), true));
    }

    public void appendToProof(String sentence) {
        Fragment proof = lastProof();
        if (proof == null) {
            throw new IllegalStateException("No proof to append to");
        }
        proof.sentences().add(sentence);
    }

    public void appendLoose(String sentence) {
        Fragment last = fragments.isEmpty() ? null : fragments.get(fragments.size() - 1);
        if (last == null || last.proof()) {
            last = new Fragment(new ArrayList<>(), false, false, false);
            fragments.add(last);
        }
        last.sentences().add(sentence);
    }

    public int openBraces() {
        return openBraces;
    }

    public void openBrace() {
        openBraces++;
    }

    public void closeBrace() {
        if (openBraces > 0) {
            openBraces--;
        }
    }

    /**
     * Appends this assertion's statement and fragments to {@code result}.
     *
     * @return whether glomming should continue; false once any proof lacks a terminal ender
     */
    public boolean discharge(List<String> result, boolean glom, String documentId) {
        boolean continueGlom = glom;
        for (Fragment fragment : fragments) {
            if (fragment.proof() && !terminated(fragment)) {
                if (continueGlom) {
                    LOGGER.warn("Unterminated proof in {}; proof glomming abandoned", documentId);
                }
                continueGlom = false;
            }
        }
        if (statement != null) {
            result.add(statement);
        }
        for (Fragment fragment : fragments) {
            if (fragment.proof() && continueGlom) {
                result.add(String.join(" ", fragment.sentences()));
            } else {
                result.addAll(fragment.sentences());
            }
        }
        return continueGlom;
    }

    private void begin(String starter, List<String> pending, boolean obligation) {
        Objects.requireNonNull(starter, "starter");
        if (inProof()) {
            appendToProof(pending);
            appendToProof(starter);
            return;
        }
        if (!program && hasProof()) {
            throw new IllegalStateException("Assertion already holds a proof: " + statement);
        }
        Fragment proof = openProof(program && obligation);
        proof.sentences().addAll(pending);
        proof.sentences().add(starter);
    }

    private Fragment continueProof() {
        if (inProof()) {
            return lastProof();
        }
        if (hasProof()) {
            throw new IllegalStateException("No proof in progress: " + this);
        }
        // a program's first obligation may go without a starter
        return openProof(program);
    }

    private void appendToProof(List<String> sentences) {
        for (String sentence : sentences) {
            appendToProof(sentence);
        }
    }

    private boolean terminated(Fragment proof) {
        List<String> sentences = proof.sentences();
        return proof.aborted()
                || !sentences.isEmpty() && enderRecognizer.test(sentences.get(sentences.size() - 1));
    }

    private Fragment openProof(boolean obligation) {
        Fragment proof = new Fragment(new ArrayList<>(), true, obligation, false);
        fragments.add(proof);
        return proof;
    }

    private Fragment lastProof() {
        int last = lastProofIndex();
        return last < 0 ? null : fragments.get(last);
    }

    private int lastProofIndex() {
        for (int i = fragments.size() - 1; i >= 0; i--) {
            if (fragments.get(i).proof()) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return "Assertion{statement=" + statement + ", program=" + program + ", proofs=" + proofs().size() + "}";
    }

    private record Fragment(List<String> sentences, boolean proof, boolean obligation, boolean aborted) {
    }
}
