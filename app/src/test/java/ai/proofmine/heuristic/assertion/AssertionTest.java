package ai.proofmine.heuristic.assertion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.proofmine.heuristic.classify.LexicalClassifier;
import ai.proofmine.heuristic.classify.SentenceClassifier;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class AssertionTest {

    private final SentenceClassifier classifier = new LexicalClassifier();

    private Assertion lemma() {
        return new Assertion("Lemma l : True.", false, classifier::isProofEnder);
    }

    @Test
    void tracksProofModeThroughStartTacticAndEnd() {
        Assertion assertion = lemma();
        assertThat(assertion.inProof()).isFalse();

        assertion.startProof("Proof.", List.of());
        assertThat(assertion.inProof()).isTrue();
        assertion.applyTactic("trivial.", List.of("-"));
        assertion.endProof("Qed.", List.of());

        assertThat(assertion.inProof()).isFalse();
        assertThat(assertion.proofs()).containsExactly(List.of("Proof.", "-", "trivial.", "Qed."));
    }

    @Test
    void tacticOpensProofImplicitly() {
        Assertion assertion = lemma();

        assertion.applyTactic("auto.", List.of());

        assertThat(assertion.inProof()).isTrue();
        assertThat(assertion.proofs()).containsExactly(List.of("auto."));
    }

    @Test
    void enderWithoutStarterIsAccepted() {
        Assertion assertion = lemma();

        assertion.endProof("Admitted.", List.of());

        assertThat(assertion.inProof()).isFalse();
        assertThat(assertion.proofs()).containsExactly(List.of("Admitted."));
    }

    @Test
    void selfTerminatingProofIsNotInProgress() {
        Assertion assertion = lemma();

        assertion.startProof("Proof I.", List.of());

        assertThat(assertion.hasProof()).isTrue();
        assertThat(assertion.inProof()).isFalse();
    }

    @Test
    void ordinaryAssertionAcceptsSingleProof() {
        Assertion assertion = lemma();
        assertion.startProof("Proof.", List.of());
        assertion.endProof("Qed.", List.of());

        Throwable thrown = catchThrowable(() -> assertion.startProof("Proof.", List.of()));

        assertThat(thrown).isInstanceOf(IllegalStateException.class).hasMessageContaining("already holds a proof");
    }

    @Test
    void programAccumulatesOneProofPerObligation() {
        Assertion program = new Assertion("Program Definition f : nat := _.", true, classifier::isProofEnder);

        program.startObligation("Next Obligation.", List.of());
        assertThat(program.inObligation()).isTrue();
        program.applyTactic("exact 0.", List.of());
        program.endProof("Defined.", List.of());
        program.startObligation("Next Obligation.", List.of());
        program.endProof("Defined.", List.of());

        assertThat(program.proofs()).hasSize(2);
        assertThat(program.isBareProgram()).isFalse();
        assertThat(program.inObligation()).isFalse();
    }

    @Test
    void programMainProofIsNotAnObligation() {
        Assertion program = new Assertion("Program Lemma foo : True.", true, classifier::isProofEnder);

        program.startProof("Proof.", List.of());

        assertThat(program.inProof()).isTrue();
        assertThat(program.inObligation()).isFalse();
    }

    @Test
    void programOpensFirstObligationImplicitlyOnly() {
        Assertion program = new Assertion("Program Definition f : nat := _.", true, classifier::isProofEnder);
        program.applyTactic("exact 0.", List.of());
        assertThat(program.inObligation()).isTrue();
        program.endProof("Defined.", List.of());

        assertThat(program.canContinueProof()).isFalse();
        Throwable thrown = catchThrowable(() -> program.applyTactic("exact 1.", List.of()));

        assertThat(thrown).isInstanceOf(IllegalStateException.class).hasMessageContaining("No proof in progress");
        assertThat(program.proofs()).containsExactly(List.of("exact 0.", "Defined."));
    }

    @Test
    void abortedProofIsFinishedAndStillGlommed() {
        Assertion assertion = lemma();
        assertion.startProof("Proof.", List.of());
        assertion.applyTactic("auto.", List.of());

        assertion.abort();

        assertThat(assertion.inProof()).isFalse();
        List<String> result = new ArrayList<>();
        assertThat(assertion.discharge(result, true, "doc.v")).isTrue();
        assertThat(result).containsExactly("Lemma l : True.", "Proof. auto.");
    }

    @Test
    void startingWhileInProofAppendsToActiveProof() {
        Assertion program = new Assertion(null, true, classifier::isProofEnder);
        program.startObligation("Next Obligation.", List.of());

        program.startProof("Proof.", List.of("{"));

        assertThat(program.proofs()).containsExactly(List.of("Next Obligation.", "{", "Proof."));
        assertThat(program.isBareProgram()).isTrue();
    }

    @Test
    void dischargeGlomsTerminatedProofs() {
        Assertion assertion = lemma();
        assertion.startProof("Proof.", List.of());
        assertion.applyTactic("trivial.", List.of());
        assertion.endProof("Qed.", List.of());
        List<String> result = new ArrayList<>();

        boolean continueGlom = assertion.discharge(result, true, "doc.v");

        assertThat(continueGlom).isTrue();
        assertThat(result).containsExactly("Lemma l : True.", "Proof. trivial. Qed.");
    }

    @Test
    void dischargeWithoutGlomKeepsSentencesApart() {
        Assertion assertion = lemma();
        assertion.startProof("Proof.", List.of());
        assertion.endProof("Qed.", List.of());
        List<String> result = new ArrayList<>();

        boolean continueGlom = assertion.discharge(result, false, "doc.v");

        assertThat(continueGlom).isFalse();
        assertThat(result).containsExactly("Lemma l : True.", "Proof.", "Qed.");
    }

    @Test
    void unterminatedProofDisablesGlomming() {
        Assertion assertion = lemma();
        assertion.startProof("Proof.", List.of());
        assertion.applyTactic("auto.", List.of());
        List<String> result = new ArrayList<>();

        boolean continueGlom = assertion.discharge(result, true, "doc.v");

        assertThat(continueGlom).isFalse();
        assertThat(result).containsExactly("Lemma l : True.", "Proof.", "auto.");
    }

    @Test
    void looseSentencesKeepSourceOrder() {
        Assertion definition = new Assertion("Definition x := 0.", false, classifier::isProofEnder);
        definition.appendLoose("Check x.");
        definition.appendLoose("Print x.");
        List<String> result = new ArrayList<>();

        definition.discharge(result, true, "doc.v");

        assertThat(definition.hasProof()).isFalse();
        assertThat(result).containsExactly("Definition x := 0.", "Check x.", "Print x.");
    }

    @Test
    void bareProgramOmitsStatement() {
        Assertion program = new Assertion(null, true, classifier::isProofEnder);
        program.startProof("Next Obligation.", List.of());
        program.endProof("Qed.", List.of());
        List<String> result = new ArrayList<>();

        program.discharge(result, true, "doc.v");

        assertThat(result).containsExactly("Next Obligation. Qed.");
    }

    @Test
    void braceCountNeverDropsBelowZero() {
        Assertion assertion = lemma();
        assertion.closeBrace();
        assertion.openBrace();
        assertion.openBrace();
        assertion.closeBrace();

        assertThat(assertion.openBraces()).isEqualTo(1);
    }

    @Test
    void appendingWithoutProofIsRejected() {
        Throwable thrown = catchThrowable(() -> lemma().appendToProof("Check x."));

        assertThat(thrown).isInstanceOf(IllegalStateException.class);
    }
}
