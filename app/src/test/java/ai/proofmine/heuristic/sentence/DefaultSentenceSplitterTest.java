package ai.proofmine.heuristic.sentence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class DefaultSentenceSplitterTest {

    private final SentenceSplitter splitter = new DefaultSentenceSplitter();

    @Test
    void splitsOnPeriodFollowedByWhitespace() {
        List<String> sentences = splitter.splitSentences("Lemma l : True.\nProof.\n  trivial.\nQed.");

        assertThat(sentences).containsExactly("Lemma l : True.", "Proof.", "trivial.", "Qed.");
    }

    @Test
    void removesNestedCommentsAndReportsThem() {
        SplitResult result = splitter.split("(* a (* b *) c *) Lemma x : True. Proof. auto. Qed.");

        assertThat(result.texts()).containsExactly("Lemma x : True.", "Proof.", "auto.", "Qed.");
        assertThat(result.comments())
                .extracting(Comment::text, Comment::beginOffset, Comment::endOffset)
                .containsExactly(tuple("(* a (* b *) c *)", 0, 17));
        assertThat(result.comments().get(0).terminated()).isTrue();
    }

    @Test
    void commentStillSeparatesTokens() {
        assertThat(splitter.splitSentences("Lemma x(*name*): True.")).containsExactly("Lemma x : True.");
    }

    @Test
    void unterminatedCommentConsumesRestOfSource() {
        SplitResult result = splitter.split("Lemma a : True. (* never closed\nProof. auto. Qed.");

        assertThat(result.texts()).containsExactly("Lemma a : True.");
        assertThat(result.comments()).hasSize(1);
        assertThat(result.comments().get(0).terminated()).isFalse();
    }

    @Test
    void keepsStrayClosingDelimiterAsText() {
        DefaultSentenceSplitter.StrippedSource stripped =
                DefaultSentenceSplitter.stripComments("a *) b", new ArrayList<>());

        assertThat(stripped.text()).isEqualTo("a *) b");
    }

    @Test
    void doesNotSplitInsideRecursiveNotation() {
        String notation = "Notation \"[ x ; .. ; y ]\" := (cons x .. (cons y nil) ..).";

        assertThat(splitter.splitSentences(notation + "\nCheck [1 ; 2].")).containsExactly(notation, "Check [1 ; 2].");
    }

    @Test
    void ellipsisTerminatesSentence() {
        assertThat(splitter.splitSentences("Proof with auto.\n  split...\nQed."))
                .containsExactly("Proof with auto.", "split...", "Qed.");
    }

    @Test
    void splitsLeadingBulletsAndBraces() {
        assertThat(splitter.splitSentences("- split.\n  + auto.\n  ++ { auto. }\n"))
                .containsExactly("-", "split.", "+", "auto.", "++", "{", "auto.", "}");
    }

    @Test
    void collapsesWhitespaceAndRestoresFinalPeriod() {
        assertThat(splitter.splitSentences("Definition  x\n   : nat\t:= 0.\nCheck x"))
                .containsExactly("Definition x : nat := 0.", "Check x.");
    }

    @Test
    void recordsOffsetsAndLineNumbers() {
        SplitResult result = splitter.split("Lemma a : True.\nProof.\n  - exact I.\n");

        assertThat(result.sentences())
                .extracting(Sentence::text, Sentence::beginOffset, Sentence::endOffset)
                .containsExactly(
                        tuple("Lemma a : True.", 0, 15),
                        tuple("Proof.", 16, 22),
                        tuple("-", 25, 26),
                        tuple("exact I.", 27, 35));
        assertThat(result.sentences()).extracting(Sentence::lineNumber).containsExactly(1, 2, 3, 3);
    }

    @Test
    void returnsEmptyResultForBlankInput() {
        assertThat(splitter.split("").isEmpty()).isTrue();
        assertThat(splitter.split("   \n\t").isEmpty()).isTrue();
        assertThat(splitter.split(null).isEmpty()).isTrue();
        assertThat(splitter.split("(* only a comment *)").texts()).isEmpty();
    }

    @Test
    void resplittingJoinedSentencesIsIdempotent() {
        List<String> first = splitter.splitSentences(
                "Theorem t : True.\n(* c *)\nProof.\n  - split... \n  { exact I. }\nQed.\n");

        List<String> second = splitter.splitSentences(String.join(" ", first));

        assertThat(second).isEqualTo(first);
    }
}
