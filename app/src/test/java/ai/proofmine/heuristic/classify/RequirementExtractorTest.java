package ai.proofmine.heuristic.classify;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class RequirementExtractorTest {

    @Test
    void extractsQualifiedNames() {
        assertThat(RequirementExtractor.extract("Require Import Coq.Lists.List."))
                .containsExactly("Coq.Lists.List");
        assertThat(RequirementExtractor.extract("Require Export A B."))
                .containsExactly("A", "B");
        assertThat(RequirementExtractor.extract("Require Program."))
                .containsExactly("Program");
    }

    @Test
    void prependsFromDirectory() {
        assertThat(RequirementExtractor.extract("From mathcomp Require Import ssreflect ssrbool."))
                .containsExactly("mathcomp.ssreflect", "mathcomp.ssrbool");
    }

    @Test
    void skipsImportCategories() {
        assertThat(RequirementExtractor.extract("Require Import -(notations) Foo."))
                .containsExactly("Foo");
    }

    @Test
    void ignoresOtherCommands() {
        assertThat(RequirementExtractor.extract("Check x.")).isEmpty();
        assertThat(RequirementExtractor.extract("From Coq.")).isEmpty();
        assertThat(RequirementExtractor.extract(null)).isEmpty();
    }
}
