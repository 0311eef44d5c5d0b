package ai.proofmine.heuristic.classify;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Lexical classification of one sentence.
 *
 * @param sentence the sentence as given to the classifier
 * @param command the sentence with control prefixes and attributes stripped
 * @param facets every facet the sentence carries
 * @param leadingIdentifier the first identifier of {@code command}, if it starts with one
 * @param definedTactic the tactic name introduced by an {@code Ltac} definition
 * @param requirements logical names loaded by a {@code Require} command
 */
public record Classification(
        String sentence,
        String command,
        Set<Facet> facets,
        Optional<String> leadingIdentifier,
        Optional<String> definedTactic,
        Set<String> requirements
) {

    public Classification {
        Objects.requireNonNull(sentence, "sentence");
        Objects.requireNonNull(command, "command");
        facets = facets == null || facets.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(Facet.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(facets));
        leadingIdentifier = leadingIdentifier == null ? Optional.empty() : leadingIdentifier;
        definedTactic = definedTactic == null ? Optional.empty() : definedTactic;
        requirements = requirements == null ? Set.of() : Set.copyOf(requirements);
    }

    public boolean has(Facet facet) {
        return facets.contains(facet);
    }

    public SentenceKind kind() {
        return SentenceKind.of(facets);
    }
}
