package ai.proofmine.heuristic.classify;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link SentenceClassifier} driven by a {@link Vocabulary} and an ordered table of rules.
 *
 * <p>Each rule may consult the facets granted before it, which is how tactics and queries are kept apart from
 * sentences that already carry a structural facet.
 */
public class LexicalClassifier implements SentenceClassifier {

    private static final Pattern BULLET_OR_BRACE = Pattern.compile("[{}]|-+|\\++|\\*+");
    private static final Pattern TACTIC_NAME = Pattern.compile(
            "Ltac2?\\s+(?:mutable\\s+|rec\\s+)?([A-Za-z_][A-Za-z0-9_']*)");

    private final Vocabulary vocabulary;
    private final List<ClassificationRule> rules;

    public LexicalClassifier() {
        this(Vocabulary.standard());
    }

    public LexicalClassifier(Vocabulary vocabulary) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
        this.rules = List.of(
                new ClassificationRule(Facet.BULLET_OR_BRACE,
                        (parts, matched) -> BULLET_OR_BRACE.matcher(parts.sentence().strip()).matches()),
                new ClassificationRule(Facet.PROGRAM_STARTER,
                        (parts, matched) -> parts.program() && !matched.contains(Facet.BULLET_OR_BRACE)),
                new ClassificationRule(Facet.THEOREM_STARTER,
                        (parts, matched) -> matched.contains(Facet.PROGRAM_STARTER)
                                || this.vocabulary.isTheoremStarter(parts.declaration())),
                new ClassificationRule(Facet.OBLIGATION,
                        (parts, matched) -> this.vocabulary.isObligationStarter(parts.command())),
                new ClassificationRule(Facet.PROOF_STARTER,
                        (parts, matched) -> matched.contains(Facet.OBLIGATION)
                                || this.vocabulary.isProofStarter(parts.command())),
                new ClassificationRule(Facet.PROOF_ENDER,
                        (parts, matched) -> this.vocabulary.isProofEnder(parts.command())),
                new ClassificationRule(Facet.TACTIC,
                        (parts, matched) -> !hasStructural(matched) && startsLowercaseOrDigit(parts.command())),
                new ClassificationRule(Facet.CUSTOM_TACTIC,
                        (parts, matched) -> matched.contains(Facet.TACTIC)
                                && parts.leadingIdentifier().filter(id -> !this.vocabulary.isBuiltinTactic(id))
                                        .isPresent()),
                new ClassificationRule(Facet.FAIL, (parts, matched) -> parts.failed()),
                new ClassificationRule(Facet.TACTIC_DEFINITION,
                        (parts, matched) -> !hasStructural(matched) && this.vocabulary.definesTactic(parts.command())),
                new ClassificationRule(Facet.REQUIREMENT,
                        (parts, matched) -> !hasStructural(matched)
                                && this.vocabulary.loadsRequirement(parts.command())),
                new ClassificationRule(Facet.NESTED_PROOFS_ON,
                        (parts, matched) -> parts.command().equals(Vocabulary.NESTED_PROOFS_ON)),
                new ClassificationRule(Facet.NESTED_PROOFS_OFF,
                        (parts, matched) -> parts.command().equals(Vocabulary.NESTED_PROOFS_OFF)),
                new ClassificationRule(Facet.QUERY,
                        (parts, matched) -> !hasStructural(matched) && startsUppercase(parts.command())),
                new ClassificationRule(Facet.UNKNOWN_COMMAND,
                        (parts, matched) -> matched.contains(Facet.QUERY)
                                && !this.vocabulary.isKnownCommand(parts.command())));
    }

    @Override
    public Classification classify(String sentence) {
        String text = sentence == null ? "" : sentence;
        CommandParts parts = CommandParts.parse(text);
        Set<Facet> matched = EnumSet.noneOf(Facet.class);
        for (ClassificationRule rule : rules) {
            if (rule.matches(parts, matched)) {
                matched.add(rule.facet());
            }
        }
        Optional<String> definedTactic = matched.contains(Facet.TACTIC_DEFINITION)
                ? definedTacticName(parts.command())
                : Optional.empty();
        Set<String> requirements = matched.contains(Facet.REQUIREMENT)
                ? RequirementExtractor.extract(parts.command())
                : Set.of();
        return new Classification(text, parts.command(), matched, parts.leadingIdentifier(), definedTactic,
                requirements);
    }

    public Vocabulary vocabulary() {
        return vocabulary;
    }

    List<ClassificationRule> rules() {
        return rules;
    }

    private static Optional<String> definedTacticName(String command) {
        Matcher matcher = TACTIC_NAME.matcher(command);
        return matcher.lookingAt() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private static boolean hasStructural(Set<Facet> matched) {
        for (Facet facet : matched) {
            if (facet.isStructural()) {
                return true;
            }
        }
        return false;
    }

    private static boolean startsLowercaseOrDigit(String command) {
        return !command.isEmpty()
                && (Character.isLowerCase(command.charAt(0)) || Character.isDigit(command.charAt(0)));
    }

    private static boolean startsUppercase(String command) {
        return !command.isEmpty() && Character.isUpperCase(command.charAt(0));
    }
}
