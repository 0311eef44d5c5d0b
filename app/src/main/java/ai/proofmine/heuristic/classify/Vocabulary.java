package ai.proofmine.heuristic.classify;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Fixed keyword tables the lexical classifier matches sentences against.
 *
 * <p>Instances are immutable and meant to be built once and shared.
 */
public final class Vocabulary {

    static final List<String> THEOREM_KEYWORDS = byLengthDescending(Set.of(
            "Theorem",
            "Lemma",
            "Fact",
            "Remark",
            "Corollary",
            "Proposition",
            "Property",
            "Definition",
            "Example",
            "Instance",
            "Let",
            "Fixpoint",
            "CoFixpoint",
            "Function",
            "Coercion",
            "Add Morphism",
            "Add Parametric Morphism",
            "Add Parametric Relation",
            "Add Setoid",
            "Declare Morphism"));

    static final List<String> OBLIGATION_KEYWORDS = byLengthDescending(Set.of(
            "Obligation",
            "Next Obligation",
            "Solve Obligation",
            "Solve Obligations",
            "Solve All Obligations"));

    static final List<String> OBLIGATION_ENDER_KEYWORDS = byLengthDescending(Set.of(
            "Solve Obligations",
            "Solve All Obligations"));

    static final List<String> NON_STARTER_KEYWORDS = byLengthDescending(Set.of(
            "Obligation Tactic",
            "Obligations"));

    static final List<String> PROOF_STARTER_KEYWORDS = List.of("Proof", "Goal");

    static final Set<String> CONTROL_KEYWORDS = Set.of("Time", "Fail", "Succeed", "Redirect", "Timeout");

    static final Set<String> ATTRIBUTE_KEYWORDS = Set.of(
            "Local",
            "Global",
            "Polymorphic",
            "Monomorphic",
            "Cumulative",
            "NonCumulative",
            "Private");

    static final List<String> TACTIC_DEFINERS = List.of("Ltac2", "Ltac");

    static final List<String> REQUIREMENT_STARTERS = List.of("Require", "From");

    static final String NESTED_PROOFS_ON = "Set Nested Proofs Allowed.";
    static final String NESTED_PROOFS_OFF = "Unset Nested Proofs Allowed.";

    private static final Pattern PROOF_ENDER = Pattern.compile(
            "(?:Qed|Admitted)\\.|(?:Save|Defined|Abort)(?: [A-Za-z_][A-Za-z0-9_'.]*)?\\.");
    private static final Pattern SELF_TERMINATING_PROOF = Pattern.compile(
            "Proof (?!with\\b)(?!using\\b)(?!\\.$).+\\.");

    /**
     * State-irrelevant commands recognized as queries. Capitalized commands outside this table are still
     * treated as queries but reported as unknown.
     */
    static final Set<String> QUERY_COMMANDS = Set.of(
            "About", "Check", "Search", "SearchPattern", "SearchRewrite", "SearchHead", "Print", "Locate",
            "Compute", "Eval", "Require", "From", "Import", "Export", "Include", "Set", "Unset", "Test",
            "Add", "Remove", "Open", "Close", "Section", "End", "Module", "Declare", "Arguments", "Implicit",
            "Notation", "Infix", "Reserved", "Tactic", "Ltac", "Ltac2", "Hint", "Create", "Inductive",
            "CoInductive", "Variant", "Record", "Structure", "Class", "Existing", "Variable", "Variables",
            "Hypothesis", "Hypotheses", "Axiom", "Axioms", "Parameter", "Parameters", "Conjecture",
            "Conjectures", "Context", "Generalizable", "Scheme", "Combined", "Opaque", "Transparent",
            "Strategy", "Canonical", "Typeclasses", "Derive", "Extraction", "Recursive", "Extract", "Show",
            "Undo", "Restart", "Focus", "Unfocus", "Unfocused", "Back", "BackTo", "Reset", "Debug",
            "Universe", "Universes", "Constraint", "Primitive", "Register", "Bind", "Delimit", "Undelimit",
            "Load", "Cd", "Pwd", "Optimize", "Functional", "Obligation", "Obligations", "Admit", "Preterm",
            "Guarded", "Unshelve", "Info", "Abbreviation", "Collection", "Comments", "Attributes", "Instructions",
            "Profile", "Type", "Number", "String", "Enable", "Disable", "Inspect");

    static final Set<String> BUILTIN_TACTICS = Set.of(
            "abstract", "absurd", "admit", "all", "apply", "assert", "assert_fails", "assert_succeeds",
            "assumption", "auto", "autoapply", "autorewrite", "autounfold", "bfs", "btauto", "by", "case",
            "case_eq", "casetype", "cbn", "cbv", "change", "change_no_check", "classical_left",
            "classical_right", "clear", "clearbody", "cofix", "compare", "compute", "congr", "congruence",
            "constr_eq", "constr_eq_nounivs", "constr_eq_strict", "constructor", "context", "contradict",
            "contradiction", "cut", "cutrewrite", "cycle", "debug", "decide", "decompose", "dependent",
            "destruct", "dintuition", "discriminate", "discrR", "do", "done", "dtauto", "eapply", "eassert",
            "eassumption", "easy", "eauto", "ecase", "econstructor", "edestruct", "ediscriminate", "eelim",
            "eenough", "eexact", "eexists", "einduction", "einjection", "eintros", "eleft", "elim", "elimtype",
            "enough", "epose", "eremember", "erewrite", "eright", "eset", "esimplify_eq", "esplit",
            "etransitivity", "eval", "evar", "exact", "exact_no_check", "exactly_once", "exfalso", "exists",
            "f_equal", "fail", "field", "field_simplify", "field_simplify_eq", "finish_timing", "first",
            "firstorder", "fix", "fold", "fresh", "fun", "functional", "generalize", "generally", "gfail",
            "give_up", "guard", "has_evar", "have", "hnf", "idtac", "in", "induction", "info_auto",
            "info_eauto", "info_trivial", "injection", "instantiate", "intro", "intros", "intuition",
            "inversion", "inversion_clear", "inversion_sigma", "is_cofix", "is_const", "is_constructor",
            "is_evar", "is_fix", "is_ground", "is_ind", "is_proj", "is_var", "lapply", "last", "lazy",
            "lazy_match", "lazymatch", "left", "let", "lia", "lra", "match", "move", "multi_match",
            "multimatch", "native_cast_no_check", "native_compute", "nia", "notypeclasses", "now",
            "now_show", "nra", "nsatz", "numgoals", "omega", "once", "only", "optimize_heap", "over",
            "pattern", "pose", "progress", "psatz", "rapply", "red", "refine", "reflexivity", "remember",
            "rename", "repeat", "replace", "reset", "restart_timer", "revert", "revgoals", "rewrite",
            "rewrite_db", "rewrite_strat", "right", "ring", "ring_simplify", "rtauto", "set",
            "setoid_reflexivity", "setoid_replace", "setoid_rewrite", "setoid_symmetry",
            "setoid_transitivity", "shelve", "shelve_unifiable", "show", "simpl", "simple", "simplify_eq",
            "solve", "solve_constraints", "specialize", "split", "split_Rabs", "split_Rmult", "start", "subst",
            "substitute", "suff", "suffices", "swap", "symmetry", "tauto", "time", "time_constr", "timeout",
            "transitivity", "transparent_abstract", "trivial", "try", "tryif", "type", "type_term",
            "typeclasses", "under", "unfold", "unify", "unlock", "unshelve", "vm_cast_no_check", "vm_compute",
            "with_strategy", "without", "wlog", "zify");

    private static final Vocabulary STANDARD = new Vocabulary(BUILTIN_TACTICS);

    private final Set<String> tactics;

    private Vocabulary(Collection<String> tactics) {
        this.tactics = Set.copyOf(tactics);
    }

    public static Vocabulary standard() {
        return STANDARD;
    }

    /**
     * Returns a vocabulary whose built-in tactic table also contains {@code extraTactics}.
     */
    public Vocabulary withExtraTactics(Collection<String> extraTactics) {
        Objects.requireNonNull(extraTactics, "extraTactics");
        if (extraTactics.isEmpty()) {
            return this;
        }
        Set<String> merged = new LinkedHashSet<>(tactics);
        extraTactics.stream()
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .forEach(merged::add);
        return new Vocabulary(merged);
    }

    public boolean isBuiltinTactic(String identifier) {
        return identifier != null && tactics.contains(identifier);
    }

    public boolean isTheoremStarter(String declaration) {
        return matchesAny(declaration, THEOREM_KEYWORDS);
    }

    public boolean isNonStarter(String command) {
        return matchesAny(command, NON_STARTER_KEYWORDS);
    }

    public boolean isObligationStarter(String command) {
        return !isNonStarter(command) && matchesAny(command, OBLIGATION_KEYWORDS);
    }

    public boolean isProofStarter(String command) {
        return !isNonStarter(command) && matchesAny(command, PROOF_STARTER_KEYWORDS);
    }

    /**
     * Returns whether {@code command} closes proof mode on its own.
     */
    public boolean isProofEnder(String command) {
        return PROOF_ENDER.matcher(command).matches()
                || SELF_TERMINATING_PROOF.matcher(command).matches()
                || matchesAny(command, OBLIGATION_ENDER_KEYWORDS);
    }

    public boolean definesTactic(String command) {
        return matchesAny(command, TACTIC_DEFINERS);
    }

    public boolean loadsRequirement(String command) {
        return matchesAny(command, REQUIREMENT_STARTERS);
    }

    public boolean isKnownCommand(String command) {
        String keyword = leadingWord(command);
        return QUERY_COMMANDS.contains(keyword)
                || CONTROL_KEYWORDS.contains(keyword)
                || ATTRIBUTE_KEYWORDS.contains(keyword);
    }

    static boolean startsWithKeyword(String text, String keyword) {
        if (text == null || !text.startsWith(keyword)) {
            return false;
        }
        return text.length() == keyword.length() || !isIdentifierPart(text.charAt(keyword.length()));
    }

    static boolean isIdentifierPart(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_' || ch == '\'';
    }

    static String leadingWord(String text) {
        int end = 0;
        while (end < text.length() && isIdentifierPart(text.charAt(end))) {
            end++;
        }
        return text.substring(0, end);
    }

    private static boolean matchesAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (startsWithKeyword(text, keyword)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> byLengthDescending(Set<String> keywords) {
        return keywords.stream()
                .sorted(Comparator.comparingInt(String::length).reversed()
                        .thenComparing(value -> value.toLowerCase(Locale.ROOT)))
                .collect(Collectors.toUnmodifiableList());
    }
}
