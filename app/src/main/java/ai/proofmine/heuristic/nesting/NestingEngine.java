package ai.proofmine.heuristic.nesting;

import ai.proofmine.heuristic.assertion.Assertion;
import ai.proofmine.heuristic.assertion.NestingStack;
import ai.proofmine.heuristic.classify.Classification;
import ai.proofmine.heuristic.classify.Facet;
import ai.proofmine.heuristic.classify.LexicalClassifier;
import ai.proofmine.heuristic.classify.SentenceClassifier;
import ai.proofmine.heuristic.classify.SentenceKind;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds a document's sentences left to right over a stack of open assertions, producing per-sentence depth
 * and nesting statistics together with the discharged sentence stream.
 *
 * <p>Depth counts open assertions plus one for every non-bare program with an obligation proof in progress.
 * A program stays open after an obligation ends and is closed once the next theorem or program starts, once
 * the proof enclosing it continues, or at the end of the document. The engine never throws on malformed input; it records a {@link ParseWarning}
 * instead and marks the statistics partial.
 */
public class NestingEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(NestingEngine.class);

    private static final String GOAL = "Goal";
    private static final String OPEN_BRACE = "{";
    private static final String CLOSE_BRACE = "}";
    private static final Pattern ABORT_ALL = Pattern.compile("Abort\\s+All\\s*\\.");

    private final SentenceClassifier classifier;

    public NestingEngine() {
        this(new LexicalClassifier());
    }

    public NestingEngine(SentenceClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public NestingResult fold(List<String> sentences, boolean glom, String documentId) {
        Objects.requireNonNull(sentences, "sentences");
        return new Fold(documentId == null ? "<unknown>" : documentId, glom).run(sentences);
    }

    public SentenceStatistics statistics(List<String> sentences) {
        return fold(sentences, false, "<statistics>").statistics();
    }

    private final class Fold {

        private final String documentId;
        private final NestingStack stack = new NestingStack();
        private final List<String> output = new ArrayList<>();
        private final List<Integer> depths = new ArrayList<>();
        private final Set<Integer> theoremIndices = new HashSet<>();
        private final Set<Integer> starterIndices = new HashSet<>();
        private final Set<Integer> tacticIndices = new HashSet<>();
        private final List<Integer> enderIndices = new ArrayList<>();
        private final Set<Integer> programIndices = new HashSet<>();
        private final Set<Integer> obligationIndices = new HashSet<>();
        private final Set<Integer> queryIndices = new HashSet<>();
        private final Set<Integer> failIndices = new HashSet<>();
        private final List<Boolean> nestingAllowed = new ArrayList<>();
        private final Set<String> customTactics = new LinkedHashSet<>();
        private final Set<String> requirements = new LinkedHashSet<>();
        private final Set<String> warnedKeywords = new HashSet<>();
        private final List<ParseWarning> warnings = new ArrayList<>();
        private boolean glom;
        private boolean nestedProofs;
        private boolean partial;

        private Fold(String documentId, boolean glom) {
            this.documentId = documentId;
            this.glom = glom;
        }

        NestingResult run(List<String> sentences) {
            for (int index = 0; index < sentences.size(); index++) {
                String sentence = sentences.get(index);
                boolean nestingBefore = structuralNesting();
                depths.add(step(index, sentence == null ? "" : sentence));
                nestingAllowed.add(nestedProofs || nestingBefore);
            }
            finish(sentences.size());

            Set<Integer> proofIndices = new HashSet<>();
            proofIndices.addAll(theoremIndices);
            proofIndices.addAll(starterIndices);
            proofIndices.addAll(tacticIndices);
            proofIndices.addAll(enderIndices);
            proofIndices.addAll(programIndices);
            proofIndices.addAll(obligationIndices);
            SentenceStatistics statistics = new SentenceStatistics(depths, theoremIndices, starterIndices,
                    tacticIndices, enderIndices, programIndices, obligationIndices, queryIndices, failIndices,
                    proofIndices, nestingAllowed, customTactics, requirements, warnings, partial);
            return new NestingResult(statistics, output);
        }

        private int step(int index, String sentence) {
            Classification classification = classifier.classify(sentence);
            SentenceKind kind = classification.kind();
            if (actsAsTactic(kind, classification)) {
                kind = SentenceKind.TACTIC;
            }
            switch (kind) {
                case BULLET_OR_BRACE:
                    return bulletOrBrace(sentence);
                case FAIL:
                    failIndices.add(index);
                    place(sentence);
                    return depth();
                case PROGRAM_STARTER:
                case THEOREM_STARTER:
                    return theoremStarter(index, sentence, classification);
                case PROOF_STARTER:
                    return proofStarter(index, sentence, classification);
                case PROOF_ENDER:
                    return proofEnder(index, sentence, classification);
                case TACTIC:
                    return tactic(index, sentence, classification);
                default:
                    return query(index, sentence, classification);
            }
        }

        /**
         * Capitalized calls of tactics defined earlier, and sentences no rule recognizes, are tactics while a
         * proof is open.
         */
        private boolean actsAsTactic(SentenceKind kind, Classification classification) {
            if (!topInProof() && !settledProgramAboveProof()) {
                return false;
            }
            if (kind == SentenceKind.OTHER) {
                return true;
            }
            return kind == SentenceKind.QUERY
                    && classification.leadingIdentifier().filter(customTactics::contains).isPresent();
        }

        private int bulletOrBrace(String sentence) {
            stack.buffer(sentence);
            Optional<Assertion> top = stack.top();
            if (top.isPresent()) {
                if (OPEN_BRACE.equals(sentence)) {
                    top.get().openBrace();
                } else if (CLOSE_BRACE.equals(sentence)) {
                    top.get().closeBrace();
                }
            }
            return depth();
        }

        private int theoremStarter(int index, String sentence, Classification classification) {
            closeSettledProgram();
            flushPending();
            boolean program = classification.has(Facet.PROGRAM_STARTER);
            stack.push(new Assertion(sentence, program, classifier::isProofEnder));
            theoremIndices.add(index);
            if (program) {
                programIndices.add(index);
            }
            return depth();
        }

        private int proofStarter(int index, String sentence, Classification classification) {
            boolean obligation = classification.has(Facet.OBLIGATION);
            if (classification.command().startsWith(GOAL)) {
                closeSettledProgram();
                flushPending();
                stack.push(new Assertion(null, false, classifier::isProofEnder));
                theoremIndices.add(index);
            } else if (obligation && !topInProof() && stack.top().filter(Assertion::isProgram).isEmpty()) {
                LOGGER.debug("Obligation without an open program in {} at sentence {}", documentId, index);
                flushPending();
                stack.push(new Assertion(null, true, classifier::isProofEnder));
            } else if (stack.isEmpty()) {
                LOGGER.debug("Proof starter without an open assertion in {} at sentence {}", documentId, index);
                flushPending();
                stack.push(new Assertion(null, false, classifier::isProofEnder));
            }
            Assertion top = stack.top().orElseThrow();
            if (obligation) {
                top.startObligation(sentence, stack.drainPending());
            } else {
                top.startProof(sentence, stack.drainPending());
            }
            starterIndices.add(index);
            if (obligation) {
                obligationIndices.add(index);
            }
            int depth = depth();
            if (classification.has(Facet.PROOF_ENDER)) {
                // the starter already closed its own proof
                enderIndices.add(index);
                closeTopUnlessProgram();
            }
            return depth;
        }

        private int proofEnder(int index, String sentence, Classification classification) {
            if (stack.isEmpty()) {
                malformed(index, "Proof ender '" + sentence + "' without an open assertion");
                place(sentence);
                return depth();
            }
            int depth = depth();
            if (ABORT_ALL.matcher(classification.command()).matches() && anyInProof()) {
                abortAll(index, sentence);
                return depth;
            }
            closeProgramsAboveProof();
            Assertion top = stack.top().orElseThrow();
            if (!top.canContinueProof()) {
                malformed(index, "Proof ender '" + sentence + "' without a proof in progress");
                place(sentence);
                return depth;
            }
            top.endProof(sentence, stack.drainPending());
            enderIndices.add(index);
            closeTopUnlessProgram();
            return depth;
        }

        /**
         * Ends the innermost proof with the sentence, gives up every other proof in progress and discharges
         * everything from the outermost aborted assertion up.
         */
        private void abortAll(int index, String sentence) {
            List<Assertion> open = stack.assertions();
            int outermost = -1;
            int innermost = -1;
            for (int i = 0; i < open.size(); i++) {
                if (open.get(i).inProof()) {
                    innermost = i;
                    if (outermost < 0) {
                        outermost = i;
                    }
                }
            }
            open.get(innermost).endProof(sentence, stack.drainPending());
            for (int i = outermost; i < open.size(); i++) {
                open.get(i).abort();
            }
            enderIndices.add(index);
            while (stack.size() > outermost) {
                dischargeTop();
            }
        }

        private int tactic(int index, String sentence, Classification classification) {
            tacticIndices.add(index);
            if (classification.has(Facet.CUSTOM_TACTIC)) {
                classification.leadingIdentifier().ifPresent(customTactics::add);
            }
            int depthBeforeClosing = depth();
            boolean closed = closeProgramsAboveProof();
            Optional<Assertion> top = stack.top();
            if (top.isEmpty()) {
                LOGGER.debug("Tactic outside any assertion in {} at sentence {}", documentId, index);
                place(sentence);
                return depth();
            }
            if (!top.get().canContinueProof()) {
                LOGGER.debug("Tactic outside any proof in {} at sentence {}", documentId, index);
                place(sentence);
                return depth();
            }
            top.get().applyTactic(sentence, stack.drainPending());
            return closed ? depthBeforeClosing : depth();
        }

        private int query(int index, String sentence, Classification classification) {
            if (classification.has(Facet.QUERY)) {
                queryIndices.add(index);
            }
            classification.definedTactic().ifPresent(customTactics::add);
            requirements.addAll(classification.requirements());
            if (classification.has(Facet.NESTED_PROOFS_ON)) {
                nestedProofs = true;
            } else if (classification.has(Facet.NESTED_PROOFS_OFF)) {
                nestedProofs = false;
            }
            if (classification.has(Facet.UNKNOWN_COMMAND)) {
                String keyword = classification.leadingIdentifier().orElse(classification.command());
                if (warnedKeywords.add(keyword)) {
                    LOGGER.warn("Unknown command '{}' in {} treated as a query", keyword, documentId);
                    warnings.add(new ParseWarning(ParseWarning.Kind.UNKNOWN_COMMAND, index,
                            "Unknown command '" + keyword + "'"));
                }
            }
            place(sentence);
            return depth();
        }

        private void finish(int sentenceCount) {
            long unfinished = stack.assertions().stream().filter(Assertion::inProof).count();
            if (unfinished > 0) {
                malformed(sentenceCount, unfinished + " proof(s) still open at end of document");
            }
            flushPending();
            boolean continueGlom = stack.dischargeAll(output, glom, documentId);
            if (glom && !continueGlom) {
                warnings.add(new ParseWarning(ParseWarning.Kind.UNTERMINATED_PROOF, sentenceCount,
                        "Unterminated proof at end of document"));
            }
            glom = continueGlom;
        }

        private void closeSettledProgram() {
            Optional<Assertion> top = stack.top();
            if (top.isPresent() && top.get().isProgram() && !top.get().inProof()) {
                dischargeTop();
            }
        }

        /**
         * Discharges programs whose obligations are settled while an assertion below them still has a proof
         * in progress, so that the enclosing proof receives the next tactic or ender.
         */
        private boolean closeProgramsAboveProof() {
            boolean closed = false;
            while (settledProgramAboveProof()) {
                dischargeTop();
                closed = true;
            }
            return closed;
        }

        private void closeTopUnlessProgram() {
            if (stack.top().filter(assertion -> !assertion.isProgram()).isPresent()) {
                dischargeTop();
            }
        }

        private void dischargeTop() {
            Assertion assertion = stack.pop();
            boolean continueGlom = stack.discharge(assertion, output, glom, documentId);
            if (glom && !continueGlom) {
                warnings.add(new ParseWarning(ParseWarning.Kind.UNTERMINATED_PROOF, depths.size(),
                        "Unterminated proof in " + assertion));
            }
            glom = continueGlom;
        }

        private void malformed(int index, String message) {
            LOGGER.warn("Malformed proof in {} at sentence {}: {}", documentId, index, message);
            warnings.add(new ParseWarning(ParseWarning.Kind.MALFORMED_PROOF, index, message));
            partial = true;
            glom = false;
        }

        /**
         * Places a sentence that does not change the structure, keeping it in source order.
         */
        private void place(String sentence) {
            flushPending();
            Optional<Assertion> top = stack.top();
            if (top.isEmpty()) {
                output.add(sentence);
            } else if (top.get().inProof()) {
                top.get().appendToProof(sentence);
            } else {
                top.get().appendLoose(sentence);
            }
        }

        private void flushPending() {
            if (!stack.hasPending()) {
                return;
            }
            List<String> pending = stack.drainPending();
            Optional<Assertion> top = stack.top();
            for (String token : pending) {
                if (top.isEmpty()) {
                    output.add(token);
                } else if (top.get().inProof()) {
                    top.get().appendToProof(token);
                } else {
                    top.get().appendLoose(token);
                }
            }
        }

        private boolean settledProgramAboveProof() {
            return stack.top().filter(top -> top.isProgram() && !top.canContinueProof()).isPresent()
                    && anyInProof();
        }

        private boolean anyInProof() {
            return stack.assertions().stream().anyMatch(Assertion::inProof);
        }

        private boolean topInProof() {
            return stack.top().filter(Assertion::inProof).isPresent();
        }

        private int depth() {
            int depth = stack.size();
            for (Assertion assertion : stack.assertions()) {
                if (!assertion.isBareProgram() && assertion.inObligation()) {
                    depth++;
                }
            }
            return depth;
        }

        private boolean structuralNesting() {
            for (Assertion assertion : stack.assertions()) {
                if (assertion.openBraces() > 0) {
                    return true;
                }
            }
            return stack.top().filter(Assertion::inObligation).isPresent();
        }
    }
}
