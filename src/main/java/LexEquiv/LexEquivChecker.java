package LexEquiv;

import java.util.List;

import LexEquiv.Alphabet.AlphabetPartition;
import LexEquiv.Alphabet.AlphabetPartitioner;
import LexEquiv.Automaton.EpsilonNFA;
import LexEquiv.Automaton.LexerDFA;
import LexEquiv.Automaton.ThompsonBuilder;
import LexEquiv.Model.CheckerOptions;
import LexEquiv.Model.EquivalenceResult;
import LexEquiv.Pattern.Pattern;
import LexEquiv.Pattern.RuleParser;
import LexEquiv.Pattern.RuleSyntaxException;

/**
 * Entry point of the comparison pipeline: parse both rule blocks, partition their alphabet jointly, build a DFA for
 * each, optionally minimize, and check equivalence.
 * <p>
 * Instances are immutable and hold no state between comparisons.
 */
public class LexEquivChecker {
    private final CheckerOptions options;

    public LexEquivChecker() {
        this(CheckerOptions.defaults());
    }

    public LexEquivChecker(CheckerOptions options) {
        this.options = options;
    }

    public CheckerOptions getOptions() {
        return options;
    }

    /**
     * Parses one rule block into the union of its rule patterns.
     */
    public Pattern compileBlock(String patternBlockText) throws RuleSyntaxException {
        return RuleParser.compileBlock(patternBlockText);
    }

    /**
     * Joint partition of the given trees over the configured universe.
     */
    public AlphabetPartition partition(Pattern... trees) {
        return AlphabetPartitioner.partition(options.universe(), trees);
    }

    /**
     * Compiles a pattern tree into a total DFA over {@code alphabet}, minimized if so configured.
     */
    public LexerDFA buildDfa(Pattern tree, AlphabetPartition alphabet) {
        final EpsilonNFA nfa = ThompsonBuilder.build(tree, alphabet);
        final LexerDFA dfa = SubsetConstruction.determinize(nfa, alphabet);
        return options.minimize() ? DFAMinimizer.minimize(dfa) : dfa;
    }

    public EquivalenceResult checkEquivalence(LexerDFA dfaLeft, LexerDFA dfaRight) {
        return EquivalenceOracle.checkEquivalence(dfaLeft, dfaRight, options.witnessOrder());
    }

    /**
     * Runs the whole pipeline on two rule blocks.
     *
     * @throws RuleSyntaxException if either block is malformed; the comparison is not attempted
     */
    public Comparison compare(String leftBlock, String rightBlock) throws RuleSyntaxException {
        final Pattern leftTree = compileBlock(leftBlock);
        final Pattern rightTree = compileBlock(rightBlock);
        final AlphabetPartition alphabet = partition(leftTree, rightTree);
        final LexerDFA leftDfa = buildDfa(leftTree, alphabet);
        final LexerDFA rightDfa = buildDfa(rightTree, alphabet);
        return new Comparison(alphabet, List.of(leftDfa, rightDfa), checkEquivalence(leftDfa, rightDfa));
    }

    /**
     * Result of {@link #compare(String, String)} together with the artifacts it was computed from, for diagnostics.
     *
     * @param alphabet the joint partition
     * @param dfas     left and right DFA, in that order
     * @param result   the equivalence verdict
     */
    public record Comparison(AlphabetPartition alphabet, List<LexerDFA> dfas, EquivalenceResult result) {
        public Comparison {
            dfas = List.copyOf(dfas);
        }

        public LexerDFA left() {
            return dfas.get(0);
        }

        public LexerDFA right() {
            return dfas.get(1);
        }
    }
}
