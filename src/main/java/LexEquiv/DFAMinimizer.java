package LexEquiv;

import LexEquiv.Automaton.LexerDFA;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;

/**
 * Minimization of total {@link LexerDFA}s with Hopcroft's partition refinement. Unreachable states are pruned; the
 * reject sink survives whenever it is reachable, so the result stays total.
 */
public class DFAMinimizer {
    public static boolean DEBUG = false;

    private DFAMinimizer() {}

    public static LexerDFA minimize(LexerDFA dfa) {
        final Alphabet<Integer> alphabet = dfa.getPartition().getInputAlphabet();
        final CompactDFA<Integer> minimized = HopcroftMinimizer.minimizeDFA(dfa.getAutomaton(), alphabet);
        if (DEBUG) {
            System.out.println("DEBUG: Minimization: " + dfa.size() + " -> " + minimized.size() + " states");
        }
        return new LexerDFA(minimized, dfa.getPartition());
    }
}
