package LexEquiv;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;

import LexEquiv.Alphabet.AlphabetPartition;
import LexEquiv.Automaton.EpsilonNFA;
import LexEquiv.Automaton.LexerDFA;
import LexEquiv.Model.DeterminizeRecord;
import LexEquiv.Registry.AddressRegistry;
import LexEquiv.Registry.Registry;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * Subset construction from an {@link EpsilonNFA} to a total {@link LexerDFA}.
 * <p>
 * Each DFA state stands for an epsilon-closed set of NFA states. The empty set is a regular DFA state like any
 * other: it is non-accepting and loops to itself on every class, so it serves as the reject sink and keeps the
 * transition function total.
 */
public class SubsetConstruction {
    public static boolean DEBUG = false;
    private static final long STATES_EXPLORED_PERIOD = 10000L;

    private SubsetConstruction() {}

    public static LexerDFA determinize(EpsilonNFA nfa, AlphabetPartition partition) {
        return determinize(nfa, partition, new AddressRegistry());
    }

    /**
     * @param nfa - NFA over the class indices of {@code partition}
     * @param partition - shared alphabet partition
     * @param registry - interning of NFA state sets; must be empty
     * @return total DFA recognizing the NFA's language
     */
    public static LexerDFA determinize(EpsilonNFA nfa, AlphabetPartition partition, Registry registry) {
        if (nfa.numInputs() != partition.size()) {
            throw new IllegalArgumentException("NFA has " + nfa.numInputs() + " inputs, partition has "
                                               + partition.size() + " classes");
        }
        final int numInputs = partition.size();
        final CompactDFA<Integer> out = new CompactDFA<>(partition.getInputAlphabet());
        final Deque<DeterminizeRecord> stack = new ArrayDeque<>();

        BitSet init = nfa.initialClosure();
        int initOut = out.addInitialState(nfa.isAccepting(init));
        registry.put(init, initOut);
        stack.push(new DeterminizeRecord(init, initOut));

        long statesExplored = 0;
        while (!stack.isEmpty()) {
            DeterminizeRecord curr = stack.pop();
            BitSet inState = curr.inputState();
            int outState = curr.outputAddress();

            for (int i = 0; i < numInputs; i++) {
                BitSet succ = nfa.successor(inState, i);
                int outSucc = registry.get(succ);
                if (outSucc == Registry.MISSING_ELEMENT) {
                    // add new state to DFA and to stack
                    outSucc = out.addState(nfa.isAccepting(succ));
                    registry.put(succ, outSucc);
                    stack.push(new DeterminizeRecord(succ, outSucc));
                }
                out.setTransition(outState, i, outSucc);
            }
            statesExplored++;

            if (DEBUG && statesExplored % STATES_EXPLORED_PERIOD == 0) {
                System.out.println("DEBUG: Explored " + statesExplored + " states - "
                    + stack.size() + " states left in queue - " + out.size() + " states added");
            }
        }
        if (DEBUG) {
            System.out.println("DEBUG: Subset construction: " + nfa.size() + " NFA states -> " + out.size()
                               + " DFA states over " + numInputs + " classes");
        }

        return new LexerDFA(out, partition);
    }
}
