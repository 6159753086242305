package LexEquiv.Automaton;

import java.util.BitSet;

import LexEquiv.Alphabet.AlphabetPartition;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.word.Word;

/**
 * A total DFA over the classes of an {@link AlphabetPartition}. The underlying automaton's input symbols are the
 * partition's class indices, and every state has a successor on every class.
 */
public final class LexerDFA {
    private final CompactDFA<Integer> automaton;
    private final AlphabetPartition partition;

    /**
     * @throws IllegalArgumentException if the automaton has no initial state, a different alphabet size than the
     *                                  partition, or a missing transition
     */
    public LexerDFA(CompactDFA<Integer> automaton, AlphabetPartition partition) {
        if (automaton.numInputs() != partition.size()) {
            throw new IllegalArgumentException("Automaton has " + automaton.numInputs() + " inputs, partition has "
                                               + partition.size() + " classes");
        }
        if (automaton.getIntInitialState() < 0) {
            throw new IllegalArgumentException("Automaton has no initial state");
        }
        for (int q = 0; q < automaton.size(); q++) {
            for (int i = 0; i < partition.size(); i++) {
                if (automaton.getSuccessor(q, i) < 0) {
                    throw new IllegalArgumentException("Transition function is not total: state " + q
                                                       + " has no successor on " + partition.describeClass(i));
                }
            }
        }
        this.automaton = automaton;
        this.partition = partition;
    }

    public CompactDFA<Integer> getAutomaton() {
        return automaton;
    }

    public AlphabetPartition getPartition() {
        return partition;
    }

    public int size() {
        return automaton.size();
    }

    public int numInputs() {
        return partition.size();
    }

    public int getInitialState() {
        return automaton.getIntInitialState();
    }

    public boolean isAccepting(int state) {
        return automaton.isAccepting(state);
    }

    public int getSuccessor(int state, int classIndex) {
        return automaton.getSuccessor(state, classIndex);
    }

    public BitSet getAcceptingStates() {
        BitSet result = new BitSet();
        for (int q = 0; q < automaton.size(); q++) {
            if (automaton.isAccepting(q)) {
                result.set(q);
            }
        }
        return result;
    }

    public boolean accepts(Word<Integer> classes) {
        int q = getInitialState();
        for (int classIndex : classes) {
            q = getSuccessor(q, classIndex);
        }
        return isAccepting(q);
    }

    /**
     * @throws LexEquiv.Alphabet.AlphabetException if {@code s} contains a character outside the partition's universe
     */
    public boolean accepts(String s) {
        return accepts(partition.classify(s));
    }

    @Override
    public String toString() {
        return "LexerDFA[states=" + size() + ", accepting=" + getAcceptingStates().cardinality() + ", classes="
               + numInputs() + "]";
    }
}
