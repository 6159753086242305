package LexEquiv.Automaton;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * NFA over alphabet-class indices with epsilon transitions. States are dense integers starting at 0.
 */
public class EpsilonNFA {
    private final int numInputs;
    private final List<IntList> epsilons = new ArrayList<>();
    // per state: alternating (symbol, target) pairs
    private final List<IntList> transitions = new ArrayList<>();
    private final BitSet accepting = new BitSet();
    private int initial = -1;

    public EpsilonNFA(int numInputs) {
        this.numInputs = numInputs;
    }

    public int numInputs() {
        return numInputs;
    }

    public int size() {
        return epsilons.size();
    }

    public int addState() {
        epsilons.add(new IntArrayList(2));
        transitions.add(new IntArrayList(2));
        return epsilons.size() - 1;
    }

    public void addEpsilon(int from, int to) {
        epsilons.get(from).add(to);
    }

    public void addTransition(int from, int symbol, int to) {
        if (symbol < 0 || symbol >= numInputs) {
            throw new IndexOutOfBoundsException("Input " + symbol + " outside [0," + numInputs + ")");
        }
        IntList out = transitions.get(from);
        out.add(symbol);
        out.add(to);
    }

    public void setAccepting(int state, boolean accepting) {
        this.accepting.set(state, accepting);
    }

    public boolean isAccepting(int state) {
        return accepting.get(state);
    }

    public void setInitial(int state) {
        this.initial = state;
    }

    public int getInitial() {
        return initial;
    }

    /**
     * @return whether the state set contains an accepting state
     */
    public boolean isAccepting(BitSet states) {
        return states.intersects(accepting);
    }

    /**
     * Epsilon closure of the initial state.
     */
    public BitSet initialClosure() {
        BitSet init = new BitSet();
        init.set(initial);
        return epsilonClosure(init);
    }

    /**
     * Adds to a copy of {@code states} every state reachable through epsilon transitions.
     */
    public BitSet epsilonClosure(BitSet states) {
        BitSet closure = (BitSet) states.clone();
        IntArrayList stack = new IntArrayList();
        for (int q = states.nextSetBit(0); q >= 0; q = states.nextSetBit(q + 1)) {
            stack.push(q);
        }
        while (!stack.isEmpty()) {
            int q = stack.popInt();
            IntList eps = epsilons.get(q);
            for (int i = 0; i < eps.size(); i++) {
                int t = eps.getInt(i);
                if (!closure.get(t)) {
                    closure.set(t);
                    stack.push(t);
                }
            }
        }
        return closure;
    }

    /**
     * Epsilon-closed successor set of {@code states} on {@code symbol}. Empty if no state has a transition on it.
     */
    public BitSet successor(BitSet states, int symbol) {
        BitSet succ = new BitSet();
        for (int q = states.nextSetBit(0); q >= 0; q = states.nextSetBit(q + 1)) {
            IntList out = transitions.get(q);
            for (int i = 0; i < out.size(); i += 2) {
                if (out.getInt(i) == symbol) {
                    succ.set(out.getInt(i + 1));
                }
            }
        }
        return epsilonClosure(succ);
    }

    /**
     * Runs the automaton on a sequence of class indices.
     */
    public boolean accepts(int... symbols) {
        BitSet current = initialClosure();
        for (int symbol : symbols) {
            current = successor(current, symbol);
            if (current.isEmpty()) {
                return false;
            }
        }
        return isAccepting(current);
    }

    public int numTransitions() {
        int result = 0;
        for (int q = 0; q < size(); q++) {
            result += transitions.get(q).size() / 2 + epsilons.get(q).size();
        }
        return result;
    }
}
