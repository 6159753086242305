package LexEquiv.Registry;

import java.util.BitSet;

/**
 * Interning of NFA state sets to DFA state IDs during subset construction.
 */
public interface Registry {
    int MISSING_ELEMENT = -1;

    /**
     * Get the DFA state ID registered for a set of NFA states.
     * @param stateSet set of NFA states
     * @return DFA state ID or MISSING_ELEMENT if the set has not been registered.
     */
    int get(BitSet stateSet);

    /**
     * Register a new set of NFA states under a (fixed) DFA state ID.
     * @param stateSet set of NFA states; must not be modified afterwards
     * @param stateID DFA state ID
     */
    void put(BitSet stateSet, int stateID);

    /**
     * Number of registered sets.
     */
    int size();
}
