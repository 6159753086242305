package LexEquiv.Registry;

import java.util.BitSet;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

public class AddressRegistry implements Registry {
    private final Object2IntMap<BitSet> set2State;

    public AddressRegistry() {
        this.set2State = new Object2IntOpenHashMap<>();
        this.set2State.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
    }

    @Override
    public int get(BitSet stateSet) {
        return set2State.getInt(stateSet);
    }

    @Override
    public void put(BitSet stateSet, int stateID) {
        if (stateID < 0) {
            throw new IllegalArgumentException("Invalid state ID: " + stateID);
        }
        this.set2State.put(stateSet, stateID);
    }

    @Override
    public int size() {
        return set2State.size();
    }

    @Override
    public String toString() {
        return "Address[" + size() + "]";
    }
}
