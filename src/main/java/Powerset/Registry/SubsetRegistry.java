package Powerset.Registry;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Assigns consecutive DFA state IDs to the subsets discovered by the subset construction.
 * BitSet equality is content based, so a subset serves directly as its own canonical key.
 */
public class SubsetRegistry {
    public static final int MISSING_ELEMENT = -1;

    private final Object2IntMap<BitSet> subset2State;
    private final List<BitSet> state2Subset;

    public SubsetRegistry() {
        this.subset2State = new Object2IntOpenHashMap<>();
        this.subset2State.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
        this.state2Subset = new ArrayList<>();
    }

    /**
     * Get the state ID of a subset.
     * @param subset NFA state indices
     * @return state ID or MISSING_ELEMENT if the subset was not registered yet.
     */
    public int get(BitSet subset) {
        return subset2State.getInt(subset);
    }

    /**
     * Register a new subset. The registry keeps its own copy, callers may keep mutating theirs.
     * @param subset NFA state indices
     * @return the new state ID
     * @throws IllegalArgumentException if the subset is already registered
     */
    public int put(BitSet subset) {
        if (subset2State.containsKey(subset)) {
            throw new IllegalArgumentException("Subset already registered: " + subset);
        }
        final BitSet key = (BitSet) subset.clone();
        final int stateID = state2Subset.size();
        subset2State.put(key, stateID);
        state2Subset.add(key);
        return stateID;
    }

    /**
     * @return the subset of a state ID; must not be mutated
     */
    public BitSet getSubset(int stateID) {
        return state2Subset.get(stateID);
    }

    public int size() {
        return state2Subset.size();
    }

    @Override
    public String toString() {
        return "SubsetRegistry" + state2Subset;
    }
}
