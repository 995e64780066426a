package Powerset;

import Powerset.Model.StateSet;

/**
 * What one alphabet symbol did to a dequeued subset.
 *
 * @param symbol - the input symbol
 * @param move - direct successors, before closure
 * @param closure - epsilon-closure of the move; empty when the move is empty
 * @param transition - whether a DFA transition was recorded
 * @param discovered - whether the closure was a new DFA state
 */
public record SymbolStep<S, I>(I symbol, StateSet<S> move, StateSet<S> closure, boolean transition, boolean discovered) {

    @Override
    public String toString() {
        if (!transition) {
            return symbol + ": " + move + " (no transition)";
        }
        return symbol + ": " + move + " -> " + closure + (discovered ? " (new)" : "");
    }
}
