package Powerset;

import java.util.List;

import Powerset.Model.StateSet;

/**
 * One worklist iteration of the subset construction.
 */
public record TraceRecord<S, I>(int iteration, StateSet<S> subset, List<SymbolStep<S, I>> steps) {

    public TraceRecord {
        steps = List.copyOf(steps);
    }

    @Override
    public String toString() {
        return iteration + ": " + subset + " " + steps;
    }
}
