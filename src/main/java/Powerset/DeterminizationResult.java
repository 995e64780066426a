package Powerset;

import java.util.List;

import Powerset.Model.Automaton;
import Powerset.Model.StateSet;

/**
 * Output of a subset construction.
 *
 * @param dfa - the deterministic automaton; its states are subsets of the NFA states
 * @param trace - one record per worklist iteration, empty if tracing was off
 * @param iterations - number of worklist iterations
 */
public record DeterminizationResult<S, I>(Automaton<StateSet<S>, I> dfa, List<TraceRecord<S, I>> trace, int iterations) {

    public DeterminizationResult {
        trace = List.copyOf(trace);
    }
}
