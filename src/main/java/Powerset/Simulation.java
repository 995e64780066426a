package Powerset;

import java.util.BitSet;

import Powerset.Model.Automaton;

/**
 * Direct simulation of an automaton on a word, tracking the epsilon-closed set of current states.
 * Works for NFAs and for the DFAs produced by {@link SubsetConstruction}.
 */
public final class Simulation {

    private Simulation() {
    }

    /**
     * @param automaton - automaton to run
     * @param word - input symbols; a symbol outside the alphabet rejects the word
     * @return whether some run on {@code word} ends in an accepting state
     */
    public static <S, I> boolean accepts(Automaton<S, I> automaton, Iterable<? extends I> word) {
        final BitSet init = new BitSet(automaton.size());
        init.set(automaton.getStateId(automaton.getInitialState()));
        BitSet current = SubsetConstruction.closure(automaton, init);

        for (I sym : word) {
            if (sym == null || !automaton.getAlphabet().contains(sym)) {
                return false;
            }
            current = SubsetConstruction.closure(automaton, SubsetConstruction.move(automaton, current, sym));
            if (current.isEmpty()) {
                return false;
            }
        }
        return current.intersects(SubsetConstruction.acceptingBits(automaton));
    }
}
