package Powerset;

import Powerset.Model.Automaton;
import Powerset.Model.TransitionEntry;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Conversion of {@link Automaton}s into AutomataLib's compact automata.
 * State IDs of the result follow the declaration order of the source automaton.
 */
public class AutomataLibExport {

    /**
     * @param dfa - a deterministic automaton, e.g. the output of {@link SubsetConstruction}
     * @return equivalent {@link CompactDFA}; partial if {@code dfa} is partial
     * @throws IllegalArgumentException if {@code dfa} has epsilon moves or nondeterministic transitions
     */
    public static <S, I> CompactDFA<I> toCompactDFA(Automaton<S, I> dfa) {
        if (!dfa.isDeterministic()) {
            throw new IllegalArgumentException("Automaton is not deterministic");
        }
        final Alphabet<I> alphabet = dfa.getAlphabet();
        final CompactDFA<I> out = new CompactDFA<>(alphabet, dfa.size());

        for (S s : dfa.getStates()) {
            out.addState(dfa.isAccepting(s));
        }
        out.setInitialState(dfa.getStateId(dfa.getInitialState()));

        for (TransitionEntry<S, I> entry : dfa.getTransitionEntries()) {
            for (S t : entry.targets()) {
                out.setTransition(dfa.getStateId(entry.source()), alphabet.getSymbolIndex(entry.symbol()), dfa.getStateId(t));
            }
        }
        return out;
    }

    /**
     * @param nfa - an automaton without epsilon moves
     * @return equivalent {@link CompactNFA} with a single initial state
     * @throws IllegalArgumentException if {@code nfa} has epsilon moves
     */
    public static <S, I> CompactNFA<I> toCompactNFA(Automaton<S, I> nfa) {
        if (nfa.hasEpsilonTransitions()) {
            throw new IllegalArgumentException("CompactNFA cannot represent epsilon transitions");
        }
        final Alphabet<I> alphabet = nfa.getAlphabet();
        final CompactNFA<I> out = new CompactNFA<>(alphabet, nfa.size());

        for (S s : nfa.getStates()) {
            out.addState(nfa.isAccepting(s));
        }
        out.setInitial(nfa.getStateId(nfa.getInitialState()), true);

        for (TransitionEntry<S, I> entry : nfa.getTransitionEntries()) {
            final Integer src = nfa.getStateId(entry.source());
            for (S t : entry.targets()) {
                final Integer succ = nfa.getStateId(t);
                out.addTransition(src, entry.symbol(), succ);
            }
        }
        return out;
    }
}
