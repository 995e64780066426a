package Powerset.Model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Accumulates the parts of an automaton description and hands them to {@link Automaton#build}.
 * Transitions added repeatedly for the same (source, symbol) pair are unioned.
 */
public class AutomatonBuilder<S, I> {
    private final Set<S> states = new LinkedHashSet<>();
    private final Set<I> alphabet = new LinkedHashSet<>();
    private final Map<TransitionKey<S, I>, Set<S>> transitions = new LinkedHashMap<>();
    private final Set<S> accept = new LinkedHashSet<>();
    private S start;

    public AutomatonBuilder<S, I> withStates(Collection<? extends S> states) {
        this.states.addAll(states);
        return this;
    }

    @SafeVarargs
    public final AutomatonBuilder<S, I> withStates(S... states) {
        return withStates(Arrays.asList(states));
    }

    public AutomatonBuilder<S, I> withAlphabet(Collection<? extends I> symbols) {
        this.alphabet.addAll(symbols);
        return this;
    }

    @SafeVarargs
    public final AutomatonBuilder<S, I> withAlphabet(I... symbols) {
        return withAlphabet(Arrays.asList(symbols));
    }

    public AutomatonBuilder<S, I> withStart(S start) {
        this.start = start;
        return this;
    }

    public AutomatonBuilder<S, I> withAccepting(Collection<? extends S> states) {
        this.accept.addAll(states);
        return this;
    }

    @SafeVarargs
    public final AutomatonBuilder<S, I> withAccepting(S... states) {
        return withAccepting(Arrays.asList(states));
    }

    public AutomatonBuilder<S, I> withTransition(S source, I symbol, Collection<? extends S> targets) {
        transitions.computeIfAbsent(new TransitionKey<>(source, symbol), k -> new LinkedHashSet<>()).addAll(targets);
        return this;
    }

    @SafeVarargs
    public final AutomatonBuilder<S, I> withTransition(S source, I symbol, S... targets) {
        return withTransition(source, symbol, Arrays.asList(targets));
    }

    @SafeVarargs
    public final AutomatonBuilder<S, I> withEpsilon(S source, S... targets) {
        return withTransition(source, null, Arrays.asList(targets));
    }

    /**
     * @throws MalformedAutomatonException if the accumulated description is inconsistent
     */
    public Automaton<S, I> build() {
        final List<TransitionEntry<S, I>> entries = new ArrayList<>(transitions.size());
        for (Map.Entry<TransitionKey<S, I>, Set<S>> e : transitions.entrySet()) {
            entries.add(TransitionEntry.of(e.getKey().source(), e.getKey().symbol(), e.getValue()));
        }
        return Automaton.build(states, alphabet, entries, start, accept);
    }

    private record TransitionKey<S, I>(S source, I symbol) { }
}
