package Powerset.Model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import Powerset.Model.MalformedAutomatonException.Field;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;

/**
 * Finite automaton with a single initial state, possibly nondeterministic and possibly with epsilon moves.
 * <p>
 * Instances are immutable. They are created through {@link #build} (or {@link AutomatonBuilder}), which validates
 * every reference, or by the subset construction. States are numbered in declaration order; the subset construction
 * uses these numbers as bit indices.
 *
 * @param <S> state type
 * @param <I> input symbol type; {@code null} is reserved for the empty symbol
 */
public final class Automaton<S, I> {
    public static final int MISSING_STATE = -1;

    private final List<S> states;
    private final Object2IntMap<S> stateIds;
    private final Alphabet<I> alphabet;
    private final Map<S, Map<I, Set<S>>> transitions;
    private final Map<S, Set<S>> epsilonTransitions;
    private final S initialState;
    private final Set<S> acceptingStates;

    private Automaton(List<S> states,
                      Object2IntMap<S> stateIds,
                      Alphabet<I> alphabet,
                      Map<S, Map<I, Set<S>>> transitions,
                      Map<S, Set<S>> epsilonTransitions,
                      S initialState,
                      Set<S> acceptingStates) {
        this.states = states;
        this.stateIds = stateIds;
        this.alphabet = alphabet;
        this.transitions = transitions;
        this.epsilonTransitions = epsilonTransitions;
        this.initialState = initialState;
        this.acceptingStates = acceptingStates;
    }

    /**
     * Validate and build an automaton. Entries sharing a (source, symbol) pair are merged into one entry whose
     * targets are the union of all of them.
     *
     * @param states - declared states, duplicates are ignored
     * @param alphabet - input symbols, excluding the empty symbol
     * @param transitionEntries - transition relation; a {@code null} symbol is an epsilon move
     * @param start - initial state
     * @param accept - accepting states
     * @return the automaton
     * @throws MalformedAutomatonException if anything refers to an undeclared state or symbol
     */
    public static <S, I> Automaton<S, I> build(Collection<? extends S> states,
                                               Collection<? extends I> alphabet,
                                               Collection<TransitionEntry<S, I>> transitionEntries,
                                               S start,
                                               Collection<? extends S> accept) {
        final List<S> stateList = new ArrayList<>(states.size());
        final Object2IntMap<S> stateIds = new Object2IntOpenHashMap<>(states.size());
        stateIds.defaultReturnValue(MISSING_STATE);
        for (S s : states) {
            if (s == null) {
                throw new MalformedAutomatonException(Field.STATES, null, "States must not be null");
            }
            if (!stateIds.containsKey(s)) {
                stateIds.put(s, stateList.size());
                stateList.add(s);
            }
        }

        final Set<I> symbols = new LinkedHashSet<>(alphabet);
        if (symbols.contains(null)) {
            throw new MalformedAutomatonException(Field.ALPHABET, null,
                "The empty symbol cannot be part of the alphabet");
        }

        if (start == null || !stateIds.containsKey(start)) {
            throw new MalformedAutomatonException(Field.START, start, "Start state " + start + " is not a declared state");
        }

        final Set<S> acceptSet = new LinkedHashSet<>();
        for (S s : accept) {
            if (s == null || !stateIds.containsKey(s)) {
                throw new MalformedAutomatonException(Field.ACCEPT, s, "Accept state " + s + " is not a declared state");
            }
            acceptSet.add(s);
        }

        // accumulate first, then freeze; repeated (source, symbol) pairs are unioned
        final Map<S, Map<I, Set<S>>> delta = new LinkedHashMap<>();
        final Map<S, Set<S>> epsilon = new LinkedHashMap<>();
        for (TransitionEntry<S, I> entry : transitionEntries) {
            final S source = entry.source();
            if (source == null || !stateIds.containsKey(source)) {
                throw new MalformedAutomatonException(Field.TRANSITION_SOURCE, source,
                    "Transition " + entry + " starts in undeclared state " + source);
            }
            if (!entry.isEpsilon() && !symbols.contains(entry.symbol())) {
                throw new MalformedAutomatonException(Field.TRANSITION_SYMBOL, entry.symbol(),
                    "Transition " + entry + " uses symbol " + entry.symbol() + " outside the alphabet");
            }
            for (S t : entry.targets()) {
                if (t == null || !stateIds.containsKey(t)) {
                    throw new MalformedAutomatonException(Field.TRANSITION_TARGET, t,
                        "Transition " + entry + " leads to undeclared state " + t);
                }
            }

            final Set<S> targets = entry.isEpsilon()
                ? epsilon.computeIfAbsent(source, k -> new LinkedHashSet<>())
                : delta.computeIfAbsent(source, k -> new LinkedHashMap<>())
                       .computeIfAbsent(entry.symbol(), k -> new LinkedHashSet<>());
            targets.addAll(entry.targets());
        }

        final Map<S, Map<I, Set<S>>> frozenDelta = new HashMap<>(delta.size());
        for (Map.Entry<S, Map<I, Set<S>>> e : delta.entrySet()) {
            final Map<I, Set<S>> bySymbol = new LinkedHashMap<>(e.getValue().size());
            for (Map.Entry<I, Set<S>> t : e.getValue().entrySet()) {
                bySymbol.put(t.getKey(), Collections.unmodifiableSet(t.getValue()));
            }
            frozenDelta.put(e.getKey(), Collections.unmodifiableMap(bySymbol));
        }
        final Map<S, Set<S>> frozenEpsilon = new HashMap<>(epsilon.size());
        for (Map.Entry<S, Set<S>> e : epsilon.entrySet()) {
            frozenEpsilon.put(e.getKey(), Collections.unmodifiableSet(e.getValue()));
        }

        return new Automaton<>(Collections.unmodifiableList(stateList),
                               stateIds,
                               Alphabets.fromCollection(symbols),
                               frozenDelta,
                               frozenEpsilon,
                               start,
                               Collections.unmodifiableSet(acceptSet));
    }

    public static <S, I> AutomatonBuilder<S, I> builder() {
        return new AutomatonBuilder<>();
    }

    /**
     * @return states in declaration order
     */
    public List<S> getStates() {
        return states;
    }

    public int size() {
        return states.size();
    }

    public Alphabet<I> getAlphabet() {
        return alphabet;
    }

    public S getInitialState() {
        return initialState;
    }

    public Set<S> getAcceptingStates() {
        return acceptingStates;
    }

    public boolean isAccepting(S state) {
        return acceptingStates.contains(state);
    }

    public boolean containsState(S state) {
        return stateIds.containsKey(state);
    }

    /**
     * @return the declaration index of the state, or {@link #MISSING_STATE}
     */
    public int getStateId(S state) {
        return stateIds.getInt(state);
    }

    public S getState(int id) {
        return states.get(id);
    }

    /**
     * Successors of a state on an alphabet symbol. Unknown pairs yield the empty set.
     * Passing {@code null} as symbol returns the epsilon successors.
     */
    public Set<S> getTransitions(S state, I symbol) {
        if (symbol == null) {
            return getEpsilonTransitions(state);
        }
        final Map<I, Set<S>> bySymbol = transitions.get(state);
        if (bySymbol == null) {
            return Collections.emptySet();
        }
        return bySymbol.getOrDefault(symbol, Collections.emptySet());
    }

    public Set<S> getEpsilonTransitions(S state) {
        return epsilonTransitions.getOrDefault(state, Collections.emptySet());
    }

    public boolean hasEpsilonTransitions() {
        for (Set<S> targets : epsilonTransitions.values()) {
            if (!targets.isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Every transition of the automaton, one entry per (source, symbol) pair, sources in declaration order and
     * epsilon entries after the symbol entries of their source.
     */
    public List<TransitionEntry<S, I>> getTransitionEntries() {
        final List<TransitionEntry<S, I>> result = new ArrayList<>();
        for (S s : states) {
            final Map<I, Set<S>> bySymbol = transitions.get(s);
            if (bySymbol != null) {
                for (I i : alphabet) {
                    final Set<S> targets = bySymbol.get(i);
                    if (targets != null) {
                        result.add(TransitionEntry.of(s, i, targets));
                    }
                }
            }
            final Set<S> eps = epsilonTransitions.get(s);
            if (eps != null) {
                result.add(TransitionEntry.of(s, null, eps));
            }
        }
        return result;
    }

    /**
     * @return whether every (state, symbol) pair has at most one successor and there are no epsilon moves
     */
    public boolean isDeterministic() {
        if (hasEpsilonTransitions()) {
            return false;
        }
        for (Map<I, Set<S>> bySymbol : transitions.values()) {
            for (Set<S> targets : bySymbol.values()) {
                if (targets.size() > 1) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "Automaton{states=" + states.size()
            + ", alphabet=" + alphabet
            + ", start=" + initialState
            + ", accept=" + acceptingStates.size()
            + "}";
    }
}
