package Powerset;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import Powerset.Model.Automaton;
import Powerset.Model.Cancellation;
import Powerset.Model.StateSet;
import Powerset.Model.TransitionEntry;
import Powerset.Model.UnboundedConstructionException;
import Powerset.Registry.SubsetRegistry;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntPriorityQueue;
import net.automatalib.alphabet.Alphabet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subset (powerset) construction of a DFA from an NFA with epsilon moves.
 * <p>
 * Subsets are handled as {@link BitSet}s over the NFA's state IDs and numbered by a {@link SubsetRegistry}. The
 * worklist is FIFO and the alphabet is iterated in declaration order, so two runs on the same NFA produce the same
 * DFA with states in the same order, and the same trace.
 * <p>
 * By default a symbol without successors produces no DFA transition, i.e. the DFA is partial. With completion
 * enabled these pairs lead to a non-accepting dead state, the empty subset, instead.
 */
public class SubsetConstruction {
    private static final Logger LOGGER = LoggerFactory.getLogger(SubsetConstruction.class);

    private final Cancellation cancellation;
    private boolean trace;
    private boolean complete;

    public SubsetConstruction() {
        this(new Cancellation());
    }

    public SubsetConstruction(Cancellation cancellation) {
        this.cancellation = cancellation;
    }

    /**
     * Record a {@link TraceRecord} for every worklist iteration.
     */
    public SubsetConstruction withTrace(boolean trace) {
        this.trace = trace;
        return this;
    }

    /**
     * Route missing transitions to an explicit dead state.
     */
    public SubsetConstruction withCompletion(boolean complete) {
        this.complete = complete;
        return this;
    }

    /**
     * Determinize with default settings, recording the trace.
     * @param nfa - Original NFA
     * @return DFA and construction trace
     */
    public static <S, I> DeterminizationResult<S, I> determinize(Automaton<S, I> nfa) {
        return new SubsetConstruction().withTrace(true).construct(nfa);
    }

    /**
     * Epsilon-closure of a set of states: every state reachable with zero or more epsilon moves.
     * @param nfa - automaton
     * @param states - declared states of the automaton
     * @return closure, containing all of {@code states}
     */
    public static <S, I> Set<S> epsilonClosure(Automaton<S, I> nfa, Collection<? extends S> states) {
        return toStates(nfa, closure(nfa, toBits(nfa, states)));
    }

    /**
     * Direct successors of a set of states on one symbol. No epsilon-closure is applied.
     * @param nfa - automaton
     * @param states - declared states of the automaton
     * @param symbol - alphabet symbol, never the empty symbol
     * @return union of the successors, possibly empty
     */
    public static <S, I> Set<S> move(Automaton<S, I> nfa, Collection<? extends S> states, I symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("Move is not defined for the empty symbol");
        }
        return toStates(nfa, move(nfa, toBits(nfa, states), symbol));
    }

    static <S, I> BitSet closure(Automaton<S, I> nfa, BitSet states) {
        final BitSet result = (BitSet) states.clone();
        final Deque<S> stack = new ArrayDeque<>();
        for (int i = states.nextSetBit(0); i >= 0; i = states.nextSetBit(i + 1)) {
            stack.push(nfa.getState(i));
        }

        while (!stack.isEmpty()) {
            final S s = stack.pop();
            for (S t : nfa.getEpsilonTransitions(s)) {
                final int id = nfa.getStateId(t);
                if (!result.get(id)) {
                    result.set(id);
                    stack.push(t);
                }
            }
        }
        return result;
    }

    static <S, I> BitSet move(Automaton<S, I> nfa, BitSet states, I symbol) {
        final BitSet result = new BitSet();
        for (int i = states.nextSetBit(0); i >= 0; i = states.nextSetBit(i + 1)) {
            for (S t : nfa.getTransitions(nfa.getState(i), symbol)) {
                result.set(nfa.getStateId(t));
            }
        }
        return result;
    }

    static <S, I> BitSet acceptingBits(Automaton<S, I> nfa) {
        final BitSet result = new BitSet(nfa.size());
        for (S s : nfa.getAcceptingStates()) {
            result.set(nfa.getStateId(s));
        }
        return result;
    }

    /**
     * Run the subset construction.
     * @param nfa - Original NFA
     * @return DFA language-equivalent to {@code nfa}, and the trace if enabled
     * @throws UnboundedConstructionException if the {@link Cancellation} stops the construction
     */
    public <S, I> DeterminizationResult<S, I> construct(Automaton<S, I> nfa) {
        final Alphabet<I> alphabet = nfa.getAlphabet();
        final BitSet accepting = acceptingBits(nfa);
        final SubsetRegistry registry = new SubsetRegistry();
        final IntPriorityQueue worklist = new IntArrayFIFOQueue();
        // successors[state][symbol index], MISSING_ELEMENT where there is no transition
        final List<int[]> successors = new ArrayList<>();
        final List<TraceRecord<S, I>> records = new ArrayList<>();

        final BitSet init = closure(nfa, singleton(nfa, nfa.getInitialState()));
        discover(registry, init, worklist, successors, alphabet.size());

        int iterations = 0;
        while (!worklist.isEmpty()) {
            if (cancellation.isInterrupted()) {
                throw new UnboundedConstructionException(cancellation, registry.size());
            }
            final int current = worklist.dequeueInt();
            final BitSet subset = registry.getSubset(current);
            final List<SymbolStep<S, I>> steps = trace ? new ArrayList<>(alphabet.size()) : Collections.emptyList();

            int symbolIdx = 0;
            for (I sym : alphabet) {
                final BitSet mv = move(nfa, subset, sym);
                int succ = SubsetRegistry.MISSING_ELEMENT;
                boolean discovered = false;
                BitSet next = mv;

                if (!mv.isEmpty() || complete) {
                    next = closure(nfa, mv);
                    succ = registry.get(next);
                    if (succ == SubsetRegistry.MISSING_ELEMENT) {
                        // add new state to DFA and to worklist
                        succ = discover(registry, next, worklist, successors, alphabet.size());
                        discovered = true;
                        if (cancellation.isAboveThreshold(registry.size())) {
                            throw new UnboundedConstructionException(cancellation, registry.size());
                        }
                    }
                    successors.get(current)[symbolIdx] = succ;
                }

                if (trace) {
                    final boolean transition = succ != SubsetRegistry.MISSING_ELEMENT;
                    steps.add(new SymbolStep<>(sym,
                                               toStateSet(nfa, mv),
                                               transition ? toStateSet(nfa, next) : StateSet.<S>empty(),
                                               transition,
                                               discovered));
                }
                symbolIdx++;
            }

            if (trace) {
                records.add(new TraceRecord<>(iterations, toStateSet(nfa, subset), steps));
            }
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Iteration {}: processed {} - {} subsets left in worklist - {} DFA states",
                             iterations, toStateSet(nfa, subset), worklist.size(), registry.size());
            }
            iterations++;
        }

        final Automaton<StateSet<S>, I> dfa = toDFA(nfa, registry, successors, accepting);
        LOGGER.info("Subset construction: {} NFA states -> {} DFA states in {} iterations",
                    nfa.size(), dfa.size(), iterations);
        return new DeterminizationResult<>(dfa, records, iterations);
    }

    private static int discover(SubsetRegistry registry,
                                BitSet subset,
                                IntPriorityQueue worklist,
                                List<int[]> successors,
                                int alphabetSize) {
        final int id = registry.put(subset);
        final int[] row = new int[alphabetSize];
        Arrays.fill(row, SubsetRegistry.MISSING_ELEMENT);
        successors.add(row);
        worklist.enqueue(id);
        return id;
    }

    private static <S, I> Automaton<StateSet<S>, I> toDFA(Automaton<S, I> nfa,
                                                          SubsetRegistry registry,
                                                          List<int[]> successors,
                                                          BitSet accepting) {
        final List<StateSet<S>> states = new ArrayList<>(registry.size());
        final List<StateSet<S>> accept = new ArrayList<>();
        for (int id = 0; id < registry.size(); id++) {
            final BitSet subset = registry.getSubset(id);
            final StateSet<S> state = toStateSet(nfa, subset);
            states.add(state);
            if (subset.intersects(accepting)) {
                accept.add(state);
            }
        }

        final Alphabet<I> alphabet = nfa.getAlphabet();
        final List<TransitionEntry<StateSet<S>, I>> entries = new ArrayList<>();
        for (int id = 0; id < registry.size(); id++) {
            final int[] row = successors.get(id);
            for (int a = 0; a < row.length; a++) {
                if (row[a] != SubsetRegistry.MISSING_ELEMENT) {
                    entries.add(TransitionEntry.of(states.get(id), alphabet.getSymbol(a), List.of(states.get(row[a]))));
                }
            }
        }

        return Automaton.build(states, alphabet, entries, states.get(0), accept);
    }

    private static <S, I> BitSet singleton(Automaton<S, I> nfa, S state) {
        final BitSet result = new BitSet(nfa.size());
        result.set(nfa.getStateId(state));
        return result;
    }

    private static <S, I> BitSet toBits(Automaton<S, I> nfa, Collection<? extends S> states) {
        final BitSet result = new BitSet(nfa.size());
        for (S s : states) {
            final int id = nfa.getStateId(s);
            if (id == Automaton.MISSING_STATE) {
                throw new IllegalArgumentException("Unknown state: " + s);
            }
            result.set(id);
        }
        return result;
    }

    private static <S, I> Set<S> toStates(Automaton<S, I> nfa, BitSet bits) {
        final Set<S> result = new LinkedHashSet<>();
        for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
            result.add(nfa.getState(i));
        }
        return result;
    }

    static <S, I> StateSet<S> toStateSet(Automaton<S, I> nfa, BitSet bits) {
        return StateSet.of(toStates(nfa, bits));
    }
}
