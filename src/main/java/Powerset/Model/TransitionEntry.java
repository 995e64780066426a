package Powerset.Model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One (source, symbol) -> targets entry of a transition relation.
 * A {@code null} symbol is the empty symbol, i.e. an epsilon move.
 */
public record TransitionEntry<S, I>(S source, I symbol, Set<S> targets) {

    public TransitionEntry {
        targets = Collections.unmodifiableSet(new LinkedHashSet<>(targets));
    }

    public static <S, I> TransitionEntry<S, I> of(S source, I symbol, Collection<? extends S> targets) {
        return new TransitionEntry<>(source, symbol, new LinkedHashSet<>(targets));
    }

    @SafeVarargs
    public static <S, I> TransitionEntry<S, I> of(S source, I symbol, S... targets) {
        return of(source, symbol, Arrays.asList(targets));
    }

    @SafeVarargs
    public static <S, I> TransitionEntry<S, I> epsilon(S source, S... targets) {
        return of(source, null, Arrays.asList(targets));
    }

    public boolean isEpsilon() {
        return symbol == null;
    }

    @Override
    public String toString() {
        return source + "," + (symbol == null ? "" : symbol) + "->" + targets;
    }
}
