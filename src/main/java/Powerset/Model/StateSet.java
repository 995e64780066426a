package Powerset.Model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.StringJoiner;

/**
 * A set of NFA states used as a single DFA state.
 * <p>
 * Equality and hash code depend on the members only, not on their order. The subset construction
 * creates members in the declaration order of the NFA, so {@link #toString()} is reproducible.
 *
 * @param <S> NFA state type
 */
public final class StateSet<S> implements Iterable<S> {

    private final Set<S> members;

    private StateSet(Set<S> members) {
        this.members = members;
    }

    public static <S> StateSet<S> of(Collection<? extends S> members) {
        if (members.isEmpty()) {
            return empty();
        }
        return new StateSet<>(Collections.unmodifiableSet(new LinkedHashSet<>(members)));
    }

    @SafeVarargs
    public static <S> StateSet<S> of(S... members) {
        return of(Arrays.asList(members));
    }

    public static <S> StateSet<S> empty() {
        return new StateSet<>(Collections.emptySet());
    }

    public boolean contains(Object state) {
        return members.contains(state);
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public Set<S> asSet() {
        return members;
    }

    @Override
    public Iterator<S> iterator() {
        return members.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StateSet<?> other)) {
            return false;
        }
        return members.equals(other.members);
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }

    @Override
    public String toString() {
        final StringJoiner joiner = new StringJoiner(",", "{", "}");
        for (S s : members) {
            joiner.add(String.valueOf(s));
        }
        return joiner.toString();
    }
}
