package com.rnfa.nfa;

import org.eclipse.collections.api.list.primitive.ImmutableIntList;
import org.eclipse.collections.api.list.primitive.IntList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.api.set.primitive.ImmutableIntSet;
import org.eclipse.collections.impl.factory.primitive.IntLists;

import java.util.Objects;

public record Nfa(
        ImmutableIntSet states,
        ImmutableSet<Character> alphabet,
        int initialState,
        int finalState,
        ImmutableMap<TransitionKey, ImmutableIntList> transitions) {

    public Nfa {
        Objects.requireNonNull(states, "states");
        Objects.requireNonNull(alphabet, "alphabet");
        Objects.requireNonNull(transitions, "transitions");
        if (!states.contains(initialState) || !states.contains(finalState)) {
            throw new IllegalStateException("Initial state " + initialState + " and final state "
                    + finalState + " must both belong to " + states);
        }
    }

    public IntList destinations(int state, TransitionLabel label) {
        return transitions.getIfAbsentValue(new TransitionKey(state, label), IntLists.immutable.empty());
    }

    public int transitionCount() {
        return (int) transitions.sumOfInt(ImmutableIntList::size);
    }
}
