package com.rnfa.nfa;

import java.util.Comparator;

public record TransitionKey(int state, TransitionLabel label) implements Comparable<TransitionKey> {
    private static final Comparator<TransitionKey> ORDER =
            Comparator.comparingInt(TransitionKey::state).thenComparing(TransitionKey::label);

    @Override
    public int compareTo(TransitionKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + state + ", " + label + ")";
    }
}
