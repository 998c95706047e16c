package com.rnfa.nfa;

import com.rnfa.error.InvalidWordInputException;
import org.eclipse.collections.api.set.primitive.IntSet;
import org.eclipse.collections.api.set.primitive.MutableIntSet;
import org.eclipse.collections.api.stack.primitive.MutableIntStack;
import org.eclipse.collections.impl.factory.primitive.IntSets;
import org.eclipse.collections.impl.factory.primitive.IntStacks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class WordRecognizer {
    private static final Logger LOG = LoggerFactory.getLogger(WordRecognizer.class);

    private final Nfa nfa;

    public WordRecognizer(Nfa nfa) {
        this.nfa = nfa;
    }

    /**
     * Returns every state reachable from {@code seeds} through zero or more epsilon
     * transitions, the seeds included. Epsilon cycles are visited once.
     */
    public MutableIntSet epsilonClosure(IntSet seeds) {
        MutableIntSet closure = IntSets.mutable.withAll(seeds);
        MutableIntStack pending = IntStacks.mutable.withAll(seeds);

        while (!pending.isEmpty()) {
            int state = pending.pop();
            nfa.destinations(state, TransitionLabel.EPSILON).forEach(next -> {
                if (closure.add(next)) {
                    pending.push(next);
                }
            });
        }
        return closure;
    }

    public boolean recognize(String word) {
        if (word == null) {
            throw new InvalidWordInputException("The word to recognize must be text, got null");
        }

        MutableIntSet current = epsilonClosure(IntSets.immutable.of(nfa.initialState()));
        for (int i = 0; i < word.length() && !current.isEmpty(); i++) {
            current = epsilonClosure(step(current, TransitionLabel.of(word.charAt(i))));
        }

        boolean accepted = current.contains(nfa.finalState());
        LOG.debug("Word '{}' {}", word, accepted ? "accepted" : "rejected");
        return accepted;
    }

    private MutableIntSet step(IntSet states, TransitionLabel label) {
        MutableIntSet next = IntSets.mutable.empty();
        states.forEach(state -> next.addAll(nfa.destinations(state, label)));
        return next;
    }
}
