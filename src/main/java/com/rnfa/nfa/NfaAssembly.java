package com.rnfa.nfa;

import org.eclipse.collections.api.list.primitive.ImmutableIntList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.map.primitive.MutableIntObjectMap;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.api.set.primitive.MutableIntSet;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.Sets;
import org.eclipse.collections.impl.factory.primitive.IntLists;
import org.eclipse.collections.impl.factory.primitive.IntObjectMaps;
import org.eclipse.collections.impl.factory.primitive.IntSets;

class NfaAssembly {
    record Fragment(int initial, int accepting) {}

    private final StateAllocator allocator;
    private final MutableIntObjectMap<MutableMap<TransitionLabel, MutableIntList>> outgoing =
            IntObjectMaps.mutable.empty();
    private final MutableIntSet states = IntSets.mutable.empty();
    private final MutableSet<Character> alphabet = Sets.mutable.empty();

    NfaAssembly(StateAllocator allocator) {
        this.allocator = allocator;
    }

    Fragment absorb(Nfa nfa) {
        states.addAll(nfa.states());
        alphabet.addAllIterable(nfa.alphabet());
        nfa.transitions().forEachKeyValue((key, targets) -> row(key.state()).getIfAbsentPut(key.label(),
                IntLists.mutable::empty).addAll(targets));
        return new Fragment(nfa.initialState(), nfa.finalState());
    }

    Fragment operand(char character) {
        Fragment fragment = fresh();
        add(fragment.initial(), TransitionLabel.of(character), fragment.accepting());
        alphabet.add(character);
        return fragment;
    }

    Fragment kleeneStar(Fragment inner) {
        Fragment fragment = fresh();
        addEpsilon(inner.accepting(), inner.initial());
        addEpsilon(inner.accepting(), fragment.accepting());
        addEpsilon(fragment.initial(), inner.initial());
        addEpsilon(fragment.initial(), fragment.accepting());
        return fragment;
    }

    Fragment alternation(Fragment left, Fragment right) {
        Fragment fragment = fresh();
        addEpsilon(right.accepting(), fragment.accepting());
        addEpsilon(left.accepting(), fragment.accepting());
        addEpsilon(fragment.initial(), right.initial());
        addEpsilon(fragment.initial(), left.initial());
        return fragment;
    }

    // The right initial state has no incoming transitions, so moving its outgoing row is enough
    Fragment concatenation(Fragment left, Fragment right) {
        MutableMap<TransitionLabel, MutableIntList> moved = outgoing.remove(right.initial());
        if (moved != null) {
            moved.forEachKeyValue((label, targets) -> row(left.accepting())
                    .getIfAbsentPut(label, IntLists.mutable::empty).addAll(targets));
        }
        states.remove(right.initial());
        return new Fragment(left.initial(), right.accepting());
    }

    Nfa toNfa(Fragment root) {
        MutableMap<TransitionKey, ImmutableIntList> transitions = Maps.mutable.empty();
        outgoing.forEachKeyValue((state, row) -> row.forEachKeyValue((label, targets) ->
                transitions.put(new TransitionKey(state, label), targets.toImmutable())));
        return new Nfa(states.toImmutable(), alphabet.toImmutable(), root.initial(), root.accepting(),
                transitions.toImmutable());
    }

    private Fragment fresh() {
        int initial = allocator.allocate();
        int accepting = allocator.allocate();
        states.add(initial);
        states.add(accepting);
        return new Fragment(initial, accepting);
    }

    private MutableMap<TransitionLabel, MutableIntList> row(int state) {
        return outgoing.getIfAbsentPut(state, Maps.mutable::empty);
    }

    private void add(int from, TransitionLabel label, int to) {
        row(from).getIfAbsentPut(label, IntLists.mutable::empty).add(to);
    }

    private void addEpsilon(int from, int to) {
        add(from, TransitionLabel.EPSILON, to);
    }
}
