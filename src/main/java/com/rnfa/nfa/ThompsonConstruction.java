package com.rnfa.nfa;

import com.rnfa.regex.ExpressionNode;
import com.rnfa.regex.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

public class ThompsonConstruction {
    private static final Logger LOG = LoggerFactory.getLogger(ThompsonConstruction.class);

    private final StateAllocator allocator;

    public ThompsonConstruction(StateAllocator allocator) {
        this.allocator = allocator;
    }

    private record Step(ExpressionNode node, boolean childrenBuilt) {}

    // Post-order over an explicit stack: children are built before their parent
    public Nfa build(ExpressionNode root) {
        NfaAssembly assembly = new NfaAssembly(allocator);
        Deque<Step> steps = new ArrayDeque<>();
        Deque<NfaAssembly.Fragment> built = new ArrayDeque<>();
        steps.push(new Step(root, false));

        while (!steps.isEmpty()) {
            Step step = steps.pop();
            ExpressionNode node = step.node();
            if (node instanceof ExpressionNode.Operand operand) {
                built.push(assembly.operand(operand.symbol().character()));
            } else if (!step.childrenBuilt()) {
                steps.push(new Step(node, true));
                if (node instanceof ExpressionNode.Binary binary) {
                    steps.push(new Step(binary.right(), false));
                    steps.push(new Step(binary.left(), false));
                } else {
                    steps.push(new Step(((ExpressionNode.Unary) node).child(), false));
                }
            } else {
                built.push(compose(assembly, node, built));
            }
        }

        Nfa nfa = assembly.toNfa(built.pop());
        LOG.debug("Built NFA with {} states and {} transitions", nfa.states().size(), nfa.transitionCount());
        return nfa;
    }

    private static NfaAssembly.Fragment compose(NfaAssembly assembly, ExpressionNode node,
                                                Deque<NfaAssembly.Fragment> built) {
        if (node instanceof ExpressionNode.Unary) {
            return assembly.kleeneStar(built.pop());
        }
        NfaAssembly.Fragment right = built.pop();
        NfaAssembly.Fragment left = built.pop();
        Symbol operator = ((ExpressionNode.Binary) node).operator();
        if (operator.isAlternation()) {
            return assembly.alternation(left, right);
        }
        if (operator.isConcat()) {
            return assembly.concatenation(left, right);
        }
        throw new IllegalArgumentException("Not a binary operator: " + operator);
    }

    public Nfa operand(char character) {
        NfaAssembly assembly = new NfaAssembly(allocator);
        return assembly.toNfa(assembly.operand(character));
    }

    public Nfa kleeneStar(Nfa inner) {
        NfaAssembly assembly = new NfaAssembly(allocator);
        return assembly.toNfa(assembly.kleeneStar(assembly.absorb(inner)));
    }

    public Nfa alternation(Nfa left, Nfa right) {
        NfaAssembly assembly = new NfaAssembly(allocator);
        NfaAssembly.Fragment leftFragment = assembly.absorb(left);
        return assembly.toNfa(assembly.alternation(leftFragment, assembly.absorb(right)));
    }

    /**
     * Merges the right initial state into the left final state. The right initial id is
     * retired, never reused. Thompson automata never enter their own initial state, and
     * a right operand that does is rejected.
     */
    public Nfa concatenation(Nfa left, Nfa right) {
        int retired = right.initialState();
        if (right.transitions().anySatisfy(targets -> targets.contains(retired))) {
            throw new IllegalArgumentException("Initial state " + retired
                    + " of the right automaton has incoming transitions");
        }
        NfaAssembly assembly = new NfaAssembly(allocator);
        NfaAssembly.Fragment leftFragment = assembly.absorb(left);
        return assembly.toNfa(assembly.concatenation(leftFragment, assembly.absorb(right)));
    }
}
