package com.rnfa.regex;

import com.rnfa.error.UnbalancedParenthesesException;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.ArrayDeque;
import java.util.Deque;

public class ShuntingYardConverter {

    public MutableList<Symbol> toPostfix(ListIterable<Symbol> infix) {
        MutableList<Symbol> output = Lists.mutable.empty();
        Deque<Symbol> operators = new ArrayDeque<>();
        Deque<Integer> openOffsets = new ArrayDeque<>();

        for (int i = 0; i < infix.size(); i++) {
            Symbol symbol = infix.get(i);

            if (symbol.isOperand()) {
                output.add(symbol);
            } else if (symbol.isLeftParen()) {
                operators.push(symbol);
                openOffsets.push(i);
            } else if (symbol.isRightParen()) {
                while (!operators.isEmpty() && !operators.peek().isLeftParen()) {
                    output.add(operators.pop());
                }
                if (operators.isEmpty()) {
                    throw new UnbalancedParenthesesException(
                            "Unmatched ')' at offset " + i + " in " + Symbol.render(infix), i);
                }
                operators.pop();
                openOffsets.pop();
            } else {
                while (!operators.isEmpty() && operators.peek().precedence() >= symbol.precedence()) {
                    output.add(operators.pop());
                }
                operators.push(symbol);
            }
        }

        if (!openOffsets.isEmpty()) {
            throw new UnbalancedParenthesesException(
                    "Unclosed '(' at offset " + openOffsets.peek() + " in " + Symbol.render(infix), -1);
        }
        while (!operators.isEmpty()) {
            output.add(operators.pop());
        }
        return output;
    }
}
