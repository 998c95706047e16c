package com.rnfa.regex;

import com.rnfa.error.MalformedExpressionException;
import org.eclipse.collections.api.list.ListIterable;

import java.util.ArrayDeque;
import java.util.Deque;

public class ExpressionTreeBuilder {

    public ExpressionNode build(ListIterable<Symbol> postfix) {
        Deque<ExpressionNode> stack = new ArrayDeque<>();

        for (Symbol symbol : postfix) {
            if (symbol.isKleeneStar()) {
                ExpressionNode child = pop(stack, symbol, postfix);
                stack.push(new ExpressionNode.Unary(symbol, child));
            } else if (symbol.isConcat() || symbol.isAlternation()) {
                ExpressionNode right = pop(stack, symbol, postfix);
                ExpressionNode left = pop(stack, symbol, postfix);
                stack.push(new ExpressionNode.Binary(symbol, left, right));
            } else {
                stack.push(new ExpressionNode.Operand(symbol));
            }
        }

        if (stack.size() != 1) {
            String hint = stack.size() > 1
                    ? "; adjacent groups need an explicit concatenation, e.g. (a).(b) rather than (a)(b)"
                    : "";
            throw new MalformedExpressionException("Postfix " + Symbol.render(postfix)
                    + " reduces to " + stack.size() + " expressions instead of one" + hint);
        }
        return stack.pop();
    }

    private static ExpressionNode pop(Deque<ExpressionNode> stack, Symbol operator, ListIterable<Symbol> postfix) {
        if (stack.isEmpty()) {
            throw new MalformedExpressionException("Operator '" + operator
                    + "' is missing an operand in postfix " + Symbol.render(postfix));
        }
        return stack.pop();
    }
}
