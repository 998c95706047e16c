package com.rnfa.regex;

import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

public class InfixPreprocessor {

    public MutableList<Symbol> preprocess(ListIterable<Symbol> symbols) {
        MutableList<Symbol> result = Lists.mutable.empty();
        Symbol previous = null;
        for (Symbol current : symbols) {
            if (previous != null && needsConcat(previous, current)) {
                result.add(Symbol.CONCAT_OPERATOR);
            }
            result.add(current);
            previous = current;
        }
        return result;
    }

    static boolean needsConcat(Symbol previous, Symbol current) {
        return (previous.isOperand() && current.isOperand())
                || (previous.isKleeneStar() && current.isOperand())
                || (previous.isKleeneStar() && current.isLeftParen())
                || (previous.isLeftParen() && current.isRightParen())
                || (previous.isRightParen() && current.isOperand())
                || (previous.isOperand() && current.isLeftParen());
    }
}
