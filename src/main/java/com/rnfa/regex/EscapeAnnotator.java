package com.rnfa.regex;

import com.rnfa.error.DanglingEscapeException;
import com.rnfa.error.EmptyRegexException;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

public class EscapeAnnotator {
    private final boolean lenientEscapes;

    public EscapeAnnotator(boolean lenientEscapes) {
        this.lenientEscapes = lenientEscapes;
    }

    public MutableList<Symbol> annotate(String regex) {
        if (regex == null || regex.isEmpty()) {
            throw new EmptyRegexException();
        }

        MutableList<Symbol> symbols = Lists.mutable.empty();
        boolean escapeNext = false;
        for (int i = 0; i < regex.length(); i++) {
            char c = regex.charAt(i);
            if (escapeNext) {
                symbols.add(new Symbol(c, true));
                escapeNext = false;
            } else if (c == Symbol.ESCAPE) {
                escapeNext = true;
            } else {
                symbols.add(Symbol.literal(c));
            }
        }

        if (escapeNext && !lenientEscapes) {
            throw new DanglingEscapeException(regex, regex.length() - 1);
        }
        // A lone backslash under lenient escapes leaves nothing to compile
        if (symbols.isEmpty()) {
            throw new EmptyRegexException();
        }
        return symbols;
    }
}
