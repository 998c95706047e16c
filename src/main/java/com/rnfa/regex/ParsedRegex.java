package com.rnfa.regex;

import com.rnfa.nfa.Nfa;
import com.rnfa.nfa.WordRecognizer;
import org.eclipse.collections.api.list.ImmutableList;

public record ParsedRegex(
        String raw,
        ImmutableList<Symbol> escaped,
        ImmutableList<Symbol> preprocessed,
        ImmutableList<Symbol> postfix,
        ExpressionNode tree,
        Nfa nfa) {

    public String escapedRegex() {
        return Symbol.render(escaped);
    }

    public String preprocessedRegex() {
        return Symbol.render(preprocessed);
    }

    public String postfixRegex() {
        return Symbol.render(postfix);
    }

    public boolean recognize(String word) {
        return new WordRecognizer(nfa).recognize(word);
    }
}
