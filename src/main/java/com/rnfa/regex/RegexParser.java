package com.rnfa.regex;

import com.rnfa.nfa.Nfa;
import com.rnfa.nfa.StateAllocator;
import com.rnfa.nfa.ThompsonConstruction;
import org.eclipse.collections.api.list.MutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RegexParser {
    private static final Logger LOG = LoggerFactory.getLogger(RegexParser.class);

    private final EscapeAnnotator escapeAnnotator;
    private final InfixPreprocessor preprocessor = new InfixPreprocessor();
    private final ShuntingYardConverter converter = new ShuntingYardConverter();
    private final ExpressionTreeBuilder treeBuilder = new ExpressionTreeBuilder();

    public RegexParser() {
        this(ParserOptions.DEFAULTS);
    }

    public RegexParser(ParserOptions options) {
        this.escapeAnnotator = new EscapeAnnotator(options.lenientEscapes());
    }

    public ParsedRegex parse(String regex) {
        MutableList<Symbol> escaped = escapeAnnotator.annotate(regex);
        MutableList<Symbol> preprocessed = preprocessor.preprocess(escaped);
        LOG.debug("Preprocessed '{}' to '{}'", regex, Symbol.render(preprocessed));

        MutableList<Symbol> postfix = converter.toPostfix(preprocessed);
        LOG.debug("Postfix form of '{}' is '{}'", regex, Symbol.render(postfix));

        ExpressionNode tree = treeBuilder.build(postfix);
        Nfa nfa = new ThompsonConstruction(new StateAllocator()).build(tree);

        return new ParsedRegex(regex, escaped.toImmutable(), preprocessed.toImmutable(),
                postfix.toImmutable(), tree, nfa);
    }
}
