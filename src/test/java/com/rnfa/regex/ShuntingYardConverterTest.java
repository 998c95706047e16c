package com.rnfa.regex;

import com.rnfa.error.UnbalancedParenthesesException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class ShuntingYardConverterTest {

    private final EscapeAnnotator annotator = new EscapeAnnotator(false);
    private final InfixPreprocessor preprocessor = new InfixPreprocessor();
    private final ShuntingYardConverter converter = new ShuntingYardConverter();

    private String postfix(String regex) {
        return Symbol.render(converter.toPostfix(preprocessor.preprocess(annotator.annotate(regex))));
    }

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "ab;        ab.",
            "a|b;       ab|",
            "a*;        a*",
            "a*b;       a*b.",
            "ab|c;      ab.c|",
            "a|bc;      abc.|",
            "a|b|c;     ab|c|",
            "(a|b)*;    ab|*",
            "(a|b)*c;   ab|*c.",
            "a(b|c);    abc|.",
            "a**;       a**",
            "a\\|b;     a\\|.b."
    })
    public void testPrecedenceAndAssociativity(String regex, String expected) {
        assertEquals(expected, postfix(regex));
    }

    @Test
    public void testUnclosedGroupIsRejected() {
        UnbalancedParenthesesException e = assertThrows(UnbalancedParenthesesException.class, () -> postfix("(a"));
        assertEquals(-1, e.offset());
    }

    @Test
    public void testUnopenedGroupIsRejected() {
        UnbalancedParenthesesException e = assertThrows(UnbalancedParenthesesException.class, () -> postfix("a)"));
        assertEquals(1, e.offset());
    }

    @Test
    public void testNestedGroupsMissingOneCloseAreRejected() {
        assertThrows(UnbalancedParenthesesException.class, () -> postfix("((a|b)c"));
    }

    @Test
    public void testEscapedParenthesesAreOperands() {
        assertEquals("\\(a.\\).", postfix("\\(a\\)"));
    }
}
