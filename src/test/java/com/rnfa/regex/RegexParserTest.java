package com.rnfa.regex;

import com.rnfa.error.DanglingEscapeException;
import com.rnfa.error.EmptyRegexException;
import com.rnfa.error.MalformedExpressionException;
import com.rnfa.error.UnbalancedParenthesesException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

public class RegexParserTest {

    private final RegexParser parser = new RegexParser();

    @Test
    public void testCanonicalConversion() {
        ParsedRegex parsed = parser.parse("ab");

        assertEquals("ab", parsed.raw());
        assertEquals("ab", parsed.escapedRegex());
        assertEquals("a.b", parsed.preprocessedRegex());
        assertEquals("ab.", parsed.postfixRegex());
    }

    @Test
    public void testEscapedFormsArePreserved() {
        ParsedRegex parsed = parser.parse("a\\*b");

        assertEquals("a\\*b", parsed.escapedRegex());
        assertEquals("a.\\*.b", parsed.preprocessedRegex());
        assertEquals("a\\*.b.", parsed.postfixRegex());
    }

    @Test
    public void testParseErrorsSurfaceAsDistinctExceptions() {
        assertThrows(EmptyRegexException.class, () -> parser.parse(""));
        assertThrows(DanglingEscapeException.class, () -> parser.parse("a\\"));
        assertThrows(UnbalancedParenthesesException.class, () -> parser.parse("(a"));
        assertThrows(UnbalancedParenthesesException.class, () -> parser.parse("a)"));
        assertThrows(MalformedExpressionException.class, () -> parser.parse("a|"));
        assertThrows(MalformedExpressionException.class, () -> parser.parse("*a"));
        assertThrows(MalformedExpressionException.class, () -> parser.parse("()"));
    }

    @Test
    public void testAdjacentGroupsPointToExplicitConcatenation() {
        MalformedExpressionException e =
                assertThrows(MalformedExpressionException.class, () -> parser.parse("(a)(b)"));
        assertTrue(e.getMessage().contains("(a).(b)"));
        assertTrue(parser.parse("(a).(b)").recognize("ab"));
    }

    @Test
    public void testLongLiteralCompiles() {
        String literal = "a".repeat(20000);
        ParsedRegex parsed = parser.parse(literal);

        assertEquals(20001, parsed.nfa().states().size());
        assertTrue(parsed.recognize(literal));
        assertFalse(parsed.recognize(literal.substring(1)));
        assertFalse(parsed.recognize(literal + "a"));
    }

    @Test
    public void testLongChainOfStarsCompiles() {
        ParsedRegex parsed = parser.parse("a*".repeat(10000));

        assertTrue(parsed.recognize(""));
        assertTrue(parsed.recognize("aaaa"));
        assertFalse(parsed.recognize("b"));
    }

    @Test
    public void testLenientEscapesDropTrailingBackslash() {
        ParsedRegex parsed = new RegexParser(new ParserOptions(true)).parse("ab\\");

        assertEquals("a.b", parsed.preprocessedRegex());
        assertTrue(parsed.recognize("ab"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"a", "ab|cd", "(a|b)*", "a*b", "(ab)*|c", "a\\*b", "((a|b)*c)*"})
    public void testFreshSessionsProduceTheSameAutomaton(String regex) {
        ParsedRegex first = parser.parse(regex);
        ParsedRegex second = parser.parse(regex);

        assertEquals(first.nfa(), second.nfa());
        for (String word : List.of("", "a", "ab", "cd", "aab", "abab", "c", "a*b", "abc", "bbc")) {
            assertEquals(first.recognize(word), second.recognize(word), "word: " + word);
        }
    }

    @Test
    public void testConcurrentCompilationsDoNotInterfere() throws Exception {
        ParsedRegex expected = parser.parse("(a|b)*abb");
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<ParsedRegex>> futures = IntStream.range(0, 32)
                    .mapToObj(i -> executor.submit(() -> parser.parse("(a|b)*abb")))
                    .collect(Collectors.toList());
            for (Future<ParsedRegex> future : futures) {
                assertEquals(expected.nfa(), future.get().nfa());
            }
        } finally {
            executor.shutdown();
        }
    }
}
