package com.rnfa.nfa;

import com.rnfa.error.InvalidWordInputException;
import com.rnfa.regex.ParsedRegex;
import com.rnfa.regex.RegexParser;
import org.eclipse.collections.impl.factory.primitive.IntSets;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class WordRecognizerTest {

    private final RegexParser parser = new RegexParser();

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "(a|b)*;   '';     true",
            "(a|b)*;   a;      true",
            "(a|b)*;   b;      true",
            "(a|b)*;   aabba;  true",
            "(a|b)*;   c;      false",
            "(a|b)*;   ab1;    false",
            "a*b;      b;      true",
            "a*b;      ab;     true",
            "a*b;      aaab;   true",
            "a*b;      '';     false",
            "a*b;      ba;     false",
            "a\\*b;    a*b;    true",
            "a\\*b;    ab;     false",
            "a\\*b;    aab;    false",
            "ab|cd;    ab;     true",
            "ab|cd;    cd;     true",
            "ab|cd;    ad;     false",
            "ab|cd;    abcd;   false",
            "(ab)*;    abab;   true",
            "(ab)*;    aba;    false",
            "a(b|c)*d; ad;     true",
            "a(b|c)*d; abccbd; true",
            "a(b|c)*d; abd1;   false",
            "a.b;      ab;     true",
            "a\\.b;    a.b;    true",
            "a\\.b;    ab;     false",
            "(a*)*;    aaaa;   true",
            "(a*)*;    '';     true"
    })
    public void testRecognize(String regex, String word, boolean expected) {
        assertEquals(expected, parser.parse(regex).recognize(word));
    }

    @ParameterizedTest
    @ValueSource(strings = {"a", "a*", "ab", "(a|b)*", "a*b*", "(a*|b)c", "(a*)*", "a|b*"})
    public void testEmptyWordMatchesClosureOfInitialState(String regex) {
        Nfa nfa = parser.parse(regex).nfa();
        WordRecognizer recognizer = new WordRecognizer(nfa);

        boolean expected = recognizer.epsilonClosure(IntSets.immutable.of(nfa.initialState()))
                .contains(nfa.finalState());
        assertEquals(expected, recognizer.recognize(""));
    }

    @Test
    public void testEpsilonClosureSurvivesCycles() {
        // (a*)* : a = 0,1  inner star = 2,3  outer star = 4,5
        Nfa nfa = parser.parse("(a*)*").nfa();
        WordRecognizer recognizer = new WordRecognizer(nfa);

        assertEquals(IntSets.mutable.of(0, 2, 3, 4, 5), recognizer.epsilonClosure(IntSets.immutable.of(4)));
    }

    @Test
    public void testEpsilonClosureIncludesSeeds() {
        Nfa nfa = parser.parse("ab").nfa();
        WordRecognizer recognizer = new WordRecognizer(nfa);

        assertEquals(IntSets.mutable.of(0), recognizer.epsilonClosure(IntSets.immutable.of(0)));
        assertTrue(recognizer.epsilonClosure(IntSets.immutable.empty()).isEmpty());
    }

    @Test
    public void testSymbolsOutsideAlphabetAreRejectedNotErrors() {
        ParsedRegex parsed = parser.parse("abc");

        assertFalse(parsed.recognize("xyz"));
        assertFalse(parsed.recognize("abé"));
    }

    @Test
    public void testNullWordIsInvalidInput() {
        WordRecognizer recognizer = new WordRecognizer(parser.parse("a").nfa());

        assertThrows(InvalidWordInputException.class, () -> recognizer.recognize(null));
    }
}
