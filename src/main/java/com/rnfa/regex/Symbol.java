package com.rnfa.regex;

import org.eclipse.collections.api.list.ListIterable;

public record Symbol(char character, boolean escaped) {
    public static final char KLEENE_STAR = '*';
    public static final char CONCAT = '.';
    public static final char ALTERNATION = '|';
    public static final char LEFT_PAREN = '(';
    public static final char RIGHT_PAREN = ')';
    public static final char ESCAPE = '\\';

    public static final Symbol CONCAT_OPERATOR = new Symbol(CONCAT, false);

    public static Symbol literal(char character) {
        return new Symbol(character, false);
    }

    public boolean isOperand() {
        return escaped || !isControl(character);
    }

    public boolean isKleeneStar() {
        return is(KLEENE_STAR);
    }

    public boolean isConcat() {
        return is(CONCAT);
    }

    public boolean isAlternation() {
        return is(ALTERNATION);
    }

    public boolean isLeftParen() {
        return is(LEFT_PAREN);
    }

    public boolean isRightParen() {
        return is(RIGHT_PAREN);
    }

    public int precedence() {
        if (isKleeneStar()) {
            return 3;
        }
        if (isConcat()) {
            return 2;
        }
        if (isAlternation()) {
            return 1;
        }
        return -1;
    }

    private boolean is(char control) {
        return !escaped && character == control;
    }

    private static boolean isControl(char c) {
        return c == KLEENE_STAR || c == CONCAT || c == ALTERNATION || c == LEFT_PAREN || c == RIGHT_PAREN;
    }

    @Override
    public String toString() {
        return escaped ? String.valueOf(ESCAPE) + character : String.valueOf(character);
    }

    public static String render(ListIterable<Symbol> symbols) {
        StringBuilder sb = new StringBuilder(symbols.size() * 2);
        for (Symbol symbol : symbols) {
            sb.append(symbol);
        }
        return sb.toString();
    }
}
