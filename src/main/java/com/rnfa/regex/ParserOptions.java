package com.rnfa.regex;

public record ParserOptions(boolean lenientEscapes) {
    public static final ParserOptions DEFAULTS = new ParserOptions(false);
}
