package com.rnfa.error;

public class DanglingEscapeException extends RegexException {
    private final int offset;

    public DanglingEscapeException(String regex, int offset) {
        super("Dangling escape at offset " + offset + " in regex: " + regex);
        this.offset = offset;
    }

    public int offset() {
        return offset;
    }
}
