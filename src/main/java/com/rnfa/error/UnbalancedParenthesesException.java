package com.rnfa.error;

public class UnbalancedParenthesesException extends RegexException {
    private final int offset;

    public UnbalancedParenthesesException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    public int offset() {
        return offset;
    }
}
