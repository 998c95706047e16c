package com.rnfa.error;

public class MalformedExpressionException extends RegexException {
    public MalformedExpressionException(String message) {
        super(message);
    }
}
