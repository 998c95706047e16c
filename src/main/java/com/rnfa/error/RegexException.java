package com.rnfa.error;

public class RegexException extends IllegalArgumentException {
    public RegexException(String message) {
        super(message);
    }
}
