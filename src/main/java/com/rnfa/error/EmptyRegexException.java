package com.rnfa.error;

public class EmptyRegexException extends RegexException {
    public EmptyRegexException() {
        super("The regex must not be empty");
    }
}
