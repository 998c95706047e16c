package com.rnfa.error;

public class InvalidWordInputException extends RegexException {
    public InvalidWordInputException(String message) {
        super(message);
    }
}
