package com.sommerph.makoto.exception;

import lombok.Getter;

@Getter
public class InvalidPredicateTypeException extends MakotoException {

    private final String expected;
    private final String actual;

    public InvalidPredicateTypeException(String expected, String actual) {
        super("Invalid predicate type: expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

}
