package com.sommerph.makoto.exception;

import lombok.Getter;

@Getter
public class HashMismatchException extends MakotoException {

    private final String expected;
    private final String actual;

    public HashMismatchException(String expected, String actual) {
        super("Hash verification failed: expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

}
