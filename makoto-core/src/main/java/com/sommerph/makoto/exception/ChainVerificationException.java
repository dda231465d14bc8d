package com.sommerph.makoto.exception;

/**
 * Raised when a sequence of attestations cannot be linked at all, e.g. an entry that is not valid JSON.
 */
public class ChainVerificationException extends MakotoException {

    public ChainVerificationException(String message, Throwable cause) {
        super("Chain verification error: " + message, cause);
    }

}
