package com.sommerph.makoto.exception;

/**
 * Base type for every failure raised by the attestation engine.
 */
public abstract class MakotoException extends RuntimeException {

    protected MakotoException(String message) {
        super(message);
    }

    protected MakotoException(String message, Throwable cause) {
        super(message, cause);
    }

}
