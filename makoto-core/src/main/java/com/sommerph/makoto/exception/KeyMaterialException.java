package com.sommerph.makoto.exception;

/**
 * Key parsing or import failure (raw scalar, SEC1 point, PEM).
 */
public class KeyMaterialException extends MakotoException {

    public KeyMaterialException(String message) {
        super("Key error: " + message);
    }

    public KeyMaterialException(String message, Throwable cause) {
        super("Key error: " + message, cause);
    }

}
