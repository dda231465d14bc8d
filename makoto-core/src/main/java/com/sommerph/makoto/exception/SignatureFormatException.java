package com.sommerph.makoto.exception;

/**
 * Thrown when a signature cannot even be decoded (bad base64, wrong length, scalar out of range).
 * A well-formed signature that does not verify is reported as {@code false}, not with this exception.
 */
public class SignatureFormatException extends MakotoException {

    public SignatureFormatException(String message) {
        super("Signature error: " + message);
    }

    public SignatureFormatException(String message, Throwable cause) {
        super("Signature error: " + message, cause);
    }

}
