package com.sommerph.makoto.exception;

public class InvalidAttestationException extends MakotoException {

    public InvalidAttestationException(String reason) {
        super("Invalid attestation: " + reason);
    }

    public InvalidAttestationException(String reason, Throwable cause) {
        super("Invalid attestation: " + reason, cause);
    }

}
