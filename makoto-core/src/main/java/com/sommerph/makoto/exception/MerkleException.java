package com.sommerph.makoto.exception;

public class MerkleException extends MakotoException {

    public MerkleException(String message) {
        super("Merkle tree error: " + message);
    }

    public MerkleException(String message, Throwable cause) {
        super("Merkle tree error: " + message, cause);
    }

}
