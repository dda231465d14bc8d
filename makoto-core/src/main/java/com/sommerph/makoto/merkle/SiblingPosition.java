package com.sommerph.makoto.merkle;

import com.sommerph.makoto.exception.MerkleException;

/**
 * Side on which a proof sibling sits relative to the running hash.
 */
public enum SiblingPosition {
    LEFT("left"),
    RIGHT("right");

    private final String wireName;

    SiblingPosition(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static SiblingPosition fromWireName(String value) {
        return switch (value == null ? "" : value) {
            case "left" -> LEFT;
            case "right" -> RIGHT;
            default -> throw new MerkleException("Unknown sibling position: " + value);
        };
    }
}
