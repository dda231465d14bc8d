package com.sommerph.makoto.model.attestation;

public enum PredicateType {
    ORIGIN("https://makoto.dev/origin/v1"),
    TRANSFORM("https://makoto.dev/transform/v1"),
    STREAM_WINDOW("https://makoto.dev/stream-window/v1"),
    UNKNOWN(null);

    private final String uri;

    PredicateType(String uri) {
        this.uri = uri;
    }

    public String getUri() {
        return uri;
    }

    /** Never null: anything unrecognised maps to {@link #UNKNOWN}. */
    public static PredicateType fromUri(String uri) {
        if (uri == null) {
            return UNKNOWN;
        }
        for (PredicateType type : values()) {
            if (uri.equals(type.uri)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
