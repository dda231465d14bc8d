package com.sommerph.makoto.model.attestation;

public enum AttestationType {
    ORIGIN("origin", PredicateType.ORIGIN),
    TRANSFORM("transform", PredicateType.TRANSFORM),
    STREAM_WINDOW("stream-window", PredicateType.STREAM_WINDOW),
    DBOM("dbom", null),
    SIGNED("signed", null);

    private final String displayName;
    private final PredicateType predicateType;

    AttestationType(String displayName, PredicateType predicateType) {
        this.displayName = displayName;
        this.predicateType = predicateType;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** Predicate of the statement types, {@code null} for manifests and envelopes. */
    public PredicateType getPredicateType() {
        return predicateType;
    }

    public static AttestationType fromPredicateType(PredicateType predicateType) {
        return switch (predicateType) {
            case ORIGIN -> ORIGIN;
            case TRANSFORM -> TRANSFORM;
            case STREAM_WINDOW -> STREAM_WINDOW;
            default -> throw new IllegalArgumentException("No attestation type for predicate: " + predicateType);
        };
    }

    @Override
    public String toString() {
        return displayName;
    }
}
