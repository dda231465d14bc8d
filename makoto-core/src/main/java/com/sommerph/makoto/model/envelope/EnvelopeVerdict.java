package com.sommerph.makoto.model.envelope;

public enum EnvelopeVerdict {
    VERIFIED,
    NO_MATCHING_KEY,
    INVALID_SIGNATURE
}
