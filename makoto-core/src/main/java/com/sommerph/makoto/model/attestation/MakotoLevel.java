package com.sommerph.makoto.model.attestation;

/**
 * Assurance level reached by a verification. L3 is reserved and never produced here.
 */
public enum MakotoLevel {
    L1,
    L2,
    L3
}
