package com.sommerph.makoto.merkle;

import com.sommerph.makoto.exception.InvalidAttestationException;
import com.sommerph.makoto.exception.MerkleException;
import com.sommerph.makoto.util.DigestUtils;

import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Inclusion proof for one leaf. Verifiable on its own against a known root.
 */
public final class MerkleProof {

    private final int leafIndex;
    private final byte[] leafHash;
    private final List<byte[]> siblings;
    private final List<SiblingPosition> positions;

    public MerkleProof(int leafIndex, byte[] leafHash, List<byte[]> siblings, List<SiblingPosition> positions) {
        if (siblings.size() != positions.size()) {
            throw new MerkleException("Proof has " + siblings.size() + " siblings but "
                    + positions.size() + " positions");
        }
        this.leafIndex = leafIndex;
        this.leafHash = leafHash.clone();
        List<byte[]> copy = new ArrayList<>(siblings.size());
        for (byte[] sibling : siblings) {
            copy.add(sibling.clone());
        }
        this.siblings = Collections.unmodifiableList(copy);
        this.positions = List.copyOf(positions);
    }

    public int getLeafIndex() {
        return leafIndex;
    }

    public byte[] getLeafHash() {
        return leafHash.clone();
    }

    public List<byte[]> getSiblings() {
        List<byte[]> copy = new ArrayList<>(siblings.size());
        for (byte[] sibling : siblings) {
            copy.add(sibling.clone());
        }
        return copy;
    }

    public List<SiblingPosition> getPositions() {
        return positions;
    }

    public byte[] computeRoot() {
        byte[] current = leafHash;
        for (int i = 0; i < siblings.size(); i++) {
            byte[] sibling = siblings.get(i);
            current = positions.get(i) == SiblingPosition.LEFT
                    ? DigestUtils.hashPair(sibling, current)
                    : DigestUtils.hashPair(current, sibling);
        }
        return current.clone();
    }

    public boolean verifyAgainst(byte[] expectedRoot) {
        if (expectedRoot == null) {
            return false;
        }
        return MessageDigest.isEqual(computeRoot(), expectedRoot);
    }

    public boolean verifyAgainstHex(String expectedRootHex) {
        byte[] expected;
        try {
            expected = DigestUtils.hashFromHex(expectedRootHex);
        } catch (InvalidAttestationException e) {
            return false;
        }
        return verifyAgainst(expected);
    }

    public MerkleProofHex toHex() {
        List<String> siblingHex = new ArrayList<>(siblings.size());
        for (byte[] sibling : siblings) {
            siblingHex.add(DigestUtils.toHex(sibling));
        }
        List<String> positionNames = new ArrayList<>(positions.size());
        for (SiblingPosition position : positions) {
            positionNames.add(position.getWireName());
        }
        return new MerkleProofHex(leafIndex, DigestUtils.toHex(leafHash), siblingHex, positionNames);
    }

    public static MerkleProof fromHex(MerkleProofHex hex) {
        List<String> siblingHex = hex.getSiblings() == null ? List.of() : hex.getSiblings();
        List<String> positionNames = hex.getPositions() == null ? List.of() : hex.getPositions();
        if (siblingHex.size() != positionNames.size()) {
            throw new MerkleException("Proof has " + siblingHex.size() + " siblings but "
                    + positionNames.size() + " positions");
        }
        try {
            byte[] leafHash = DigestUtils.hashFromHex(hex.getLeafHash());
            List<byte[]> siblings = new ArrayList<>(siblingHex.size());
            for (String sibling : siblingHex) {
                siblings.add(DigestUtils.hashFromHex(sibling));
            }
            List<SiblingPosition> positions = new ArrayList<>(positionNames.size());
            for (String name : positionNames) {
                positions.add(SiblingPosition.fromWireName(name));
            }
            return new MerkleProof(hex.getLeafIndex(), leafHash, siblings, positions);
        } catch (InvalidAttestationException e) {
            throw new MerkleException("Invalid proof encoding: " + e.getMessage(), e);
        }
    }

}
