package com.sommerph.makoto.merkle;

import com.sommerph.makoto.exception.MerkleException;
import com.sommerph.makoto.util.DigestUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Binary SHA-256 Merkle tree. Level 0 holds the leaf hashes, the last level the root.
 * An odd node at the end of a level is hashed with itself.
 */
@Slf4j
public final class MerkleTree {

    private final List<List<byte[]>> levels;

    private MerkleTree(List<List<byte[]>> levels) {
        this.levels = levels;
    }

    /** Hashes every leaf with SHA-256 and builds the tree. */
    public static MerkleTree fromLeaves(List<byte[]> leaves) {
        List<byte[]> hashes = new ArrayList<>(leaves.size());
        for (byte[] leaf : leaves) {
            hashes.add(DigestUtils.sha256(leaf));
        }
        return build(hashes);
    }

    public static MerkleTree fromLeafHashes(List<byte[]> leafHashes) {
        List<byte[]> hashes = new ArrayList<>(leafHashes.size());
        for (byte[] hash : leafHashes) {
            if (hash == null || hash.length != DigestUtils.HASH_LENGTH) {
                throw new MerkleException("Leaf hash must be " + DigestUtils.HASH_LENGTH + " bytes");
            }
            hashes.add(hash.clone());
        }
        return build(hashes);
    }

    private static MerkleTree build(List<byte[]> leafHashes) {
        List<List<byte[]>> levels = new ArrayList<>();
        if (leafHashes.isEmpty()) {
            log.debug("Build empty Merkle tree");
            return new MerkleTree(Collections.emptyList());
        }
        List<byte[]> current = Collections.unmodifiableList(leafHashes);
        levels.add(current);
        while (current.size() > 1) {
            List<byte[]> next = new ArrayList<>((current.size() + 1) / 2);
            for (int i = 0; i < current.size(); i += 2) {
                byte[] left = current.get(i);
                byte[] right = (i + 1 < current.size()) ? current.get(i + 1) : left;
                next.add(DigestUtils.hashPair(left, right));
            }
            current = Collections.unmodifiableList(next);
            levels.add(current);
        }
        log.debug("Built Merkle tree with {} leaves and height {}", leafHashes.size(), levels.size());
        return new MerkleTree(Collections.unmodifiableList(levels));
    }

    public Optional<byte[]> root() {
        if (levels.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(levels.get(levels.size() - 1).get(0).clone());
    }

    public Optional<String> rootHex() {
        return root().map(DigestUtils::toHex);
    }

    public int height() {
        return levels.size();
    }

    public int leafCount() {
        return levels.isEmpty() ? 0 : levels.get(0).size();
    }

    public byte[] leafHash(int index) {
        checkIndex(index);
        return levels.get(0).get(index).clone();
    }

    public MerkleProof proof(int leafIndex) {
        checkIndex(leafIndex);
        List<byte[]> siblings = new ArrayList<>(levels.size() - 1);
        List<SiblingPosition> positions = new ArrayList<>(levels.size() - 1);
        int index = leafIndex;
        for (int level = 0; level < levels.size() - 1; level++) {
            List<byte[]> nodes = levels.get(level);
            boolean even = index % 2 == 0;
            int siblingIndex = even ? index + 1 : index - 1;
            if (siblingIndex < nodes.size()) {
                siblings.add(nodes.get(siblingIndex));
                positions.add(even ? SiblingPosition.RIGHT : SiblingPosition.LEFT);
            } else {
                // trailing odd node was paired with itself
                siblings.add(nodes.get(index));
                positions.add(SiblingPosition.RIGHT);
            }
            index /= 2;
        }
        log.debug("Built proof for leaf {} with {} siblings", leafIndex, siblings.size());
        return new MerkleProof(leafIndex, levels.get(0).get(leafIndex), siblings, positions);
    }

    public boolean verifyProof(MerkleProof proof) {
        return root().map(proof::verifyAgainst).orElse(false);
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= leafCount()) {
            throw new MerkleException("Leaf index " + index + " out of range for " + leafCount() + " leaves");
        }
    }

}
