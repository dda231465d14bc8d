package com.sommerph.makoto.merkle;

import com.sommerph.makoto.exception.MerkleException;
import com.sommerph.makoto.util.DigestUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MerkleTreeTest {

    private static List<byte[]> leaves(String... values) {
        List<byte[]> leaves = new ArrayList<>();
        for (String value : values) {
            leaves.add(value.getBytes(StandardCharsets.UTF_8));
        }
        return leaves;
    }

    private static List<byte[]> numberedLeaves(int count) {
        List<byte[]> leaves = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            leaves.add(("record-" + i).getBytes(StandardCharsets.UTF_8));
        }
        return leaves;
    }

    @Test
    void emptyTreeHasNoRoot() {
        MerkleTree tree = MerkleTree.fromLeaves(List.of());

        assertThat(tree.root()).isEmpty();
        assertThat(tree.rootHex()).isEmpty();
        assertThat(tree.height()).isZero();
        assertThat(tree.leafCount()).isZero();
        assertThatThrownBy(() -> tree.proof(0)).isInstanceOf(MerkleException.class);
    }

    @Test
    void singleLeafRootIsLeafHash() {
        MerkleTree tree = MerkleTree.fromLeaves(leaves("only"));

        assertThat(tree.root().orElseThrow()).isEqualTo(DigestUtils.sha256("only"));
        assertThat(tree.height()).isEqualTo(1);

        MerkleProof proof = tree.proof(0);
        assertThat(proof.getSiblings()).isEmpty();
        assertThat(tree.verifyProof(proof)).isTrue();
    }

    @Test
    void twoLeavesGiveHeightTwo() {
        MerkleTree tree = MerkleTree.fromLeaves(leaves("leaf1", "leaf2"));

        assertThat(tree.height()).isEqualTo(2);
        assertThat(tree.root().orElseThrow()).isEqualTo(DigestUtils.hashPair(DigestUtils.sha256("leaf1"), DigestUtils.sha256("leaf2")));
    }

    @Test
    void fourLeavesGiveHeightThreeAndExpectedRoot() {
        MerkleTree tree = MerkleTree.fromLeaves(leaves("a", "b", "c", "d"));
        byte[] ab = DigestUtils.hashPair(DigestUtils.sha256("a"), DigestUtils.sha256("b"));
        byte[] cd = DigestUtils.hashPair(DigestUtils.sha256("c"), DigestUtils.sha256("d"));

        assertThat(tree.height()).isEqualTo(3);
        assertThat(tree.root().orElseThrow()).isEqualTo(DigestUtils.hashPair(ab, cd));
    }

    @Test
    void oddLeafIsPairedWithItself() {
        MerkleTree tree = MerkleTree.fromLeaves(leaves("a", "b", "c"));
        byte[] ha = DigestUtils.sha256("a");
        byte[] hb = DigestUtils.sha256("b");
        byte[] hc = DigestUtils.sha256("c");
        byte[] ab = DigestUtils.hashPair(ha, hb);

        assertThat(tree.root().orElseThrow()).isEqualTo(DigestUtils.hashPair(ab, DigestUtils.hashPair(hc, hc)));

        MerkleProof last = tree.proof(2);
        assertThat(last.getSiblings()).hasSize(2);
        assertThat(last.getSiblings().get(0)).isEqualTo(hc);
        assertThat(last.getSiblings().get(1)).isEqualTo(ab);
        assertThat(last.getPositions()).containsExactly(SiblingPosition.RIGHT, SiblingPosition.LEFT);

        for (int i = 0; i < 3; i++) {
            assertThat(tree.verifyProof(tree.proof(i))).as("leaf %d", i).isTrue();
        }
    }

    @Test
    void siblingPositionsFollowIndexParity() {
        MerkleTree tree = MerkleTree.fromLeaves(numberedLeaves(4));

        assertThat(tree.proof(0).getPositions()).containsExactly(SiblingPosition.RIGHT, SiblingPosition.RIGHT);
        assertThat(tree.proof(1).getPositions()).containsExactly(SiblingPosition.LEFT, SiblingPosition.RIGHT);
        assertThat(tree.proof(2).getPositions()).containsExactly(SiblingPosition.RIGHT, SiblingPosition.LEFT);
        assertThat(tree.proof(3).getPositions()).containsExactly(SiblingPosition.LEFT, SiblingPosition.LEFT);
    }

    @Test
    void everyLeafOfEveryTreeSizeVerifies() {
        for (int count = 1; count <= 33; count++) {
            MerkleTree tree = MerkleTree.fromLeaves(numberedLeaves(count));
            int expectedHeight = 32 - Integer.numberOfLeadingZeros(count - 1) + 1;

            assertThat(tree.height()).as("height for %d leaves", count).isEqualTo(expectedHeight);
            for (int i = 0; i < count; i++) {
                MerkleProof proof = tree.proof(i);
                assertThat(proof.getSiblings()).hasSize(tree.height() - 1);
                assertThat(tree.verifyProof(proof)).as("leaf %d of %d", i, count).isTrue();
            }
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 3, 5, 8})
    void flippingAnyBitBreaksTheProof(int count) {
        MerkleTree tree = MerkleTree.fromLeaves(numberedLeaves(count));
        byte[] root = tree.root().orElseThrow();

        for (int i = 0; i < count; i++) {
            MerkleProof proof = tree.proof(i);

            byte[] leaf = proof.getLeafHash();
            leaf[i % leaf.length] ^= 0x01;
            MerkleProof tamperedLeaf = new MerkleProof(i, leaf, proof.getSiblings(), proof.getPositions());
            assertThat(tamperedLeaf.verifyAgainst(root)).isFalse();

            for (int s = 0; s < proof.getSiblings().size(); s++) {
                List<byte[]> siblings = proof.getSiblings();
                siblings.get(s)[31] ^= (byte) 0x80;
                MerkleProof tamperedSibling = new MerkleProof(i, proof.getLeafHash(), siblings, proof.getPositions());
                assertThat(tamperedSibling.verifyAgainst(root)).as("leaf %d sibling %d", i, s).isFalse();
            }
        }
    }

    @Test
    void proofIndexMustBeInRange() {
        MerkleTree tree = MerkleTree.fromLeaves(numberedLeaves(3));

        assertThatThrownBy(() -> tree.proof(3))
                .isInstanceOf(MerkleException.class)
                .hasMessageContaining("out of range");
        assertThatThrownBy(() -> tree.proof(-1)).isInstanceOf(MerkleException.class);
    }

    @Test
    void fromLeafHashesSkipsLeafHashing() {
        List<byte[]> hashes = List.of(DigestUtils.sha256("a"), DigestUtils.sha256("b"));

        MerkleTree fromHashes = MerkleTree.fromLeafHashes(hashes);
        MerkleTree fromLeaves = MerkleTree.fromLeaves(leaves("a", "b"));

        assertThat(fromHashes.rootHex()).isEqualTo(fromLeaves.rootHex());
        assertThatThrownBy(() -> MerkleTree.fromLeafHashes(List.of(new byte[31])))
                .isInstanceOf(MerkleException.class);
    }

    @Test
    void leafOrderDeterminesRoot() {
        MerkleTree forward = MerkleTree.fromLeaves(leaves("a", "b"));
        MerkleTree reversed = MerkleTree.fromLeaves(leaves("b", "a"));

        assertThat(forward.rootHex()).isNotEqualTo(reversed.rootHex());
    }

    @Test
    void accessorsReturnCopies() {
        MerkleTree tree = MerkleTree.fromLeaves(leaves("a", "b"));
        String rootHex = tree.rootHex().orElseThrow();

        tree.root().orElseThrow()[0] ^= 0x01;
        tree.leafHash(0)[0] ^= 0x01;

        assertThat(tree.rootHex()).contains(rootHex);
        assertThat(tree.leafHash(0)).isEqualTo(DigestUtils.sha256("a"));
    }

}
