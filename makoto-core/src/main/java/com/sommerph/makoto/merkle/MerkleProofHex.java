package com.sommerph.makoto.merkle;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of a {@link MerkleProof}: hex digests and {@code "left"}/{@code "right"} positions.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MerkleProofHex {

    private int leafIndex;
    private String leafHash;
    private List<String> siblings = new ArrayList<>();
    private List<String> positions = new ArrayList<>();

}
