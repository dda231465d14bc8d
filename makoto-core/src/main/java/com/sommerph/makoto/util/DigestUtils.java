package com.sommerph.makoto.util;

import com.sommerph.makoto.exception.InvalidAttestationException;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 hashing and lowercase hex encoding.
 */
public final class DigestUtils {

    public static final String ALGORITHM = "SHA-256";

    /** Output size of the digest in bytes. */
    public static final int HASH_LENGTH = 32;

    /** Length of a hex encoded digest. */
    public static final int HEX_LENGTH = HASH_LENGTH * 2;

    private DigestUtils() {}

    public static byte[] sha256(byte[] data) {
        return newDigest().digest(data);
    }

    public static byte[] sha256(String input) {
        return sha256(input.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256Hex(byte[] data) {
        return toHex(sha256(data));
    }

    public static String sha256Hex(String input) {
        return toHex(sha256(input));
    }

    /** H(left || right), the parent of two Merkle nodes. */
    public static byte[] hashPair(byte[] left, byte[] right) {
        MessageDigest digest = newDigest();
        digest.update(left);
        digest.update(right);
        return digest.digest();
    }

    public static String toHex(byte[] data) {
        return Hex.toHexString(data);
    }

    public static byte[] fromHex(String hex) {
        if (hex == null || hex.length() % 2 != 0) {
            throw new InvalidAttestationException("Invalid hex: odd length or missing value");
        }
        try {
            return Hex.decodeStrict(hex);
        } catch (DecoderException e) {
            throw new InvalidAttestationException("Invalid hex: " + e.getMessage(), e);
        }
    }

    /** Decodes a hex digest and insists on exactly {@link #HASH_LENGTH} bytes. */
    public static byte[] hashFromHex(String hex) {
        byte[] bytes = fromHex(hex);
        if (bytes.length != HASH_LENGTH) {
            throw new InvalidAttestationException("Expected " + HASH_LENGTH + " bytes, got " + bytes.length);
        }
        return bytes;
    }

    public static boolean isDigestHex(String value) {
        return value != null && value.length() == HEX_LENGTH;
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 hashing failed", e);
        }
    }

}
