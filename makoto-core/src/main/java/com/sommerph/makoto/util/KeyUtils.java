package com.sommerph.makoto.util;

import com.sommerph.makoto.exception.KeyMaterialException;
import org.bouncycastle.jce.ECNamedCurveTable;
import org.bouncycastle.jce.interfaces.ECPrivateKey;
import org.bouncycastle.jce.interfaces.ECPublicKey;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.jce.spec.ECNamedCurveParameterSpec;
import org.bouncycastle.jce.spec.ECPrivateKeySpec;
import org.bouncycastle.jce.spec.ECPublicKeySpec;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.bouncycastle.util.BigIntegers;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Security;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;

/**
 * P-256 key plumbing: scalar and point encodings, JCA key conversion and key ids.
 */
public final class KeyUtils {

    public static final String CURVE_NAME = "secp256r1";
    public static final String SIGNATURE_ALGORITHM = "SHA256withECDSA";

    public static final int PRIVATE_KEY_LENGTH = 32;
    public static final int COMPRESSED_POINT_LENGTH = 33;
    public static final int UNCOMPRESSED_POINT_LENGTH = 65;

    /** Hex characters of the point digest kept as the key id. */
    public static final int KEY_ID_LENGTH = 16;

    private static final ECNamedCurveParameterSpec CURVE_SPEC;

    static {
        ensureProvider();
        CURVE_SPEC = ECNamedCurveTable.getParameterSpec(CURVE_NAME);
    }

    private KeyUtils() {}

    /**
     * Registers the BouncyCastle provider unless it is already installed. Every lookup of the
     * {@code "BC"} provider goes through here first.
     *
     * @return true when this call installed the provider
     */
    public static synchronized boolean ensureProvider() {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) != null) {
            return false;
        }
        Security.addProvider(new BouncyCastleProvider());
        return true;
    }

    public static ECNamedCurveParameterSpec curveSpec() {
        return CURVE_SPEC;
    }

    public static BigInteger order() {
        return CURVE_SPEC.getN();
    }

    public static ECPoint derivePublicPoint(BigInteger d) {
        return new FixedPointCombMultiplier().multiply(CURVE_SPEC.getG(), d).normalize();
    }

    /** Parses a 32-byte big-endian private scalar and checks it lies in [1, n - 1]. */
    public static BigInteger scalarFromBytes(byte[] raw) {
        if (raw == null || raw.length != PRIVATE_KEY_LENGTH) {
            throw new KeyMaterialException("Private key must be " + PRIVATE_KEY_LENGTH + " bytes, got "
                    + (raw == null ? 0 : raw.length));
        }
        return checkScalar(BigIntegers.fromUnsignedByteArray(raw));
    }

    public static byte[] scalarToBytes(BigInteger d) {
        return BigIntegers.asUnsignedByteArray(PRIVATE_KEY_LENGTH, d);
    }

    public static BigInteger checkScalar(BigInteger d) {
        if (d.signum() <= 0 || d.compareTo(order()) >= 0) {
            throw new KeyMaterialException("Private key scalar out of range");
        }
        return d;
    }

    /** Decodes a compressed or uncompressed SEC1 point on P-256. */
    public static ECPoint decodePoint(byte[] encoded) {
        if (encoded == null
                || (encoded.length != COMPRESSED_POINT_LENGTH && encoded.length != UNCOMPRESSED_POINT_LENGTH)) {
            throw new KeyMaterialException("Public key must be a " + COMPRESSED_POINT_LENGTH + " or "
                    + UNCOMPRESSED_POINT_LENGTH + " byte SEC1 point");
        }
        try {
            ECPoint point = CURVE_SPEC.getCurve().decodePoint(encoded).normalize();
            if (point.isInfinity() || !point.isValid()) {
                throw new KeyMaterialException("Public key is not a valid P-256 point");
            }
            return point;
        } catch (IllegalArgumentException e) {
            throw new KeyMaterialException("Invalid SEC1 point encoding: " + e.getMessage(), e);
        }
    }

    public static byte[] uncompressed(ECPoint point) {
        return point.getEncoded(false);
    }

    public static String keyId(ECPoint point) {
        return DigestUtils.sha256Hex(uncompressed(point)).substring(0, KEY_ID_LENGTH);
    }

    public static PrivateKey toPrivateKey(BigInteger d) {
        try {
            return keyFactory().generatePrivate(new ECPrivateKeySpec(d, CURVE_SPEC));
        } catch (InvalidKeySpecException e) {
            throw new KeyMaterialException("Failed to build EC private key", e);
        }
    }

    public static PublicKey toPublicKey(ECPoint q) {
        try {
            return keyFactory().generatePublic(new ECPublicKeySpec(q, CURVE_SPEC));
        } catch (InvalidKeySpecException e) {
            throw new KeyMaterialException("Failed to build EC public key", e);
        }
    }

    public static BigInteger scalarFromPrivateKey(PrivateKey key) {
        if (!(key instanceof ECPrivateKey)) {
            throw new KeyMaterialException("Not an EC private key: " + key.getAlgorithm());
        }
        ECPrivateKey ecKey = (ECPrivateKey) key;
        if (ecKey.getParameters() != null && !CURVE_SPEC.getCurve().equals(ecKey.getParameters().getCurve())) {
            throw new KeyMaterialException("Private key is not on " + CURVE_NAME);
        }
        return checkScalar(ecKey.getD());
    }

    public static BigInteger scalarFromPkcs8(byte[] der) {
        try {
            return scalarFromPrivateKey(keyFactory().generatePrivate(new PKCS8EncodedKeySpec(der)));
        } catch (InvalidKeySpecException e) {
            throw new KeyMaterialException("Invalid PKCS#8 private key", e);
        }
    }

    public static ECPoint pointFromX509(byte[] der) {
        try {
            PublicKey key = keyFactory().generatePublic(new X509EncodedKeySpec(der));
            if (!(key instanceof ECPublicKey)) {
                throw new KeyMaterialException("Not an EC public key: " + key.getAlgorithm());
            }
            ECPublicKey ecKey = (ECPublicKey) key;
            if (ecKey.getParameters() != null && !CURVE_SPEC.getCurve().equals(ecKey.getParameters().getCurve())) {
                throw new KeyMaterialException("Public key is not on " + CURVE_NAME);
            }
            return decodePoint(ecKey.getQ().getEncoded(false));
        } catch (InvalidKeySpecException e) {
            throw new KeyMaterialException("Invalid X.509 public key", e);
        }
    }

    private static KeyFactory keyFactory() {
        ensureProvider();
        try {
            return KeyFactory.getInstance("EC", BouncyCastleProvider.PROVIDER_NAME);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("EC key factory unavailable", e);
        }
    }

}
