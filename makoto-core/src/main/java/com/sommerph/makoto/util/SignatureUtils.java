package com.sommerph.makoto.util;

import com.sommerph.makoto.exception.SignatureFormatException;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1InputStream;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.asn1.DERSequence;
import org.bouncycastle.util.BigIntegers;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.util.Base64;

/**
 * Conversions between the DER signatures produced by JCA and the fixed-width {@code r || s}
 * form carried in envelopes.
 */
public class SignatureUtils {

    /** Width of a P-256 signature in its raw form. */
    public static final int RAW_SIGNATURE_LENGTH = 64;

    private static final int SCALAR_LENGTH = RAW_SIGNATURE_LENGTH / 2;

    public static String base64(byte[] data) {
        return Base64.getEncoder().encodeToString(data);
    }

    public static byte[] decodeBase64Signature(String value) {
        if (value == null) {
            throw new SignatureFormatException("Missing signature value");
        }
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw new SignatureFormatException("Invalid signature base64: " + e.getMessage(), e);
        }
    }

    public static EcdsaSignature decodeDerSignature(byte[] derBytes) {
        try (ASN1InputStream asn1InputStream = new ASN1InputStream(new ByteArrayInputStream(derBytes))) {
            ASN1Sequence sequence = (ASN1Sequence) asn1InputStream.readObject();
            BigInteger r = ((ASN1Integer) sequence.getObjectAt(0)).getValue();
            BigInteger s = ((ASN1Integer) sequence.getObjectAt(1)).getValue();
            return new EcdsaSignature(r, s);
        } catch (IOException | ClassCastException e) {
            throw new SignatureFormatException("Failed to parse DER-encoded ECDSA signature", e);
        }
    }

    public static byte[] derToRaw(byte[] derBytes) {
        EcdsaSignature sig = decodeDerSignature(derBytes);
        return concatSignature(sig.getR(), sig.getS());
    }

    /**
     * Splits a raw signature and checks both scalars lie in [1, order - 1].
     */
    public static EcdsaSignature decodeRawSignature(byte[] raw, BigInteger order) {
        if (raw == null || raw.length != RAW_SIGNATURE_LENGTH) {
            throw new SignatureFormatException("Invalid signature format: expected "
                    + RAW_SIGNATURE_LENGTH + " bytes, got " + (raw == null ? 0 : raw.length));
        }
        BigInteger r = BigIntegers.fromUnsignedByteArray(raw, 0, SCALAR_LENGTH);
        BigInteger s = BigIntegers.fromUnsignedByteArray(raw, SCALAR_LENGTH, SCALAR_LENGTH);
        if (!inRange(r, order) || !inRange(s, order)) {
            throw new SignatureFormatException("Invalid signature format: scalar out of range");
        }
        return new EcdsaSignature(r, s);
    }

    public static byte[] rawToDer(byte[] raw, BigInteger order) {
        EcdsaSignature sig = decodeRawSignature(raw, order);
        ASN1Encodable[] parts = { new ASN1Integer(sig.getR()), new ASN1Integer(sig.getS()) };
        try {
            ASN1Primitive sequence = new DERSequence(parts);
            return sequence.getEncoded(ASN1Encoding.DER);
        } catch (IOException e) {
            throw new SignatureFormatException("Failed to encode ECDSA signature as DER", e);
        }
    }

    public static byte[] concatSignature(BigInteger r, BigInteger s) {
        byte[] result = new byte[RAW_SIGNATURE_LENGTH];
        System.arraycopy(BigIntegers.asUnsignedByteArray(SCALAR_LENGTH, r), 0, result, 0, SCALAR_LENGTH);
        System.arraycopy(BigIntegers.asUnsignedByteArray(SCALAR_LENGTH, s), 0, result, SCALAR_LENGTH, SCALAR_LENGTH);
        return result;
    }

    private static boolean inRange(BigInteger value, BigInteger order) {
        return value.signum() > 0 && value.compareTo(order) < 0;
    }

    public static class EcdsaSignature {
        private final BigInteger r;
        private final BigInteger s;

        public EcdsaSignature(BigInteger r, BigInteger s) {
            this.r = r;
            this.s = s;
        }

        public BigInteger getR() {
            return r;
        }

        public BigInteger getS() {
            return s;
        }
    }

}
