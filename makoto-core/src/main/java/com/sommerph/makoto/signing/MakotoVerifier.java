package com.sommerph.makoto.signing;

import com.sommerph.makoto.util.KeyUtils;
import com.sommerph.makoto.util.PemUtils;
import com.sommerph.makoto.util.SignatureUtils;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.io.pem.PemObject;

import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.Signature;

/**
 * P-256 public key that checks 64-byte {@code r || s} signatures.
 */
public final class MakotoVerifier {

    private final ECPoint point;
    private final PublicKey publicKey;
    private final String keyId;

    MakotoVerifier(ECPoint point) {
        this.point = point;
        this.publicKey = KeyUtils.toPublicKey(point);
        this.keyId = KeyUtils.keyId(point);
    }

    /** Compressed (33 bytes) or uncompressed (65 bytes) SEC1 point. */
    public static MakotoVerifier fromBytes(byte[] publicKey) {
        return new MakotoVerifier(KeyUtils.decodePoint(publicKey));
    }

    /**
     * Accepts the raw SEC1 block written by {@link #toPem()} or an X.509 {@code PUBLIC KEY}.
     */
    public static MakotoVerifier fromPem(String pem) {
        PemObject object = PemUtils.fromPem(pem);
        byte[] body = object.getContent();
        if (body.length == KeyUtils.COMPRESSED_POINT_LENGTH || body.length == KeyUtils.UNCOMPRESSED_POINT_LENGTH) {
            return fromBytes(body);
        }
        return new MakotoVerifier(KeyUtils.pointFromX509(body));
    }

    public byte[] toBytes() {
        return KeyUtils.uncompressed(point);
    }

    public String toPem() {
        return PemUtils.toPem(PemUtils.PUBLIC_KEY_LABEL, toBytes());
    }

    public String keyId() {
        return keyId;
    }

    /**
     * @return whether {@code signature} is valid for {@code data}
     * @throws com.sommerph.makoto.exception.SignatureFormatException if the signature is not 64 bytes
     *         or either scalar is outside [1, n - 1]
     */
    public boolean verify(byte[] data, byte[] signature) {
        byte[] der = SignatureUtils.rawToDer(signature, KeyUtils.order());
        try {
            KeyUtils.ensureProvider();
            Signature verifier = Signature.getInstance(KeyUtils.SIGNATURE_ALGORITHM, BouncyCastleProvider.PROVIDER_NAME);
            verifier.initVerify(publicKey);
            verifier.update(data);
            return verifier.verify(der);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("ECDSA verification failed", e);
        }
    }

    @Override
    public String toString() {
        return "MakotoVerifier[keyId=" + keyId + "]";
    }

}
