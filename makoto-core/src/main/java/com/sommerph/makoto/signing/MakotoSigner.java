package com.sommerph.makoto.signing;

import com.sommerph.makoto.exception.KeyMaterialException;
import com.sommerph.makoto.util.KeyUtils;
import com.sommerph.makoto.util.PemUtils;
import com.sommerph.makoto.util.SignatureUtils;
import org.bouncycastle.jce.interfaces.ECPrivateKey;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.io.pem.PemObject;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.spec.ECGenParameterSpec;

/**
 * P-256 signing key. Produces 64-byte {@code r || s} SHA-256/ECDSA signatures.
 * The private scalar only leaves this object through {@link #toBytes()} or {@link #toPem()}.
 */
public final class MakotoSigner {

    private final BigInteger d;
    private final PrivateKey privateKey;
    private final MakotoVerifier verifier;

    private MakotoSigner(BigInteger d) {
        this.d = d;
        this.privateKey = KeyUtils.toPrivateKey(d);
        ECPoint q = KeyUtils.derivePublicPoint(d);
        this.verifier = new MakotoVerifier(q);
    }

    public static MakotoSigner generate() {
        try {
            KeyUtils.ensureProvider();
            KeyPairGenerator keyGen = KeyPairGenerator.getInstance("EC", BouncyCastleProvider.PROVIDER_NAME);
            keyGen.initialize(new ECGenParameterSpec(KeyUtils.CURVE_NAME), new SecureRandom());
            KeyPair keyPair = keyGen.generateKeyPair();
            return new MakotoSigner(((ECPrivateKey) keyPair.getPrivate()).getD());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("EC key generation failed", e);
        }
    }

    public static MakotoSigner fromBytes(byte[] privateKey) {
        return new MakotoSigner(KeyUtils.scalarFromBytes(privateKey));
    }

    /**
     * Accepts the raw-scalar block written by {@link #toPem()} or a PKCS#8 {@code PRIVATE KEY}.
     */
    public static MakotoSigner fromPem(String pem) {
        PemObject object = PemUtils.fromPem(pem);
        byte[] body = object.getContent();
        if (body.length == KeyUtils.PRIVATE_KEY_LENGTH) {
            return fromBytes(body);
        }
        try {
            return new MakotoSigner(KeyUtils.scalarFromPkcs8(body));
        } catch (KeyMaterialException e) {
            throw new KeyMaterialException("PEM block " + object.getType()
                    + " is neither a raw P-256 scalar nor a PKCS#8 EC key", e);
        }
    }

    public byte[] toBytes() {
        return KeyUtils.scalarToBytes(d);
    }

    public String toPem() {
        return PemUtils.toPem(PemUtils.PRIVATE_KEY_LABEL, toBytes());
    }

    /** Uncompressed SEC1 encoding of the public point. */
    public byte[] publicKeyBytes() {
        return verifier.toBytes();
    }

    public String keyId() {
        return verifier.keyId();
    }

    public MakotoVerifier verifier() {
        return verifier;
    }

    public byte[] sign(byte[] data) {
        try {
            KeyUtils.ensureProvider();
            Signature signer = Signature.getInstance(KeyUtils.SIGNATURE_ALGORITHM, BouncyCastleProvider.PROVIDER_NAME);
            signer.initSign(privateKey);
            signer.update(data);
            return SignatureUtils.derToRaw(signer.sign());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("ECDSA signing failed", e);
        }
    }

    @Override
    public String toString() {
        return "MakotoSigner[keyId=" + keyId() + "]";
    }

}
