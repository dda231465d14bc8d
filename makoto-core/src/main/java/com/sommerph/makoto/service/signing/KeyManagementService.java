package com.sommerph.makoto.service.signing;

import com.sommerph.makoto.config.MakotoProperties;
import com.sommerph.makoto.exception.InvalidAttestationException;
import com.sommerph.makoto.exception.KeyMaterialException;
import com.sommerph.makoto.signing.MakotoSigner;
import com.sommerph.makoto.signing.MakotoVerifier;
import com.sommerph.makoto.util.DigestUtils;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Holds the signing key of this process, loaded once from {@code makoto.keys.*}.
 */
@Slf4j
@Service
public class KeyManagementService {

    private final MakotoProperties properties;

    @Getter
    private MakotoSigner signer;

    public KeyManagementService(MakotoProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        MakotoProperties.Keys keys = properties.getKeys();
        log.info("Initialize signing key from source: {}", keys.getSource());
        this.signer = switch (keys.getSource() == null ? "" : keys.getSource().toLowerCase()) {
            case "generate" -> MakotoSigner.generate();
            case "pem" -> loadPem(keys.getPemPath());
            case "raw" -> loadRaw(keys.getPrivateKeyHex());
            default -> throw new IllegalArgumentException("Unsupported key source: " + keys.getSource());
        };
        log.info("Signing key ready with key id: {}", signer.keyId());
    }

    public MakotoVerifier getVerifier() {
        return signer.verifier();
    }

    public String getKeyId() {
        return signer.keyId();
    }

    private MakotoSigner loadPem(String pemPath) {
        if (pemPath == null || pemPath.isBlank()) {
            throw new IllegalArgumentException("makoto.keys.pem-path is required when the key source is pem");
        }
        log.info("Load signing key from PEM file: {}", pemPath);
        try {
            return MakotoSigner.fromPem(Files.readString(Path.of(pemPath), StandardCharsets.US_ASCII));
        } catch (IOException e) {
            log.error("Failed to read PEM file: {}", pemPath, e);
            throw new KeyMaterialException("Cannot read PEM file " + pemPath, e);
        }
    }

    private MakotoSigner loadRaw(String privateKeyHex) {
        if (privateKeyHex == null || privateKeyHex.isBlank()) {
            throw new IllegalArgumentException("makoto.keys.private-key-hex is required when the key source is raw");
        }
        log.info("Load signing key from configured hex scalar");
        try {
            return MakotoSigner.fromBytes(DigestUtils.fromHex(privateKeyHex.trim()));
        } catch (InvalidAttestationException e) {
            throw new KeyMaterialException("makoto.keys.private-key-hex is not valid hex", e);
        }
    }

}
