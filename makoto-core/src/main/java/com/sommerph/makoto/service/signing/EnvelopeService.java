package com.sommerph.makoto.service.signing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sommerph.makoto.config.MakotoProperties;
import com.sommerph.makoto.exception.InvalidAttestationException;
import com.sommerph.makoto.model.envelope.EnvelopeSignature;
import com.sommerph.makoto.model.envelope.EnvelopeVerdict;
import com.sommerph.makoto.model.envelope.SignedEnvelope;
import com.sommerph.makoto.signing.MakotoSigner;
import com.sommerph.makoto.signing.MakotoVerifier;
import com.sommerph.makoto.util.DsseUtils;
import com.sommerph.makoto.util.SignatureUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Signs payloads into DSSE envelopes and checks them again. The signed bytes are always the PAE
 * rebuilt from the envelope's own {@code payloadType} and {@code payload}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnvelopeService {

    private final MakotoProperties properties;
    private final KeyManagementService keyService;

    private final ObjectMapper mapper = new ObjectMapper();

    /** Signs with the key configured under {@code makoto.keys}. */
    public SignedEnvelope sign(Object payload) {
        return sign(payload, keyService.getSigner());
    }

    public SignedEnvelope sign(Object payload, MakotoSigner signer) {
        log.info("Sign payload with key {}", signer.keyId());
        String payloadType = properties.getEnvelope().getPayloadType();
        byte[] json;
        try {
            json = mapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize payload of type {}", payload.getClass().getName(), e);
            throw new InvalidAttestationException("Payload cannot be serialized to JSON", e);
        }
        String encodedPayload = DsseUtils.encodePayload(json);
        List<EnvelopeSignature> signatures = new ArrayList<>();
        signatures.add(signPae(payloadType, encodedPayload, signer));
        return new SignedEnvelope(payloadType, encodedPayload, signatures);
    }

    /** Appends a signature by {@code signer} over the same PAE. */
    public SignedEnvelope addSignature(SignedEnvelope envelope, MakotoSigner signer) {
        log.info("Add signature with key {}", signer.keyId());
        if (envelope.getSignatures() == null) {
            envelope.setSignatures(new ArrayList<>());
        }
        envelope.getSignatures().add(signPae(envelope.getPayloadType(), envelope.getPayload(), signer));
        return envelope;
    }

    /**
     * True only when at least one signature carries the verifier's key id and every such
     * signature is valid.
     */
    public boolean verify(SignedEnvelope envelope, MakotoVerifier verifier) {
        return verifyDetailed(envelope, verifier) == EnvelopeVerdict.VERIFIED;
    }

    public EnvelopeVerdict verifyDetailed(SignedEnvelope envelope, MakotoVerifier verifier) {
        log.info("Verify envelope against key {}", verifier.keyId());
        byte[] pae = DsseUtils.pae(envelope.getPayloadType(), envelope.getPayload());
        boolean found = false;
        List<EnvelopeSignature> signatures = envelope.getSignatures() == null ? List.of() : envelope.getSignatures();
        for (EnvelopeSignature signature : signatures) {
            if (signature == null) {
                log.warn("Skip empty signature entry");
                continue;
            }
            if (!verifier.keyId().equals(signature.getKeyid())) {
                continue;
            }
            found = true;
            byte[] raw = SignatureUtils.decodeBase64Signature(signature.getSig());
            if (!verifier.verify(pae, raw)) {
                log.warn("Invalid signature for key {}", verifier.keyId());
                return EnvelopeVerdict.INVALID_SIGNATURE;
            }
        }
        if (!found) {
            log.warn("No signature with key id {} in envelope", verifier.keyId());
            return EnvelopeVerdict.NO_MATCHING_KEY;
        }
        return EnvelopeVerdict.VERIFIED;
    }

    public <T> T decodePayload(SignedEnvelope envelope, Class<T> type) {
        byte[] json = DsseUtils.decodePayload(envelope.getPayload());
        try {
            return mapper.readValue(json, type);
        } catch (IOException e) {
            log.warn("Envelope payload does not match {}: {}", type.getSimpleName(), e.getMessage());
            throw new InvalidAttestationException("Payload does not match " + type.getSimpleName(), e);
        }
    }

    public JsonNode decodePayloadTree(SignedEnvelope envelope) {
        byte[] json = DsseUtils.decodePayload(envelope.getPayload());
        try {
            return mapper.readTree(json);
        } catch (IOException e) {
            throw new InvalidAttestationException("Payload is not valid JSON", e);
        }
    }

    public String toJson(SignedEnvelope envelope) {
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new InvalidAttestationException("Envelope cannot be serialized to JSON", e);
        }
    }

    public SignedEnvelope fromJson(String json) {
        try {
            return mapper.readValue(json, SignedEnvelope.class);
        } catch (JsonProcessingException e) {
            throw new InvalidAttestationException("Malformed envelope JSON: " + e.getOriginalMessage(), e);
        }
    }

    private EnvelopeSignature signPae(String payloadType, String encodedPayload, MakotoSigner signer) {
        byte[] pae = DsseUtils.pae(payloadType, encodedPayload);
        String sig = SignatureUtils.base64(signer.sign(pae));
        return new EnvelopeSignature(signer.keyId(), sig);
    }

}
