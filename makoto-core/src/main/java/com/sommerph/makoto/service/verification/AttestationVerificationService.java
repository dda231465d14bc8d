package com.sommerph.makoto.service.verification;

import com.fasterxml.jackson.databind.JsonNode;
import com.sommerph.makoto.exception.ChainVerificationException;
import com.sommerph.makoto.exception.HashMismatchException;
import com.sommerph.makoto.exception.InvalidAttestationException;
import com.sommerph.makoto.exception.SignatureFormatException;
import com.sommerph.makoto.model.attestation.AttestationType;
import com.sommerph.makoto.model.attestation.Digest;
import com.sommerph.makoto.model.attestation.MakotoLevel;
import com.sommerph.makoto.model.attestation.VerificationResult;
import com.sommerph.makoto.model.envelope.EnvelopeVerdict;
import com.sommerph.makoto.model.envelope.SignedEnvelope;
import com.sommerph.makoto.service.signing.EnvelopeService;
import com.sommerph.makoto.signing.MakotoVerifier;
import com.sommerph.makoto.util.DigestUtils;
import com.sommerph.makoto.util.DsseUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for consumers: plain JSON (L1), signed envelopes (L2), digests and chains.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttestationVerificationService {

    private final AttestationTypeDetector detector;
    private final StructuralVerifier structuralVerifier;
    private final EnvelopeService envelopeService;

    public VerificationResult verifyJson(String json) {
        log.info("Verify attestation JSON");
        JsonNode node;
        AttestationType type;
        try {
            node = detector.parse(json);
            type = detector.detect(node);
        } catch (InvalidAttestationException e) {
            log.warn("Type detection failed: {}", e.getMessage());
            return VerificationResult.fail("Type detection failed: " + e.getMessage());
        }
        return structuralVerifier.verify(type, node);
    }

    public VerificationResult verifySigned(String envelopeJson, MakotoVerifier verifier) {
        SignedEnvelope envelope;
        try {
            envelope = envelopeService.fromJson(envelopeJson);
        } catch (InvalidAttestationException e) {
            return VerificationResult.fail("Envelope parse error: " + e.getMessage());
        }
        return verifySigned(envelope, verifier);
    }

    public VerificationResult verifySigned(SignedEnvelope envelope, MakotoVerifier verifier) {
        log.info("Verify signed attestation for key {}", verifier.keyId());
        EnvelopeVerdict verdict;
        try {
            verdict = envelopeService.verifyDetailed(envelope, verifier);
        } catch (SignatureFormatException e) {
            return VerificationResult.fail(e.getMessage());
        }
        if (verdict == EnvelopeVerdict.NO_MATCHING_KEY) {
            return VerificationResult.fail("No signature found for key: " + verifier.keyId());
        }
        if (verdict == EnvelopeVerdict.INVALID_SIGNATURE) {
            return VerificationResult.fail("Signature verification failed");
        }

        JsonNode payload;
        AttestationType type;
        try {
            payload = envelopeService.decodePayloadTree(envelope);
            type = detector.detect(payload);
        } catch (InvalidAttestationException e) {
            return VerificationResult.fail("Payload decode error: " + e.getMessage());
        }
        if (type == AttestationType.SIGNED) {
            return VerificationResult.fail("Payload decode error: nested envelopes are not supported");
        }
        VerificationResult structure = structuralVerifier.verify(type, payload);
        if (!structure.isValid()) {
            return structure;
        }

        VerificationResult result = VerificationResult.pass(MakotoLevel.L2)
                .withMessage("Signed attestation is valid")
                .withMessage("Signature verified for key: " + verifier.keyId())
                .withWarnings(structure.getWarnings());
        if (!DsseUtils.IN_TOTO_PAYLOAD_TYPE.equals(envelope.getPayloadType())) {
            result.withWarning("Unexpected payload type: " + envelope.getPayloadType());
        }
        return result;
    }

    /**
     * @throws HashMismatchException when the SHA-256 of {@code data} differs from the digest
     */
    public boolean verifyDigest(Digest digest, byte[] data) {
        String computed = DigestUtils.sha256Hex(data);
        if (!computed.equals(digest.getSha256())) {
            log.warn("Digest mismatch: expected {}, got {}", digest.getSha256(), computed);
            throw new HashMismatchException(digest.getSha256(), computed);
        }
        return true;
    }

    public boolean verifyDigestHex(Digest digest, String expectedSha256) {
        return digest.getSha256() != null && digest.getSha256().equalsIgnoreCase(expectedSha256);
    }

    /**
     * Verifies an ordered list of statements: each one structurally, transform inputs against the
     * outputs of earlier statements, and stream windows against the root of the window they point back to.
     */
    public VerificationResult verifyChain(List<String> statements) {
        log.info("Verify chain of {} attestations", statements.size());
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Map<String, String> knownOutputs = new HashMap<>();
        Map<String, String> windowRoots = new HashMap<>();
        String lastWindowRoot = null;

        for (int i = 0; i < statements.size(); i++) {
            String prefix = "Statement " + i + ": ";
            JsonNode node;
            try {
                node = detector.parse(statements.get(i));
            } catch (InvalidAttestationException e) {
                throw new ChainVerificationException("statement " + i + " is not valid JSON", e);
            }
            AttestationType type;
            try {
                type = detector.detect(node);
            } catch (InvalidAttestationException e) {
                errors.add(prefix + e.getMessage());
                continue;
            }
            if (type == AttestationType.SIGNED || type == AttestationType.DBOM) {
                errors.add(prefix + "only in-toto statements can be chained, got " + type);
                continue;
            }

            VerificationResult result = structuralVerifier.verify(type, node);
            if (!result.isValid()) {
                result.getMessages().forEach(m -> errors.add(prefix + m));
            }
            result.getWarnings().forEach(w -> warnings.add(prefix + w));

            if (type == AttestationType.TRANSFORM) {
                checkInputs(node.path("predicate").path("inputs"), knownOutputs, prefix, errors, warnings);
            }
            if (type == AttestationType.STREAM_WINDOW) {
                JsonNode integrity = node.path("predicate").path("integrity");
                checkWindowLink(integrity.path("chain"), windowRoots, lastWindowRoot, prefix, errors, warnings);
                String root = text(integrity.path("merkleTree"), "root");
                for (JsonNode subject : node.path("subject")) {
                    String name = text(subject, "name");
                    if (name != null && root != null) {
                        windowRoots.put(name, root);
                    }
                }
                lastWindowRoot = root;
            }

            for (JsonNode subject : node.path("subject")) {
                String name = text(subject, "name");
                String sha256 = text(subject.path("digest"), "sha256");
                if (name != null && sha256 != null) {
                    knownOutputs.put(name, sha256);
                }
            }
        }

        if (!errors.isEmpty()) {
            log.warn("Chain verification failed with {} errors", errors.size());
            return VerificationResult.fail(errors).withWarnings(warnings);
        }
        return VerificationResult.pass(MakotoLevel.L1)
                .withMessage("Chain of " + statements.size() + " attestations is valid")
                .withWarnings(warnings);
    }

    private void checkInputs(JsonNode inputs, Map<String, String> knownOutputs, String prefix,
                             List<String> errors, List<String> warnings) {
        for (JsonNode input : inputs) {
            String name = text(input, "name");
            String sha256 = text(input.path("digest"), "sha256");
            if (name == null || name.isEmpty() || sha256 == null || sha256.isEmpty()) {
                continue;
            }
            String known = knownOutputs.get(name);
            if (known == null) {
                warnings.add(prefix + "Input " + name + " not found in previous outputs");
            } else if (!known.equalsIgnoreCase(sha256)) {
                errors.add(prefix + "Input " + name + " hash mismatch with known output");
            }
        }
    }

    private void checkWindowLink(JsonNode chain, Map<String, String> windowRoots, String lastWindowRoot,
                                 String prefix, List<String> errors, List<String> warnings) {
        String previousRoot = text(chain, "previousMerkleRoot");
        if (previousRoot == null) {
            return;
        }
        String previousWindowId = text(chain, "previousWindowId");
        String expected;
        if (previousWindowId != null) {
            expected = windowRoots.get(previousWindowId);
            if (expected == null) {
                warnings.add(prefix + "Previous window " + previousWindowId + " not found in chain");
                return;
            }
        } else if (lastWindowRoot != null) {
            expected = lastWindowRoot;
        } else {
            return;
        }
        if (!expected.equalsIgnoreCase(previousRoot)) {
            errors.add(prefix + "previousMerkleRoot does not match the Merkle root of the previous window");
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

}
