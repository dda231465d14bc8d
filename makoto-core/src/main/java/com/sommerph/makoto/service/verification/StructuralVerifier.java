package com.sommerph.makoto.service.verification;

import com.fasterxml.jackson.databind.JsonNode;
import com.sommerph.makoto.exception.InvalidAttestationException;
import com.sommerph.makoto.exception.InvalidPredicateTypeException;
import com.sommerph.makoto.exception.MakotoException;
import com.sommerph.makoto.exception.MissingFieldException;
import com.sommerph.makoto.model.attestation.AttestationType;
import com.sommerph.makoto.model.attestation.MakotoLevel;
import com.sommerph.makoto.model.attestation.Statement;
import com.sommerph.makoto.model.attestation.VerificationResult;
import com.sommerph.makoto.util.DigestUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * L1 checks on the shape of an attestation. A broken statement header fails at once; past the
 * header every problem is collected so the caller sees all of them.
 */
@Slf4j
@Component
public class StructuralVerifier {

    static final String DBOM_ID_PREFIX = "urn:dbom:";

    public VerificationResult verify(AttestationType type, JsonNode node) {
        log.info("Verify {} attestation structure", type);
        if (type == AttestationType.SIGNED) {
            return VerificationResult.fail("Signed attestations require a verifier key");
        }
        if (type == AttestationType.DBOM) {
            return verifyDbom(node);
        }
        try {
            checkStatementHeader(type, node);
        } catch (MakotoException e) {
            log.warn("Statement header rejected: {}", e.getMessage());
            return VerificationResult.fail("Structure validation failed: " + e.getMessage());
        }

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        checkSubjects(node.get("subject"), errors);
        JsonNode predicate = node.path("predicate");
        String label = switch (type) {
            case ORIGIN -> {
                checkOrigin(predicate, errors);
                yield "Origin";
            }
            case TRANSFORM -> {
                checkTransform(predicate, errors, warnings);
                yield "Transform";
            }
            case STREAM_WINDOW -> {
                checkStreamWindow(predicate, errors, warnings);
                yield "Stream window";
            }
            default -> throw new IllegalArgumentException("Not a statement type: " + type);
        };
        return toResult(errors, warnings, label + " attestation structure is valid");
    }

    void checkStatementHeader(AttestationType type, JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new InvalidAttestationException("Attestation must be a JSON object");
        }
        String statementType = text(node, "_type");
        if (!Statement.STATEMENT_TYPE.equals(statementType)) {
            throw new InvalidAttestationException("Invalid statement type: expected "
                    + Statement.STATEMENT_TYPE + ", got " + statementType);
        }
        String expected = type.getPredicateType().getUri();
        String actual = text(node, "predicateType");
        if (!expected.equals(actual)) {
            throw new InvalidPredicateTypeException(expected, actual);
        }
        JsonNode subjects = node.get("subject");
        if (subjects == null || !subjects.isArray() || subjects.isEmpty()) {
            throw new MissingFieldException("subject");
        }
    }

    private void checkSubjects(JsonNode subjects, List<String> errors) {
        for (int i = 0; i < subjects.size(); i++) {
            JsonNode subject = subjects.get(i);
            String name = text(subject, "name");
            if (isBlank(name)) {
                errors.add("Subject " + i + " missing 'name' field");
            }
            String sha256 = text(subject.path("digest"), "sha256");
            if (sha256 == null) {
                errors.add("Subject " + i + " (" + name + ") missing sha256 digest");
            } else if (!DigestUtils.isDigestHex(sha256)) {
                errors.add(hashLengthMessage("subject '" + name + "'", sha256));
            }
        }
    }

    private void checkOrigin(JsonNode predicate, List<String> errors) {
        JsonNode origin = predicate.path("origin");
        if (isBlank(text(origin, "source"))) {
            errors.add("Origin source is empty");
        }
        if (!present(origin, "collectionTimestamp")) {
            errors.add("Origin missing 'collectionTimestamp' field");
        }
        if (!present(predicate.path("collector"), "id")) {
            errors.add("Collector missing 'id' field");
        }
    }

    private void checkTransform(JsonNode predicate, List<String> errors, List<String> warnings) {
        JsonNode inputs = predicate.path("inputs");
        if (!inputs.isArray() || inputs.isEmpty()) {
            errors.add("No inputs in transform attestation");
        } else {
            for (int i = 0; i < inputs.size(); i++) {
                JsonNode input = inputs.get(i);
                String name = text(input, "name");
                if (isBlank(name)) {
                    errors.add("Transform input " + i + " missing 'name' field");
                }
                String sha256 = text(input.path("digest"), "sha256");
                if (sha256 == null) {
                    errors.add("Transform input " + i + " missing 'digest' field");
                } else if (!DigestUtils.isDigestHex(sha256)) {
                    errors.add(hashLengthMessage("input '" + name + "'", sha256));
                }
            }
        }
        JsonNode transform = predicate.path("transform");
        if (!present(transform, "type")) {
            errors.add("Transform missing 'type' field");
        }
        if (isBlank(text(transform, "name"))) {
            errors.add("Transform name is empty");
        }
        if (!present(predicate.path("executor"), "id")) {
            warnings.add("Executor missing 'id' field");
        }
    }

    private void checkStreamWindow(JsonNode predicate, List<String> errors, List<String> warnings) {
        JsonNode stream = predicate.path("stream");
        if (isBlank(text(stream, "id"))) {
            errors.add("Stream missing 'id' field");
        }
        if (!present(stream, "source")) {
            warnings.add("Stream missing 'source' field");
        }

        JsonNode window = predicate.path("window");
        if (!present(window, "type")) {
            errors.add("Window missing 'type' field");
        }
        if (!present(window, "duration")) {
            errors.add("Window missing 'duration' field");
        }

        JsonNode integrity = predicate.path("integrity");
        JsonNode merkleTree = integrity.path("merkleTree");
        if (!merkleTree.isObject()) {
            errors.add("Integrity missing 'merkleTree' field");
        } else {
            if (isBlank(text(merkleTree, "algorithm"))) {
                errors.add("MerkleTree missing 'algorithm' field");
            }
            JsonNode leafCount = merkleTree.path("leafCount");
            if (!leafCount.canConvertToLong() || leafCount.asLong() <= 0) {
                errors.add("Merkle tree has no leaves");
            }
            String root = text(merkleTree, "root");
            if (root == null) {
                errors.add("MerkleTree missing 'root' field");
            } else if (!DigestUtils.isDigestHex(root)) {
                errors.add(hashLengthMessage("Merkle root", root));
            }
        }

        JsonNode chain = integrity.path("chain");
        if (chain.isObject()) {
            String previousRoot = text(chain, "previousMerkleRoot");
            String previousWindowId = text(chain, "previousWindowId");
            if (previousRoot != null && !DigestUtils.isDigestHex(previousRoot)) {
                errors.add(hashLengthMessage("previous Merkle root", previousRoot));
            }
            if (previousWindowId != null && previousWindowId.isEmpty()) {
                errors.add("Previous window ID is empty");
            }
            if ((previousRoot == null) != (previousWindowId == null)) {
                warnings.add("Chain link is incomplete: previousWindowId and previousMerkleRoot should be set together");
            }
        }

        if (!predicate.path("collector").isObject()) {
            warnings.add("Stream window predicate missing 'collector' field");
        }
    }

    private VerificationResult verifyDbom(JsonNode node) {
        if (node == null || !node.isObject()) {
            return VerificationResult.fail("Structure validation failed: Invalid attestation: DBOM must be a JSON object");
        }
        List<String> errors = new ArrayList<>();
        if (isBlank(text(node, "dbomVersion"))) {
            errors.add("DBOM version is empty");
        }
        String dbomId = text(node, "dbomId");
        if (dbomId == null || !dbomId.startsWith(DBOM_ID_PREFIX)) {
            errors.add("DBOM ID must start with '" + DBOM_ID_PREFIX + "'");
        }
        JsonNode dataset = node.path("dataset");
        if (isBlank(text(dataset, "name"))) {
            errors.add("Dataset missing 'name' field");
        }
        if (isBlank(text(dataset, "version"))) {
            errors.add("Dataset missing 'version' field");
        }
        if (isBlank(text(dataset, "created"))) {
            errors.add("Dataset missing 'created' field");
        }
        String datasetSha256 = text(dataset.path("digest"), "sha256");
        if (datasetSha256 == null) {
            errors.add("Dataset missing 'digest.sha256' field");
        } else if (!DigestUtils.isDigestHex(datasetSha256)) {
            errors.add(hashLengthMessage("dataset", datasetSha256));
        }
        JsonNode sources = node.path("sources");
        if (!sources.isArray() || sources.isEmpty()) {
            errors.add("DBOM has no sources");
        } else {
            for (int i = 0; i < sources.size(); i++) {
                if (isBlank(text(sources.get(i), "name"))) {
                    errors.add("Source " + i + " missing 'name' field");
                }
            }
        }
        return toResult(errors, List.of(), "DBOM structure is valid");
    }

    private static VerificationResult toResult(List<String> errors, List<String> warnings, String passMessage) {
        if (!errors.isEmpty()) {
            log.warn("Structural verification failed with {} errors", errors.size());
            return VerificationResult.fail(errors).withWarnings(warnings);
        }
        return VerificationResult.pass(MakotoLevel.L1).withMessage(passMessage).withWarnings(warnings);
    }

    private static String hashLengthMessage(String what, String value) {
        return "Invalid SHA-256 hash length for " + what + ": expected " + DigestUtils.HEX_LENGTH
                + ", got " + value.length();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static boolean present(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value != null && !value.isNull();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

}
