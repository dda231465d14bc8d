package com.sommerph.makoto.service.verification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sommerph.makoto.exception.InvalidAttestationException;
import com.sommerph.makoto.model.attestation.AttestationType;
import com.sommerph.makoto.model.attestation.PredicateType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class AttestationTypeDetector {

    private final ObjectMapper mapper = new ObjectMapper();

    public AttestationType detect(String json) {
        return detect(parse(json));
    }

    /**
     * Envelope fields win over a predicate type, which wins over manifest fields.
     */
    public AttestationType detect(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new InvalidAttestationException("Unknown attestation type");
        }
        if (node.has("payloadType") && node.has("signatures")) {
            return AttestationType.SIGNED;
        }
        JsonNode predicateType = node.get("predicateType");
        if (predicateType != null && predicateType.isTextual()) {
            PredicateType type = PredicateType.fromUri(predicateType.asText());
            if (type != PredicateType.UNKNOWN) {
                return AttestationType.fromPredicateType(type);
            }
        }
        if (node.has("dbomVersion") && node.has("dbomId")) {
            return AttestationType.DBOM;
        }
        throw new InvalidAttestationException("Unknown attestation type");
    }

    JsonNode parse(String json) {
        if (json == null) {
            throw new InvalidAttestationException("Missing attestation JSON");
        }
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Cannot parse attestation JSON: {}", e.getOriginalMessage());
            throw new InvalidAttestationException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

}
