package com.sommerph.makoto.service.verification;

import com.sommerph.makoto.AttestationFixtures;
import com.sommerph.makoto.exception.InvalidAttestationException;
import com.sommerph.makoto.model.attestation.AttestationType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AttestationTypeDetectorTest {

    private final AttestationTypeDetector detector = new AttestationTypeDetector();

    @Test
    void detectsStatementsByPredicateType() {
        assertThat(detector.detect(AttestationFixtures.json("origin"))).isEqualTo(AttestationType.ORIGIN);
        assertThat(detector.detect(AttestationFixtures.json("transform"))).isEqualTo(AttestationType.TRANSFORM);
        assertThat(detector.detect(AttestationFixtures.json("stream-window"))).isEqualTo(AttestationType.STREAM_WINDOW);
    }

    @Test
    void detectsManifestByIdAndVersion() {
        assertThat(detector.detect(AttestationFixtures.json("dbom"))).isEqualTo(AttestationType.DBOM);
    }

    @Test
    void envelopeFieldsTakePriority() {
        String json = "{\"payloadType\":\"application/vnd.in-toto+json\",\"payload\":\"e30=\",\"signatures\":[],"
                + "\"predicateType\":\"https://makoto.dev/origin/v1\"}";

        assertThat(detector.detect(json)).isEqualTo(AttestationType.SIGNED);
    }

    @Test
    void unknownShapesAreRejected() {
        assertThatThrownBy(() -> detector.detect("{\"predicateType\":\"https://example.com/other/v1\"}"))
                .isInstanceOf(InvalidAttestationException.class)
                .hasMessage("Invalid attestation: Unknown attestation type");
        assertThatThrownBy(() -> detector.detect("{\"payloadType\":\"application/vnd.in-toto+json\"}"))
                .isInstanceOf(InvalidAttestationException.class);
        assertThatThrownBy(() -> detector.detect("{\"dbomId\":\"urn:dbom:x\"}"))
                .isInstanceOf(InvalidAttestationException.class);
        assertThatThrownBy(() -> detector.detect("[1,2,3]"))
                .isInstanceOf(InvalidAttestationException.class);
    }

    @Test
    void malformedJsonIsInvalidAttestation() {
        assertThatThrownBy(() -> detector.detect("{\"_type\":"))
                .isInstanceOf(InvalidAttestationException.class)
                .hasMessageContaining("Malformed JSON");
    }

    @Test
    void typesPrintTheirShortNames() {
        assertThat(AttestationType.STREAM_WINDOW).hasToString("stream-window");
        assertThat(AttestationType.DBOM).hasToString("dbom");
        assertThat(AttestationType.SIGNED.getDisplayName()).isEqualTo("signed");
    }

}
