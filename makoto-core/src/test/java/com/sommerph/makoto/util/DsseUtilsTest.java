package com.sommerph.makoto.util;

import com.sommerph.makoto.exception.InvalidAttestationException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DsseUtilsTest {

    @Test
    void paeJoinsVersionTypeAndPayloadWithSingleSpaces() {
        byte[] pae = DsseUtils.pae(DsseUtils.IN_TOTO_PAYLOAD_TYPE, "eyJhIjoxfQ==");

        assertThat(new String(pae, StandardCharsets.UTF_8))
                .isEqualTo("DSSEv1 application/vnd.in-toto+json eyJhIjoxfQ==");
    }

    @Test
    void payloadUsesPaddedStandardBase64() {
        String encoded = DsseUtils.encodePayload("{\"a\":1}".getBytes(StandardCharsets.UTF_8));

        assertThat(encoded).isEqualTo("eyJhIjoxfQ==");
        assertThat(new String(DsseUtils.decodePayload(encoded), StandardCharsets.UTF_8)).isEqualTo("{\"a\":1}");
    }

    @Test
    void decodeRejectsInvalidBase64() {
        assertThatThrownBy(() -> DsseUtils.decodePayload("not base64!"))
                .isInstanceOf(InvalidAttestationException.class);
        assertThatThrownBy(() -> DsseUtils.decodePayload("abc"))
                .isInstanceOf(InvalidAttestationException.class);
        assertThatThrownBy(() -> DsseUtils.decodePayload(null))
                .isInstanceOf(InvalidAttestationException.class);
    }

}
