package com.sommerph.makoto.model.attestation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DigestTest {

    private static final String SHA256 = "a".repeat(64);

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void unknownAlgorithmsAreKeptAndWrittenFlat() throws Exception {
        Digest digest = mapper.readValue(
                "{\"sha256\":\"" + SHA256 + "\",\"sha3_256\":\"" + "b".repeat(64) + "\"}", Digest.class);

        assertThat(digest.getAdditional()).containsEntry("sha3_256", "b".repeat(64));

        JsonNode written = mapper.valueToTree(digest);
        assertThat(written.get("sha3_256").asText()).isEqualTo("b".repeat(64));
        assertThat(written.has("additional")).isFalse();
    }

    @Test
    void fieldNamedAdditionalIsJustAnotherAlgorithm() throws Exception {
        Digest digest = mapper.readValue(
                "{\"sha256\":\"" + SHA256 + "\",\"additional\":\"c0ffee\"}", Digest.class);

        assertThat(digest.getAdditional()).hasSize(1).containsEntry("additional", "c0ffee");
        assertThat(mapper.valueToTree(digest).get("additional").asText()).isEqualTo("c0ffee");
    }

    @Test
    void recordCountIsDecimalString() throws Exception {
        Digest digest = mapper.readValue(
                "{\"sha256\":\"" + SHA256 + "\",\"recordCount\":\"18446744073709551616\"}", Digest.class);

        assertThat(digest.getRecordCount()).isEqualTo("18446744073709551616");
        assertThat(mapper.writeValueAsString(digest)).contains("\"recordCount\":\"18446744073709551616\"");
    }
}
