package com.sommerph.makoto.model.attestation;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Digest set of a subject. {@code sha256} is required by every Makoto statement; other
 * algorithms are kept as they come. {@code recordCount} is a decimal string so counts of any
 * size survive a decode and re-sign unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Digest {

    private String sha256;
    private String sha512;
    private String recordCount;
    private String merkleRoot;
    @Setter(AccessLevel.NONE)
    private Map<String, Object> additional = new LinkedHashMap<>();

    public Digest(String sha256) {
        this.sha256 = sha256;
    }

    @JsonAnyGetter
    public Map<String, Object> getAdditional() {
        return additional;
    }

    @JsonAnySetter
    public void putAdditional(String algorithm, Object value) {
        additional.put(algorithm, value);
    }

}
