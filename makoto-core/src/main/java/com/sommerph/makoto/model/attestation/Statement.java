package com.sommerph.makoto.model.attestation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * in-toto v1 statement. The predicate is kept as an untyped map.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Statement {

    public static final String STATEMENT_TYPE = "https://in-toto.io/Statement/v1";

    @JsonProperty("_type")
    private String type = STATEMENT_TYPE;

    private List<Subject> subject = new ArrayList<>();
    private String predicateType;
    private Map<String, Object> predicate = new LinkedHashMap<>();

}
