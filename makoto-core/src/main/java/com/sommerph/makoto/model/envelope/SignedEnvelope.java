package com.sommerph.makoto.model.envelope;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * DSSE envelope: a base64 payload, its type and any number of signatures over the PAE.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SignedEnvelope {

    private String payloadType;
    private String payload;
    private List<EnvelopeSignature> signatures = new ArrayList<>();

}
