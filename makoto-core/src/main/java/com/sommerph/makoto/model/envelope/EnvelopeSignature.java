package com.sommerph.makoto.model.envelope;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EnvelopeSignature {

    // First 16 hex chars of SHA-256 over the signer's uncompressed point
    private String keyid;

    // Base64 of the 64-byte r || s signature over the PAE
    private String sig;

}
