package com.sommerph.makoto.util;

import com.sommerph.makoto.exception.InvalidAttestationException;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.regex.Pattern;

public final class DsseUtils {

    public static final String PAE_VERSION = "DSSEv1";
    public static final String IN_TOTO_PAYLOAD_TYPE = "application/vnd.in-toto+json";

    // Standard alphabet, optional '=' padding
    private static final Pattern BASE64_PATTERN = Pattern.compile("^[A-Za-z0-9+/]*={0,2}$");

    private DsseUtils() {}

    /** Pre-authentication encoding: {@code "DSSEv1 <payloadType> <payload>"} as UTF-8. */
    public static byte[] pae(String payloadType, String payloadBase64) {
        String encoded = PAE_VERSION + " " + payloadType + " " + payloadBase64;
        return encoded.getBytes(StandardCharsets.UTF_8);
    }

    public static String encodePayload(byte[] payload) {
        return Base64.getEncoder().encodeToString(payload);
    }

    public static byte[] decodePayload(String payloadBase64) {
        if (!isValidBase64(payloadBase64)) {
            throw new InvalidAttestationException("Envelope payload is not valid base64");
        }
        try {
            return Base64.getDecoder().decode(payloadBase64);
        } catch (IllegalArgumentException e) {
            throw new InvalidAttestationException("Envelope payload is not valid base64", e);
        }
    }

    public static boolean isValidBase64(String s) {
        return s != null && s.length() % 4 == 0 && BASE64_PATTERN.matcher(s).matches();
    }

}
