package com.sommerph.makoto.util;

import com.sommerph.makoto.exception.KeyMaterialException;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;
import org.bouncycastle.util.io.pem.PemWriter;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;

public final class PemUtils {

    public static final String PRIVATE_KEY_LABEL = "MAKOTO PRIVATE KEY";
    public static final String PUBLIC_KEY_LABEL = "MAKOTO PUBLIC KEY";

    private PemUtils() {}

    public static String toPem(String label, byte[] content) {
        StringWriter out = new StringWriter();
        try (PemWriter writer = new PemWriter(out)) {
            writer.writeObject(new PemObject(label, content));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write PEM block " + label, e);
        }
        return out.toString();
    }

    /**
     * Reads the first PEM block of {@code pem}. The label is returned as-is; callers decide
     * what the body holds.
     */
    public static PemObject fromPem(String pem) {
        if (pem == null || pem.isBlank()) {
            throw new KeyMaterialException("Empty PEM input");
        }
        try (PemReader reader = new PemReader(new StringReader(pem))) {
            PemObject object = reader.readPemObject();
            if (object == null || object.getContent() == null || object.getContent().length == 0) {
                throw new KeyMaterialException("No PEM block found");
            }
            return object;
        } catch (IOException e) {
            throw new KeyMaterialException("Malformed PEM: " + e.getMessage(), e);
        }
    }

}
