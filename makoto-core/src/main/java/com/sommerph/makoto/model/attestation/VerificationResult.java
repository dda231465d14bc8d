package com.sommerph.makoto.model.attestation;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Getter
public class VerificationResult {

    private final boolean valid;
    private final MakotoLevel level;
    private final List<String> messages = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    private VerificationResult(boolean valid, MakotoLevel level) {
        this.valid = valid;
        this.level = level;
    }

    public static VerificationResult pass(MakotoLevel level) {
        return new VerificationResult(true, level);
    }

    public static VerificationResult fail(String message) {
        return new VerificationResult(false, null).withMessage(message);
    }

    public static VerificationResult fail(List<String> messages) {
        VerificationResult result = new VerificationResult(false, null);
        result.messages.addAll(messages);
        return result;
    }

    public VerificationResult withMessage(String message) {
        messages.add(message);
        return this;
    }

    public VerificationResult withWarning(String warning) {
        warnings.add(warning);
        return this;
    }

    public VerificationResult withWarnings(List<String> more) {
        warnings.addAll(more);
        return this;
    }

    public List<String> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    @Override
    public String toString() {
        return "VerificationResult[valid=" + valid + ", level=" + level
                + ", messages=" + messages + ", warnings=" + warnings + "]";
    }

}
