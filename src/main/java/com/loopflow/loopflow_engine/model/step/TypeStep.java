package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Types text into an input. When {@code credentialId} is set the text comes from the
 * credential's {@code credentialField} (default "password") instead of {@code value}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TypeStep(NodeType type,
                       String selector,
                       String value,
                       String credentialId,
                       String credentialField) implements Step {

    public TypeStep {
        type = NodeType.TYPE;
    }

    public static TypeStep of(String selector, String value) {
        return new TypeStep(NodeType.TYPE, selector, value, null, null);
    }

    public static TypeStep fromCredential(String selector, String credentialId, String credentialField) {
        return new TypeStep(NodeType.TYPE, selector, null, credentialId, credentialField);
    }
}
