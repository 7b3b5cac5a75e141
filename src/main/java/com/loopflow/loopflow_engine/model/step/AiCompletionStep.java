package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Single-turn chat completion against one of the supported providers, chosen by {@code type}.
 * Numeric fields are optional; the handler applies defaults and clamps.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AiCompletionStep(NodeType type,
                               String prompt,
                               String systemPrompt,
                               String model,
                               Double temperature,
                               Integer maxTokens,
                               Double topP,
                               Integer timeoutMs,
                               String baseUrl,
                               String apiKey,
                               String credentialId,
                               String storeKey) implements Step {

    public AiCompletionStep {
        NodeType.requireFamily(type, NodeType.Family.AI);
    }
}
