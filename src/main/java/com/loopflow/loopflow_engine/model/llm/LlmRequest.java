package com.loopflow.loopflow_engine.model.llm;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Provider-agnostic completion request built by the AI step handler.
 * Each LlmClient translates it into its provider's wire format.
 */
@Value
@Builder
public class LlmRequest {

    String systemPrompt;
    String userPrompt;
    String model;
    String baseUrl;
    int maxTokens;
    double temperature;
    Double topP;          // omitted from the payload when null
    Duration timeout;
}
