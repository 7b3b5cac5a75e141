package com.loopflow.loopflow_engine.executor.llm;

import com.loopflow.loopflow_engine.model.llm.LlmProvider;
import com.loopflow.loopflow_engine.model.llm.LlmRequest;
import com.loopflow.loopflow_engine.model.llm.LlmResponse;

public interface LlmClient {

    LlmProvider getProvider();

    /** Base URL used when the step does not set one; no trailing slash. */
    String getDefaultBaseUrl();

    // apiKey is null for providers that need none
    LlmResponse call(LlmRequest request, String apiKey);
}
