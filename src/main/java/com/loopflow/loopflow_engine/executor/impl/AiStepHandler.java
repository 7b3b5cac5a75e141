package com.loopflow.loopflow_engine.executor.impl;

import com.loopflow.loopflow_engine.exception.CredentialException;
import com.loopflow.loopflow_engine.exception.StepExecutionException;
import com.loopflow.loopflow_engine.executor.StepContext;
import com.loopflow.loopflow_engine.executor.StepHandler;
import com.loopflow.loopflow_engine.executor.StepResult;
import com.loopflow.loopflow_engine.executor.llm.LlmClient;
import com.loopflow.loopflow_engine.executor.llm.LlmClientFactory;
import com.loopflow.loopflow_engine.io.CredentialLookup;
import com.loopflow.loopflow_engine.model.domain.Credential;
import com.loopflow.loopflow_engine.model.llm.LlmProvider;
import com.loopflow.loopflow_engine.model.llm.LlmRequest;
import com.loopflow.loopflow_engine.model.llm.LlmResponse;
import com.loopflow.loopflow_engine.model.step.AiCompletionStep;
import com.loopflow.loopflow_engine.model.step.NodeType;
import com.loopflow.loopflow_engine.model.step.Step;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * aiOpenAI / aiAnthropic / aiOllama.
 *
 * Single-turn completion with deterministic defaults: temperature 0, 256 max tokens,
 * 20 s timeout. The trimmed reply text is the step result.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AiStepHandler implements StepHandler {

    private static final int DEFAULT_MAX_TOKENS = 256;
    private static final int MAX_TOKENS_CAP     = 4096;
    private static final int DEFAULT_TIMEOUT_MS = 20_000;
    private static final int MIN_TIMEOUT_MS     = 1_000;
    private static final int MAX_TIMEOUT_MS     = 120_000;

    private final LlmClientFactory clientFactory;
    private final CredentialLookup credentialLookup;

    @Override
    public Set<NodeType> supportedTypes() {
        return EnumSet.of(NodeType.AI_OPENAI, NodeType.AI_ANTHROPIC, NodeType.AI_OLLAMA);
    }

    @Override
    public StepResult execute(Step step, StepContext context) {
        AiCompletionStep ai = (AiCompletionStep) step;
        LlmProvider provider = providerOf(ai.type());
        String name = provider.getDisplayName();

        String prompt       = context.resolve(ai.prompt()).trim();
        String systemPrompt = context.resolve(ai.systemPrompt()).trim();
        String model        = context.resolve(ai.model()).trim();
        if (prompt.isEmpty()) throw new StepExecutionException(name + " step requires a prompt");
        if (model.isEmpty())  throw new StepExecutionException(name + " step requires a model");

        String apiKey = provider.requiresApiKey() ? resolveApiKey(ai, name, context) : null;
        LlmClient client = clientFactory.getClient(provider);

        LlmRequest request = LlmRequest.builder()
                .systemPrompt(systemPrompt.isEmpty() ? null : systemPrompt)
                .userPrompt(prompt)
                .model(model)
                .baseUrl(context.resolve(ai.baseUrl()))
                .temperature(clamp(ai.temperature() != null ? ai.temperature() : 0d, 0d, 1d))
                .maxTokens(maxTokens(ai.maxTokens()))
                .topP(ai.topP() != null ? clamp(ai.topP(), 0d, 1d) : null)
                .timeout(Duration.ofMillis(timeoutMs(ai.timeoutMs())))
                .build();

        log.debug("[{}] model={} promptLength={} systemPrompt={}", name, model, prompt.length(),
                request.getSystemPrompt() != null);

        LlmResponse response = client.call(request, apiKey);
        if (!response.isSuccess()) {
            throw new StepExecutionException(response.getErrorMessage());
        }
        String text = response.getRawText();
        if (text == null || text.isBlank()) {
            throw new StepExecutionException(name + " returned an empty response");
        }
        log.debug("[{}] reply: {} chars, tokens in={} out={}", name, text.length(),
                response.getInputTokens(), response.getOutputTokens());
        return StepResult.of(text.trim());
    }

    /** Credential first, then the step's own key. Runs before any request is sent. */
    private String resolveApiKey(AiCompletionStep step, String name, StepContext context) {
        if (step.credentialId() != null && !step.credentialId().isBlank()) {
            Credential credential = credentialLookup.getCredential(step.credentialId());
            if (credential == null) {
                throw new CredentialException(name + " credential not found");
            }
            String fromStore = credential.firstField("apiKey", "key", "token", "accessToken");
            if (fromStore == null) {
                throw new CredentialException(name + " credential is missing an API key value");
            }
            return context.resolve(fromStore);
        }
        String direct = context.resolve(step.apiKey());
        if (direct.isBlank()) {
            throw new CredentialException("API key is required for " + name);
        }
        return direct;
    }

    private static LlmProvider providerOf(NodeType type) {
        return switch (type) {
            case AI_OPENAI    -> LlmProvider.OPENAI;
            case AI_ANTHROPIC -> LlmProvider.ANTHROPIC;
            case AI_OLLAMA    -> LlmProvider.OLLAMA;
            default -> throw new UnsupportedOperationException("Not an AI step: " + type);
        };
    }

    private static int maxTokens(Integer requested) {
        int value = requested != null ? requested : DEFAULT_MAX_TOKENS;
        return Math.min(Math.max(1, value), MAX_TOKENS_CAP);
    }

    private static long timeoutMs(Integer requested) {
        int value = requested != null ? requested : DEFAULT_TIMEOUT_MS;
        return Math.min(Math.max(MIN_TIMEOUT_MS, value), MAX_TIMEOUT_MS);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
