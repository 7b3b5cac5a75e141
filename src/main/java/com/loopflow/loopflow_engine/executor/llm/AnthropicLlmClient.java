package com.loopflow.loopflow_engine.executor.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loopflow.loopflow_engine.executor.JsonPayloads;
import com.loopflow.loopflow_engine.io.HttpCallRequest;
import com.loopflow.loopflow_engine.io.HttpCallResponse;
import com.loopflow.loopflow_engine.io.HttpCaller;
import com.loopflow.loopflow_engine.model.llm.LlmProvider;
import com.loopflow.loopflow_engine.model.llm.LlmRequest;
import com.loopflow.loopflow_engine.model.llm.LlmResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class AnthropicLlmClient implements LlmClient {

    private static final String DEFAULT_BASE_URL  = "https://api.anthropic.com";
    private static final String ANTHROPIC_VERSION = "2023-06-01";

    private final HttpCaller   httpCaller;
    private final ObjectMapper objectMapper;

    @Override
    public LlmProvider getProvider() { return LlmProvider.ANTHROPIC; }

    @Override
    public String getDefaultBaseUrl() { return DEFAULT_BASE_URL; }

    @Override
    public LlmResponse call(LlmRequest req, String apiKey) {
        String url = ProviderErrors.normalizeBaseUrl(req.getBaseUrl(), DEFAULT_BASE_URL) + "/v1/messages";

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", req.getModel());
        body.put("max_tokens", req.getMaxTokens());
        body.put("temperature", req.getTemperature());
        body.put("messages", List.of(Map.of("role", "user", "content", req.getUserPrompt())));
        body.put("stream", false);
        if (req.getSystemPrompt() != null && !req.getSystemPrompt().isBlank()) {
            body.put("system", req.getSystemPrompt());
        }
        if (req.getTopP() != null) body.put("top_p", req.getTopP());

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("x-api-key", apiKey);
        headers.put("anthropic-version", ANTHROPIC_VERSION);

        try {
            HttpCallResponse resp = httpCaller.exchange(new HttpCallRequest("POST", url, headers,
                    JsonPayloads.write(objectMapper, body), req.getTimeout()));
            if (!resp.isSuccessful()) {
                log.error("[Anthropic] HTTP {}", resp.status());
                return LlmResponse.error("Anthropic API error " + resp.status() + ": "
                        + ProviderErrors.describe(objectMapper, resp.body()));
            }
            JsonNode root = objectMapper.readTree(resp.body());
            JsonNode first = root.path("content").path(0);
            String text = first.path("text").isTextual() ? first.path("text").asText()
                    : first.path("content").isTextual() ? first.path("content").asText() : null;
            JsonNode usage = root.path("usage");
            return LlmResponse.ok(text, root.path("model").asText(req.getModel()),
                    usage.path("input_tokens").asInt(), usage.path("output_tokens").asInt());
        } catch (JsonProcessingException e) {
            return LlmResponse.error("Anthropic returned a response that is not JSON");
        } catch (RestClientException e) {
            log.error("[Anthropic] Request to {} failed: {}", url, e.getMessage());
            return LlmResponse.error("Anthropic request failed: " + e.getMessage());
        }
    }
}
