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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Local Ollama server, /api/chat without streaming. No API key. */
@Slf4j
@Component
@RequiredArgsConstructor
public class OllamaLlmClient implements LlmClient {

    private static final String DEFAULT_BASE_URL = "http://localhost:11434";

    private final HttpCaller   httpCaller;
    private final ObjectMapper objectMapper;

    @Override
    public LlmProvider getProvider() { return LlmProvider.OLLAMA; }

    @Override
    public String getDefaultBaseUrl() { return DEFAULT_BASE_URL; }

    @Override
    public LlmResponse call(LlmRequest req, String apiKey) {
        String url = ProviderErrors.normalizeBaseUrl(req.getBaseUrl(), DEFAULT_BASE_URL) + "/api/chat";

        List<Map<String, String>> messages = new ArrayList<>();
        if (req.getSystemPrompt() != null && !req.getSystemPrompt().isBlank()) {
            messages.add(Map.of("role", "system", "content", req.getSystemPrompt()));
        }
        messages.add(Map.of("role", "user", "content", req.getUserPrompt()));

        Map<String, Object> options = new LinkedHashMap<>();
        options.put("temperature", req.getTemperature());
        if (req.getTopP() != null) options.put("top_p", req.getTopP());
        options.put("num_predict", req.getMaxTokens());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", req.getModel());
        body.put("messages", messages);
        body.put("stream", false);
        body.put("options", options);

        try {
            HttpCallResponse resp = httpCaller.exchange(new HttpCallRequest("POST", url, Map.of(),
                    JsonPayloads.write(objectMapper, body), req.getTimeout()));
            if (!resp.isSuccessful()) {
                log.error("[Ollama] HTTP {}", resp.status());
                return LlmResponse.error("Ollama API error " + resp.status() + ": "
                        + ProviderErrors.describe(objectMapper, resp.body()));
            }
            JsonNode root = objectMapper.readTree(resp.body());
            JsonNode content = root.path("message").path("content");
            if (!content.isTextual() || content.asText().isEmpty()) {
                content = root.path("response");
            }
            String text = content.isTextual() ? content.asText() : null;
            return LlmResponse.ok(text, root.path("model").asText(req.getModel()),
                    root.path("prompt_eval_count").asInt(), root.path("eval_count").asInt());
        } catch (JsonProcessingException e) {
            return LlmResponse.error("Ollama returned a response that is not JSON");
        } catch (RestClientException e) {
            log.error("[Ollama] Request to {} failed: {}", url, e.getMessage());
            return LlmResponse.error("Ollama request failed: " + e.getMessage());
        }
    }
}
