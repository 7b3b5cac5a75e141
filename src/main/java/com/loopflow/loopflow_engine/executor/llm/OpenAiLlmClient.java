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

/** Chat Completions API; also works against any OpenAI-compatible base URL. */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiLlmClient implements LlmClient {

    private static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    private final HttpCaller   httpCaller;
    private final ObjectMapper objectMapper;

    @Override
    public LlmProvider getProvider() { return LlmProvider.OPENAI; }

    @Override
    public String getDefaultBaseUrl() { return DEFAULT_BASE_URL; }

    @Override
    public LlmResponse call(LlmRequest req, String apiKey) {
        String url = ProviderErrors.normalizeBaseUrl(req.getBaseUrl(), DEFAULT_BASE_URL) + "/chat/completions";

        List<Map<String, String>> messages = new ArrayList<>();
        if (req.getSystemPrompt() != null && !req.getSystemPrompt().isBlank()) {
            messages.add(Map.of("role", "system", "content", req.getSystemPrompt()));
        }
        messages.add(Map.of("role", "user", "content", req.getUserPrompt()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", req.getModel());
        body.put("messages", messages);
        body.put("temperature", req.getTemperature());
        body.put("max_tokens", req.getMaxTokens());
        body.put("n", 1);
        body.put("stream", false);
        if (req.getTopP() != null) body.put("top_p", req.getTopP());

        try {
            HttpCallResponse resp = httpCaller.exchange(new HttpCallRequest("POST", url,
                    Map.of("Authorization", "Bearer " + apiKey),
                    JsonPayloads.write(objectMapper, body), req.getTimeout()));
            if (!resp.isSuccessful()) {
                log.error("[OpenAI] HTTP {}", resp.status());
                return LlmResponse.error("OpenAI API error " + resp.status() + ": "
                        + ProviderErrors.describe(objectMapper, resp.body()));
            }
            JsonNode root = objectMapper.readTree(resp.body());
            JsonNode content = root.path("choices").path(0).path("message").path("content");
            String text = content.isTextual() ? content.asText()
                    : content.isMissingNode() || content.isNull() ? null : content.toString();
            JsonNode usage = root.path("usage");
            return LlmResponse.ok(text, root.path("model").asText(req.getModel()),
                    usage.path("prompt_tokens").asInt(), usage.path("completion_tokens").asInt());
        } catch (JsonProcessingException e) {
            return LlmResponse.error("OpenAI returned a response that is not JSON");
        } catch (RestClientException e) {
            log.error("[OpenAI] Request to {} failed: {}", url, e.getMessage());
            return LlmResponse.error("OpenAI request failed: " + e.getMessage());
        }
    }
}
