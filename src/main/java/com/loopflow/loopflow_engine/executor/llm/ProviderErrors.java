package com.loopflow.loopflow_engine.executor.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Pulls a readable message out of a provider's error body. */
final class ProviderErrors {

    private static final int MAX_BODY = 200;

    private ProviderErrors() {
    }

    static String describe(ObjectMapper mapper, String body) {
        if (body == null || body.isBlank()) return "";
        try {
            JsonNode error = mapper.readTree(body).path("error");
            if (error.isTextual()) return error.asText();
            JsonNode message = error.path("message");
            if (message.isTextual()) return message.asText();
            return truncate(body);
        } catch (JsonProcessingException notJson) {
            return truncate(body);
        }
    }

    static String normalizeBaseUrl(String baseUrl, String fallback) {
        String value = baseUrl == null || baseUrl.isBlank() ? fallback : baseUrl.trim();
        return value.replaceAll("/+$", "");
    }

    private static String truncate(String body) {
        return body.length() > MAX_BODY ? body.substring(0, MAX_BODY) : body;
    }
}
