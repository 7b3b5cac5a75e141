package com.loopflow.loopflow_engine.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loopflow.loopflow_engine.exception.StepExecutionException;

import java.util.Map;

/** JSON in and out of HTTP bodies, shared by the integration handlers. */
public final class JsonPayloads {

    private static final TypeReference<Map<String, Object>> OBJECT = new TypeReference<>() {};

    private JsonPayloads() {
    }

    /** Parsed JSON value of {@code text}, or the text itself when it is not JSON. */
    public static Object parseOrText(ObjectMapper mapper, String text) {
        if (text == null || text.isBlank()) return text;
        try {
            return mapper.readValue(text, Object.class);
        } catch (JsonProcessingException notJson) {
            return text;
        }
    }

    /** A JSON object body; anything else is a provider error. */
    public static Map<String, Object> parseObject(ObjectMapper mapper, String text, String source) {
        if (text == null || text.isBlank()) {
            throw new StepExecutionException(source + " returned an empty response");
        }
        try {
            return mapper.readValue(text, OBJECT);
        } catch (JsonProcessingException e) {
            throw new StepExecutionException(source + " returned a response that is not a JSON object", e);
        }
    }

    public static String write(ObjectMapper mapper, Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StepExecutionException("Could not serialize request body: " + e.getOriginalMessage(), e);
        }
    }
}
