package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outbound HTTP request. {@code method} defaults to GET; the response body is parsed as JSON
 * when possible and stored under {@code storeKey}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiCallStep(NodeType type,
                          String method,
                          String url,
                          String body,
                          Map<String, String> headers,
                          String storeKey,
                          RetryPolicy retry) implements Step {

    public ApiCallStep {
        type = NodeType.API_CALL;
        if (method == null || method.isBlank()) method = "GET";
        headers = headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(headers)) : Map.of();
        if (retry == null) retry = RetryPolicy.NONE;
    }

    public static ApiCallStep get(String url, String storeKey) {
        return new ApiCallStep(NodeType.API_CALL, "GET", url, null, null, storeKey, null);
    }
}
