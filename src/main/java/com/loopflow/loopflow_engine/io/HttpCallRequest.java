package com.loopflow.loopflow_engine.io;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One outbound HTTP request. {@code body} is sent as-is; a JSON content type is assumed
 * unless a Content-Type header is given. A null timeout uses the caller's default.
 */
public record HttpCallRequest(String method,
                              String url,
                              Map<String, String> headers,
                              String body,
                              Duration timeout) {

    public HttpCallRequest {
        method  = method == null || method.isBlank() ? "GET" : method.toUpperCase();
        headers = headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(headers)) : Map.of();
    }

    public static HttpCallRequest of(String method, String url, Map<String, String> headers, String body) {
        return new HttpCallRequest(method, url, headers, body, null);
    }

    public HttpCallRequest withTimeout(Duration timeout) {
        return new HttpCallRequest(method, url, headers, body, timeout);
    }
}
