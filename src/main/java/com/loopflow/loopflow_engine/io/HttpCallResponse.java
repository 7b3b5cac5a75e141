package com.loopflow.loopflow_engine.io;

import java.util.Map;

public record HttpCallResponse(int status, String body, Map<String, String> headers) {

    public HttpCallResponse {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    public static HttpCallResponse of(int status, String body) {
        return new HttpCallResponse(status, body, Map.of());
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    public boolean isServerError() {
        return status >= 500 && status < 600;
    }
}
