package com.loopflow.loopflow_engine.executor.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loopflow.loopflow_engine.exception.StepExecutionException;
import com.loopflow.loopflow_engine.executor.JsonPayloads;
import com.loopflow.loopflow_engine.executor.StepContext;
import com.loopflow.loopflow_engine.executor.StepHandler;
import com.loopflow.loopflow_engine.executor.StepResult;
import com.loopflow.loopflow_engine.io.HttpCallRequest;
import com.loopflow.loopflow_engine.io.HttpCallResponse;
import com.loopflow.loopflow_engine.io.HttpCaller;
import com.loopflow.loopflow_engine.model.step.ApiCallStep;
import com.loopflow.loopflow_engine.model.step.NodeType;
import com.loopflow.loopflow_engine.model.step.Step;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Generic HTTP request step.
 *
 * The body is sent as JSON when it parses as JSON, otherwise as plain text. The response body
 * becomes the step result (parsed JSON where possible). Non-2xx responses fail the step.
 * Transport errors and 5xx responses are retried per the step's {@code retry} policy with a
 * fixed delay; 4xx responses are never retried.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiCallStepHandler implements StepHandler {

    private static final int MAX_ERROR_BODY = 500;

    private final HttpCaller httpCaller;
    private final ObjectMapper objectMapper;

    @Override
    public Set<NodeType> supportedTypes() {
        return EnumSet.of(NodeType.API_CALL);
    }

    @Override
    public StepResult execute(Step step, StepContext context) {
        ApiCallStep call = (ApiCallStep) step;
        HttpCallRequest request = buildRequest(call, context);

        int maxAttempts = call.retry().effectiveAttempts();
        long delayMs = call.retry().effectiveDelayMs();

        for (int attempt = 1; ; attempt++) {
            String failure;
            try {
                HttpCallResponse response = httpCaller.exchange(request);
                if (response.isSuccessful()) {
                    log.debug("API call {} {} → {}", request.method(), request.url(), response.status());
                    return StepResult.of(JsonPayloads.parseOrText(objectMapper, response.body()));
                }
                failure = "API call " + request.method() + " " + request.url() + " failed with HTTP "
                        + response.status() + abbreviate(response.body());
                if (!response.isServerError() || attempt >= maxAttempts) {
                    throw new StepExecutionException(failure);
                }
            } catch (ResourceAccessException ex) {
                failure = "API call " + request.method() + " " + request.url() + " failed: " + ex.getMessage();
                if (attempt >= maxAttempts) {
                    throw new StepExecutionException(failure, ex);
                }
            }

            log.warn("{} (attempt {}/{}). Retrying in {} ms", failure, attempt, maxAttempts, delayMs);
            pause(delayMs);
        }
    }

    private HttpCallRequest buildRequest(ApiCallStep call, StepContext context) {
        String url = context.resolve(call.url());
        if (url.isBlank()) {
            throw new StepExecutionException("apiCall step has no url");
        }

        Map<String, String> headers = new LinkedHashMap<>();
        call.headers().forEach((name, value) -> headers.put(name, context.resolve(value)));

        String body = null;
        if (call.body() != null && !call.body().isBlank()) {
            body = context.resolve(call.body());
            boolean json = !(JsonPayloads.parseOrText(objectMapper, body) instanceof String);
            boolean contentTypeGiven = headers.keySet().stream().anyMatch(HttpHeaders.CONTENT_TYPE::equalsIgnoreCase);
            if (!json && !contentTypeGiven) {
                headers.put(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_PLAIN_VALUE);
            }
        }
        return HttpCallRequest.of(call.method(), url, headers, body);
    }

    private static void pause(long delayMs) {
        if (delayMs <= 0) return;
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StepExecutionException("API call retry interrupted", e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null || body.isBlank()) return "";
        String trimmed = body.length() > MAX_ERROR_BODY ? body.substring(0, MAX_ERROR_BODY) + "…" : body;
        return ": " + trimmed;
    }
}
