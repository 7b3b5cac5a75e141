package com.loopflow.loopflow_engine.executor.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loopflow.loopflow_engine.exception.StepExecutionException;
import com.loopflow.loopflow_engine.executor.StepContext;
import com.loopflow.loopflow_engine.executor.StepResult;
import com.loopflow.loopflow_engine.io.HttpCallRequest;
import com.loopflow.loopflow_engine.io.HttpCallResponse;
import com.loopflow.loopflow_engine.io.HttpCaller;
import com.loopflow.loopflow_engine.model.scope.RuntimeVariableScope;
import com.loopflow.loopflow_engine.model.step.ApiCallStep;
import com.loopflow.loopflow_engine.model.step.NodeType;
import com.loopflow.loopflow_engine.model.step.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ApiCallStepHandlerTest {

    @Mock
    private HttpCaller httpCaller;

    private ApiCallStepHandler handler;
    private StepContext context;

    @BeforeEach
    void setUp() {
        handler = new ApiCallStepHandler(httpCaller, new ObjectMapper());
        context = new StepContext("run", new RuntimeVariableScope(Map.of("id", 42, "token", "t0k")), () -> null);
    }

    private static ApiCallStep post(String url, String body, RetryPolicy retry) {
        return new ApiCallStep(NodeType.API_CALL, "post", url, body, Map.of("Authorization", "Bearer {{token}}"), "resp", retry);
    }

    @Test
    void substitutesUrlHeadersAndBodyAndParsesJson() {
        when(httpCaller.exchange(any())).thenReturn(HttpCallResponse.of(200, "{\"ok\":true,\"id\":42}"));

        StepResult result = handler.execute(post("https://api.example/items/{{id}}", "{\"id\": {{id}}}", null), context);

        ArgumentCaptor<HttpCallRequest> sent = ArgumentCaptor.forClass(HttpCallRequest.class);
        verify(httpCaller).exchange(sent.capture());
        assertThat(sent.getValue().method()).isEqualTo("POST");
        assertThat(sent.getValue().url()).isEqualTo("https://api.example/items/42");
        assertThat(sent.getValue().headers()).containsEntry("Authorization", "Bearer t0k");
        assertThat(sent.getValue().body()).isEqualTo("{\"id\": 42}");
        assertThat(result.value()).isEqualTo(Map.of("ok", true, "id", 42));
    }

    @Test
    void plainTextBodyGetsTextContentType() {
        when(httpCaller.exchange(any())).thenReturn(HttpCallResponse.of(200, "accepted"));

        StepResult result = handler.execute(post("https://api.example/log", "just text", null), context);

        ArgumentCaptor<HttpCallRequest> sent = ArgumentCaptor.forClass(HttpCallRequest.class);
        verify(httpCaller).exchange(sent.capture());
        assertThat(sent.getValue().headers()).containsEntry("Content-Type", "text/plain");
        assertThat(result.value()).isEqualTo("accepted");
    }

    @Test
    void retriesServerErrorsUpToMaxAttempts() {
        when(httpCaller.exchange(any()))
                .thenReturn(HttpCallResponse.of(503, "busy"))
                .thenThrow(new ResourceAccessException("connection reset"))
                .thenReturn(HttpCallResponse.of(200, "{\"done\":1}"));

        StepResult result = handler.execute(post("https://api.example/x", null, new RetryPolicy(3, 0L)), context);

        verify(httpCaller, times(3)).exchange(any());
        assertThat(result.value()).isEqualTo(Map.of("done", 1));
    }

    @Test
    void clientErrorsAreNotRetried() {
        when(httpCaller.exchange(any())).thenReturn(HttpCallResponse.of(404, "{\"error\":\"nope\"}"));

        assertThatThrownBy(() -> handler.execute(post("https://api.example/x", null, new RetryPolicy(5, 0L)), context))
                .isInstanceOf(StepExecutionException.class)
                .hasMessageContaining("failed with HTTP 404");
        verify(httpCaller, times(1)).exchange(any());
    }

    @Test
    void givesUpAfterLastAttempt() {
        when(httpCaller.exchange(any())).thenReturn(HttpCallResponse.of(500, ""));

        assertThatThrownBy(() -> handler.execute(post("https://api.example/x", null, new RetryPolicy(2, 0L)), context))
                .isInstanceOf(StepExecutionException.class)
                .hasMessage("API call POST https://api.example/x failed with HTTP 500");
        verify(httpCaller, times(2)).exchange(any());
    }
}
