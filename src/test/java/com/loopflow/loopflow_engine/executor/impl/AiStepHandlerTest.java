package com.loopflow.loopflow_engine.executor.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loopflow.loopflow_engine.exception.CredentialException;
import com.loopflow.loopflow_engine.exception.StepExecutionException;
import com.loopflow.loopflow_engine.executor.StepContext;
import com.loopflow.loopflow_engine.executor.llm.AnthropicLlmClient;
import com.loopflow.loopflow_engine.executor.llm.LlmClientFactory;
import com.loopflow.loopflow_engine.executor.llm.OllamaLlmClient;
import com.loopflow.loopflow_engine.executor.llm.OpenAiLlmClient;
import com.loopflow.loopflow_engine.io.CredentialLookup;
import com.loopflow.loopflow_engine.io.HttpCallRequest;
import com.loopflow.loopflow_engine.io.HttpCallResponse;
import com.loopflow.loopflow_engine.io.HttpCaller;
import com.loopflow.loopflow_engine.model.domain.Credential;
import com.loopflow.loopflow_engine.model.scope.RuntimeVariableScope;
import com.loopflow.loopflow_engine.model.step.AiCompletionStep;
import com.loopflow.loopflow_engine.model.step.NodeType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AiStepHandlerTest {

    @Mock
    private HttpCaller httpCaller;

    @Mock
    private CredentialLookup credentialLookup;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private AiStepHandler handler;
    private StepContext context;

    @BeforeEach
    void setUp() {
        LlmClientFactory factory = new LlmClientFactory(List.of(
                new OpenAiLlmClient(httpCaller, objectMapper),
                new AnthropicLlmClient(httpCaller, objectMapper),
                new OllamaLlmClient(httpCaller, objectMapper)));
        handler = new AiStepHandler(factory, credentialLookup);
        context = new StepContext("run", new RuntimeVariableScope(Map.of("product", "kettle")), () -> null);
    }

    private static AiCompletionStep step(NodeType type, String apiKey, String credentialId, Double temperature) {
        return new AiCompletionStep(type, "Describe a {{product}}", "Be brief", "test-model",
                temperature, null, null, null, null, apiKey, credentialId, "answer");
    }

    @Test
    void missingCredentialFailsBeforeAnyRequest() {
        when(credentialLookup.getCredential("openai-main")).thenReturn(null);

        assertThatThrownBy(() -> handler.execute(step(NodeType.AI_OPENAI, null, "openai-main", null), context))
                .isInstanceOf(CredentialException.class)
                .hasMessage("OpenAI credential not found");
        verifyNoInteractions(httpCaller);
    }

    @Test
    void credentialWithoutKeyFieldIsRejected() {
        when(credentialLookup.getCredential("claude")).thenReturn(new Credential("anthropic", Map.of("user", "me")));

        assertThatThrownBy(() -> handler.execute(step(NodeType.AI_ANTHROPIC, null, "claude", null), context))
                .isInstanceOf(CredentialException.class)
                .hasMessage("Anthropic credential is missing an API key value");
        verifyNoInteractions(httpCaller);
    }

    @Test
    void noKeyAtAllIsRejected() {
        assertThatThrownBy(() -> handler.execute(step(NodeType.AI_OPENAI, " ", null, null), context))
                .isInstanceOf(CredentialException.class)
                .hasMessage("API key is required for OpenAI");
        verifyNoInteractions(httpCaller);
    }

    @Test
    void openAiCompletionWithClampedParameters() throws Exception {
        when(httpCaller.exchange(any())).thenReturn(HttpCallResponse.of(200,
                "{\"model\":\"test-model\",\"choices\":[{\"message\":{\"content\":\"  A kettle boils water. \"}}],"
                        + "\"usage\":{\"prompt_tokens\":9,\"completion_tokens\":5}}"));

        Object reply = handler.execute(step(NodeType.AI_OPENAI, "sk-test", null, 7.0), context).value();

        ArgumentCaptor<HttpCallRequest> sent = ArgumentCaptor.forClass(HttpCallRequest.class);
        verify(httpCaller).exchange(sent.capture());
        HttpCallRequest request = sent.getValue();
        assertThat(request.url()).isEqualTo("https://api.openai.com/v1/chat/completions");
        assertThat(request.headers()).containsEntry("Authorization", "Bearer sk-test");
        assertThat(request.timeout()).isEqualTo(Duration.ofMillis(20_000));

        Map<?, ?> body = objectMapper.readValue(request.body(), Map.class);
        assertThat(body.get("temperature")).isEqualTo(1.0);
        assertThat(body.get("max_tokens")).isEqualTo(256);
        assertThat((List<?>) body.get("messages")).hasSize(2);
        assertThat(reply).isEqualTo("A kettle boils water.");
    }

    @Test
    void ollamaNeedsNoKey() {
        when(httpCaller.exchange(any())).thenReturn(HttpCallResponse.of(200,
                "{\"message\":{\"role\":\"assistant\",\"content\":\"Hot water.\"},\"prompt_eval_count\":4,\"eval_count\":2}"));

        Object reply = handler.execute(step(NodeType.AI_OLLAMA, null, null, null), context).value();

        assertThat(reply).isEqualTo("Hot water.");
    }

    @Test
    void providerErrorFailsTheStep() {
        when(httpCaller.exchange(any())).thenReturn(HttpCallResponse.of(401,
                "{\"error\":{\"message\":\"Incorrect API key provided\"}}"));

        assertThatThrownBy(() -> handler.execute(step(NodeType.AI_OPENAI, "bad", null, null), context))
                .isInstanceOf(StepExecutionException.class)
                .hasMessageStartingWith("OpenAI API error 401")
                .hasMessageContaining("Incorrect API key provided");
    }

    @Test
    void blankReplyIsAnError() {
        when(httpCaller.exchange(any())).thenReturn(HttpCallResponse.of(200,
                "{\"content\":[{\"type\":\"text\",\"text\":\"   \"}],\"usage\":{\"input_tokens\":1,\"output_tokens\":0}}"));

        assertThatThrownBy(() -> handler.execute(step(NodeType.AI_ANTHROPIC, "key", null, null), context))
                .isInstanceOf(StepExecutionException.class)
                .hasMessage("Anthropic returned an empty response");
    }
}
