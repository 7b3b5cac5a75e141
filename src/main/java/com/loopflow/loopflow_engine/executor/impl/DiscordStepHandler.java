package com.loopflow.loopflow_engine.executor.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loopflow.loopflow_engine.exception.CredentialException;
import com.loopflow.loopflow_engine.exception.StepExecutionException;
import com.loopflow.loopflow_engine.executor.JsonPayloads;
import com.loopflow.loopflow_engine.executor.StepContext;
import com.loopflow.loopflow_engine.executor.StepHandler;
import com.loopflow.loopflow_engine.executor.StepResult;
import com.loopflow.loopflow_engine.io.CredentialLookup;
import com.loopflow.loopflow_engine.io.HttpCallRequest;
import com.loopflow.loopflow_engine.io.HttpCallResponse;
import com.loopflow.loopflow_engine.io.HttpCaller;
import com.loopflow.loopflow_engine.model.domain.Credential;
import com.loopflow.loopflow_engine.model.step.DiscordStep;
import com.loopflow.loopflow_engine.model.step.NodeType;
import com.loopflow.loopflow_engine.model.step.Step;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Discord REST v10 and webhook steps.
 * Reactions and deletes have no response body; they report {@code {success: true}}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DiscordStepHandler implements StepHandler {

    static final String API_BASE = "https://discord.com/api/v10";

    private static final int DEFAULT_LIST_LIMIT = 10;
    private static final int MAX_LIST_LIMIT     = 100;

    private final HttpCaller       httpCaller;
    private final CredentialLookup credentialLookup;
    private final ObjectMapper     objectMapper;

    @Override
    public Set<NodeType> supportedTypes() {
        return EnumSet.range(NodeType.DISCORD_SEND_MESSAGE, NodeType.DISCORD_DELETE_MESSAGE);
    }

    @Override
    public StepResult execute(Step step, StepContext context) {
        DiscordStep discord = (DiscordStep) step;
        if (discord.type() == NodeType.DISCORD_SEND_WEBHOOK) {
            return StepResult.of(sendWebhook(discord, context));
        }

        String channelId = context.resolve(discord.channelId());
        String messageId = context.resolve(discord.messageId());

        return switch (discord.type()) {
            case DISCORD_SEND_MESSAGE -> {
                String token = requireToken(discord, "send messages");
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("content", context.resolve(discord.content()));
                payload.put("tts", Boolean.TRUE.equals(discord.tts()));
                yield StepResult.of(call("POST", "/channels/" + channelId + "/messages", payload, token));
            }
            case DISCORD_REACT_MESSAGE -> {
                String token = requireToken(discord, "react to messages");
                String emoji = UriUtils.encode(context.resolve(discord.emoji()), StandardCharsets.UTF_8);
                call("PUT", "/channels/" + channelId + "/messages/" + messageId + "/reactions/" + emoji + "/@me",
                        null, token);
                yield StepResult.of(Map.of("success", true));
            }
            case DISCORD_GET_MESSAGE -> {
                String token = requireToken(discord, "fetch messages");
                yield StepResult.of(call("GET", "/channels/" + channelId + "/messages/" + messageId, null, token));
            }
            case DISCORD_LIST_MESSAGES -> {
                String token = requireToken(discord, "list messages");
                int limit = discord.limit() != null && discord.limit() > 0
                        ? Math.min(discord.limit(), MAX_LIST_LIMIT) : DEFAULT_LIST_LIMIT;
                yield StepResult.of(call("GET", "/channels/" + channelId + "/messages?limit=" + limit, null, token));
            }
            case DISCORD_DELETE_MESSAGE -> {
                String token = requireToken(discord, "delete messages");
                call("DELETE", "/channels/" + channelId + "/messages/" + messageId, null, token);
                yield StepResult.of(Map.of("success", true));
            }
            default -> throw new UnsupportedOperationException("Not a Discord step: " + discord.type());
        };
    }

    private Object sendWebhook(DiscordStep step, StepContext context) {
        String webhookUrl = context.resolve(step.webhookUrl());
        if (webhookUrl.isBlank()) {
            throw new StepExecutionException("Webhook URL is required for Discord webhook step");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("content", context.resolve(step.content()));
        if (step.username() != null && !step.username().isBlank()) {
            payload.put("username", context.resolve(step.username()));
        }
        if (step.avatarUrl() != null && !step.avatarUrl().isBlank()) {
            payload.put("avatar_url", context.resolve(step.avatarUrl()));
        }
        payload.put("tts", Boolean.TRUE.equals(step.tts()));
        if (step.embedsJson() != null && !step.embedsJson().isBlank()) {
            try {
                payload.put("embeds", objectMapper.readValue(context.resolve(step.embedsJson()), Object.class));
            } catch (JsonProcessingException e) {
                throw new StepExecutionException("Invalid embeds JSON for Discord webhook", e);
            }
        }

        log.debug("[Discord] webhook post");
        HttpCallResponse response = httpCaller.exchange(HttpCallRequest.of("POST", webhookUrl, Map.of(),
                JsonPayloads.write(objectMapper, payload)));
        return unwrap(response, "webhook");
    }

    private Object call(String method, String path, Map<String, Object> payload, String token) {
        log.debug("[Discord] {} {}", method, path);
        String body = payload != null ? JsonPayloads.write(objectMapper, payload) : null;
        HttpCallResponse response = httpCaller.exchange(HttpCallRequest.of(method, API_BASE + path,
                Map.of("Authorization", "Bot " + token), body));
        return unwrap(response, method + " " + path);
    }

    private Object unwrap(HttpCallResponse response, String what) {
        if (!response.isSuccessful()) {
            String detail = response.body() != null && !response.body().isBlank() ? ": " + response.body() : "";
            throw new StepExecutionException("Discord " + what + " failed with HTTP " + response.status() + detail);
        }
        return JsonPayloads.parseOrText(objectMapper, response.body());
    }

    private String requireToken(DiscordStep step, String action) {
        String token;
        if (step.credentialId() != null && !step.credentialId().isBlank()) {
            Credential credential = credentialLookup.getCredential(step.credentialId());
            if (credential == null || !credential.isOfType("discord")) {
                throw new CredentialException("Invalid or missing Discord credential");
            }
            token = credential.firstField("botToken");
        } else {
            token = step.botToken();
        }
        if (token == null || token.isBlank()) {
            throw new CredentialException("Discord bot token is required to " + action);
        }
        return token;
    }
}
