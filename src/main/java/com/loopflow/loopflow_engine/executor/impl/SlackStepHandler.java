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
import com.loopflow.loopflow_engine.model.step.NodeType;
import com.loopflow.loopflow_engine.model.step.SlackStep;
import com.loopflow.loopflow_engine.model.step.Step;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Slack Web API steps. Every call is authorised with a bearer token and the parsed response
 * object is the step result. A response with {@code ok:false} fails the step.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlackStepHandler implements StepHandler {

    static final String API_BASE = "https://slack.com/api";

    private final HttpCaller       httpCaller;
    private final CredentialLookup credentialLookup;
    private final ObjectMapper     objectMapper;

    @Override
    public Set<NodeType> supportedTypes() {
        return EnumSet.range(NodeType.SLACK_SEND_MESSAGE, NodeType.SLACK_ADD_REACTION);
    }

    @Override
    public StepResult execute(Step step, StepContext context) {
        SlackStep slack = (SlackStep) step;
        String token = resolveToken(slack);

        Map<String, Object> response = switch (slack.type()) {
            case SLACK_SEND_MESSAGE      -> post(token, "chat.postMessage", sendMessage(slack, context));
            case SLACK_UPDATE_MESSAGE    -> post(token, "chat.update", updateMessage(slack, context));
            case SLACK_DELETE_MESSAGE    -> post(token, "chat.delete", Map.of(
                    "channel", context.resolve(slack.channelId()),
                    "ts", context.resolve(slack.timestamp())));
            case SLACK_CREATE_CHANNEL    -> post(token, "conversations.create", createChannel(slack, context));
            case SLACK_GET_CHANNEL       -> get(token, "conversations.info", query(
                    "channel", context.resolve(slack.channelId()),
                    "include_num_members", "true"));
            case SLACK_LIST_CHANNELS     -> get(token, "conversations.list", query(
                    "limit", limitOf(slack),
                    "exclude_archived", slack.excludeArchived() != null ? slack.excludeArchived().toString() : null));
            case SLACK_INVITE_USERS      -> post(token, "conversations.invite", Map.of(
                    "channel", context.resolve(slack.channelId()),
                    "users", String.join(",", userIds(slack.userIds(), context))));
            case SLACK_LIST_MEMBERS      -> get(token, "conversations.members", query(
                    "channel", context.resolve(slack.channelId()),
                    "limit", limitOf(slack)));
            case SLACK_SET_TOPIC         -> post(token, "conversations.setTopic", Map.of(
                    "channel", context.resolve(slack.channelId()),
                    "topic", context.resolve(slack.topic())));
            case SLACK_ARCHIVE_CHANNEL   -> post(token, "conversations.archive",
                    Map.of("channel", context.resolve(slack.channelId())));
            case SLACK_UNARCHIVE_CHANNEL -> post(token, "conversations.unarchive",
                    Map.of("channel", context.resolve(slack.channelId())));
            case SLACK_GET_HISTORY       -> get(token, "conversations.history", query(
                    "channel", context.resolve(slack.channelId()),
                    "limit", limitOf(slack),
                    "oldest", optional(slack.oldestTimestamp(), context),
                    "latest", optional(slack.latestTimestamp(), context)));
            case SLACK_GET_USER          -> get(token, "users.info",
                    query("user", context.resolve(slack.userId())));
            case SLACK_LIST_USERS        -> get(token, "users.list", query("limit", limitOf(slack)));
            case SLACK_ADD_REACTION      -> post(token, "reactions.add", Map.of(
                    "channel", context.resolve(slack.channelId()),
                    "timestamp", context.resolve(slack.timestamp()),
                    "name", context.resolve(slack.reactionEmoji()).replace(":", "")));
            default -> throw new UnsupportedOperationException("Not a Slack step: " + slack.type());
        };
        return StepResult.of(response);
    }

    // ── Payloads ──────────────────────────────────────────────────────────────

    private Map<String, Object> sendMessage(SlackStep step, StepContext context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel", context.resolve(step.channelId()));
        payload.put("text", context.resolve(step.text()));
        String threadTs = optional(step.threadTs(), context);
        if (threadTs != null) {
            payload.put("thread_ts", threadTs);
            if (step.replyBroadcast() != null) payload.put("reply_broadcast", step.replyBroadcast());
        }
        if (step.mrkdwn() != null) payload.put("mrkdwn", step.mrkdwn());
        putBlocks(payload, step, context);
        return payload;
    }

    private Map<String, Object> updateMessage(SlackStep step, StepContext context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel", context.resolve(step.channelId()));
        payload.put("ts", context.resolve(step.timestamp()));
        payload.put("text", context.resolve(step.text()));
        putBlocks(payload, step, context);
        return payload;
    }

    private Map<String, Object> createChannel(SlackStep step, StepContext context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", context.resolve(step.channelName()));
        if (step.isPrivate() != null) payload.put("is_private", step.isPrivate());
        String description = optional(step.channelDescription(), context);
        if (description != null) {
            payload.put("topic", Map.of("value", description, "canvas", false));
        }
        return payload;
    }

    private void putBlocks(Map<String, Object> payload, SlackStep step, StepContext context) {
        String blocks = optional(step.blocksJson(), context);
        if (blocks == null) return;
        try {
            payload.put("blocks", objectMapper.readValue(blocks, Object.class));
        } catch (JsonProcessingException e) {
            throw new StepExecutionException("Invalid blocks JSON", e);
        }
    }

    /** Comma separated string or a list; each id is substituted and trimmed. */
    static List<String> userIds(Object raw, StepContext context) {
        List<String> ids = new ArrayList<>();
        if (raw instanceof Collection<?> list) {
            for (Object id : list) ids.add(context.resolve(String.valueOf(id)).trim());
        } else if (raw != null) {
            Arrays.stream(context.resolve(raw.toString()).split(","))
                    .map(String::trim)
                    .forEach(ids::add);
        }
        return ids;
    }

    // ── Transport ─────────────────────────────────────────────────────────────

    private Map<String, Object> post(String token, String apiMethod, Map<String, Object> payload) {
        log.debug("[Slack] POST {}", apiMethod);
        String url = API_BASE + "/" + apiMethod;
        return unwrap(httpCaller.exchange(HttpCallRequest.of("POST", url, authHeaders(token),
                JsonPayloads.write(objectMapper, payload))), apiMethod);
    }

    private Map<String, Object> get(String token, String apiMethod, MultiValueMap<String, String> params) {
        log.debug("[Slack] GET {} {}", apiMethod, params.keySet());
        String url = UriComponentsBuilder.fromHttpUrl(API_BASE + "/" + apiMethod)
                .queryParams(params)
                .encode()
                .build()
                .toUriString();
        return unwrap(httpCaller.exchange(HttpCallRequest.of("GET", url, authHeaders(token), null)), apiMethod);
    }

    private Map<String, Object> unwrap(HttpCallResponse response, String apiMethod) {
        if (!response.isSuccessful()) {
            throw new StepExecutionException("Slack API request " + apiMethod + " failed with HTTP " + response.status());
        }
        Map<String, Object> data = JsonPayloads.parseObject(objectMapper, response.body(), "Slack");
        if (!Boolean.TRUE.equals(data.get("ok"))) {
            Object error = data.get("error");
            throw new StepExecutionException("Slack API Error: " + (error != null ? error : "Unknown error"));
        }
        return data;
    }

    private static Map<String, String> authHeaders(String token) {
        return Map.of("Authorization", "Bearer " + token);
    }

    // Pairs of name/value; null or blank values are left out
    private static MultiValueMap<String, String> query(String... pairs) {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            if (pairs[i + 1] != null && !pairs[i + 1].isBlank()) params.add(pairs[i], pairs[i + 1]);
        }
        return params;
    }

    private static String limitOf(SlackStep step) {
        return step.limit() != null && step.limit() > 0 ? step.limit().toString() : null;
    }

    private static String optional(String template, StepContext context) {
        String value = context.resolve(template);
        return value.isBlank() ? null : value;
    }

    // ── Credentials ───────────────────────────────────────────────────────────

    private String resolveToken(SlackStep step) {
        if (step.credentialId() != null && !step.credentialId().isBlank()) {
            Credential credential = credentialLookup.getCredential(step.credentialId());
            if (credential == null || !credential.isOfType("slack")) {
                throw new CredentialException("Invalid or missing Slack credential");
            }
            String token = credential.firstField("token", "botToken", "apiToken");
            if (token == null) {
                throw new CredentialException("Slack credential missing token");
            }
            return token;
        }
        String token = step.apiToken() != null && !step.apiToken().isBlank() ? step.apiToken() : step.botToken();
        if (token == null || token.isBlank()) {
            throw new CredentialException("Slack token is required");
        }
        return token;
    }
}
