package com.loopflow.loopflow_engine.executor.impl;

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
import com.loopflow.loopflow_engine.io.OAuth1Signer;
import com.loopflow.loopflow_engine.model.domain.Credential;
import com.loopflow.loopflow_engine.model.step.NodeType;
import com.loopflow.loopflow_engine.model.step.Step;
import com.loopflow.loopflow_engine.model.step.TwitterStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Twitter/X API v2 steps, signed with OAuth 1.0a user context.
 * Tweet ids may be passed as plain ids or as twitter.com / x.com status URLs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TwitterStepHandler implements StepHandler {

    static final String API_BASE = "https://api.twitter.com/2";

    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern TWITTER_HOST = Pattern.compile(".*(twitter|x)\\.com$");
    private static final DateTimeFormatter ISO_MILLIS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);
    private static final int MAX_ERROR_BODY = 500;

    private final HttpCaller       httpCaller;
    private final CredentialLookup credentialLookup;
    private final OAuth1Signer     signer;
    private final ObjectMapper     objectMapper;

    @Override
    public Set<NodeType> supportedTypes() {
        return EnumSet.range(NodeType.TWITTER_CREATE_TWEET, NodeType.TWITTER_SEARCH_USER);
    }

    @Override
    public StepResult execute(Step step, StepContext context) {
        TwitterStep tw = (TwitterStep) step;
        OAuth1Signer.Keys keys = resolveKeys(tw);

        Object result = switch (tw.type()) {
            case TWITTER_CREATE_TWEET  -> dataOf(send(keys, "POST", "/tweets", Map.of(), createTweetBody(tw, context)));
            case TWITTER_DELETE_TWEET  -> send(keys, "DELETE",
                    "/tweets/" + extractTweetId(context.resolve(tw.tweetId())), Map.of(), null);
            case TWITTER_LIKE_TWEET    -> send(keys, "POST", "/users/" + currentUserId(keys) + "/likes", Map.of(),
                    Map.of("tweet_id", extractTweetId(context.resolve(tw.tweetId()))));
            case TWITTER_RETWEET       -> send(keys, "POST", "/users/" + currentUserId(keys) + "/retweets", Map.of(),
                    Map.of("tweet_id", extractTweetId(context.resolve(tw.tweetId()))));
            case TWITTER_SEARCH_TWEETS -> searchTweets(tw, keys, context);
            case TWITTER_SEND_DM       -> sendDirectMessage(tw, keys, context);
            case TWITTER_SEARCH_USER   -> dataOf(send(keys, "GET",
                    "/users/by/username/" + context.resolve(tw.username()).replace("@", ""), Map.of(), null));
            default -> throw new UnsupportedOperationException("Not a Twitter step: " + tw.type());
        };
        return StepResult.of(result);
    }

    // ── Operations ────────────────────────────────────────────────────────────

    private Map<String, Object> createTweetBody(TwitterStep step, StepContext context) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", context.resolve(step.text()));
        if (notBlank(step.replyToTweetId())) {
            body.put("reply", Map.of("in_reply_to_tweet_id", context.resolve(step.replyToTweetId())));
        }
        if (notBlank(step.quoteTweetId())) {
            body.put("quote_tweet_id", context.resolve(step.quoteTweetId()));
        }
        if (notBlank(step.mediaId())) {
            body.put("media", Map.of("media_ids", List.of(context.resolve(step.mediaId()))));
        }
        return body;
    }

    private Object searchTweets(TwitterStep step, OAuth1Signer.Keys keys, StepContext context) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("query", context.resolve(step.searchQuery()));
        query.put("max_results", String.valueOf(step.maxResults() != null && step.maxResults() > 0 ? step.maxResults() : 10));
        if (notBlank(step.startTime())) query.put("start_time", toIsoInstant(context.resolve(step.startTime()), "startTime"));
        if (notBlank(step.endTime()))   query.put("end_time", toIsoInstant(context.resolve(step.endTime()), "endTime"));

        Object tweets = dataOf(send(keys, "GET", "/tweets/search/recent", query, null));
        return tweets != null ? tweets : List.of();
    }

    private Object sendDirectMessage(TwitterStep step, OAuth1Signer.Keys keys, StepContext context) {
        String recipient = context.resolve(step.userId()).replace("@", "");
        if (!DIGITS.matcher(recipient).matches()) {
            recipient = idOf(dataOf(send(keys, "GET", "/users/by/username/" + recipient, Map.of(), null)), recipient);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", context.resolve(step.text()));
        if (notBlank(step.mediaId())) {
            body.put("attachments", List.of(Map.of("media_id", context.resolve(step.mediaId()))));
        }
        return send(keys, "POST", "/dm_conversations/with/" + recipient + "/messages", Map.of(), body);
    }

    private String currentUserId(OAuth1Signer.Keys keys) {
        return idOf(dataOf(send(keys, "GET", "/users/me", Map.of(), null)), "me");
    }

    // ── Transport ─────────────────────────────────────────────────────────────

    private Object send(OAuth1Signer.Keys keys, String method, String path,
                        Map<String, String> query, Map<String, Object> body) {
        String baseUrl = API_BASE + path;
        String url = query.isEmpty() ? baseUrl : baseUrl + "?" + query.entrySet().stream()
                .map(e -> OAuth1Signer.percentEncode(e.getKey()) + "=" + OAuth1Signer.percentEncode(e.getValue()))
                .collect(Collectors.joining("&"));

        Map<String, String> headers = Map.of("Authorization", signer.authorizationHeader(method, baseUrl, query, keys));
        log.debug("[Twitter] {} {}", method, path);

        HttpCallResponse response = httpCaller.exchange(HttpCallRequest.of(method, url, headers,
                body != null ? JsonPayloads.write(objectMapper, body) : null));
        if (!response.isSuccessful()) {
            String detail = response.body() == null ? "" : response.body().length() > MAX_ERROR_BODY
                    ? response.body().substring(0, MAX_ERROR_BODY) : response.body();
            throw new StepExecutionException("Twitter API " + method + " " + path + " failed with HTTP "
                    + response.status() + (detail.isBlank() ? "" : ": " + detail));
        }
        return JsonPayloads.parseOrText(objectMapper, response.body());
    }

    private static Object dataOf(Object response) {
        return response instanceof Map<?, ?> map ? map.get("data") : null;
    }

    private static String idOf(Object data, String who) {
        if (data instanceof Map<?, ?> map && map.get("id") != null) {
            return String.valueOf(map.get("id"));
        }
        throw new StepExecutionException("Twitter user not found: " + who);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    /** Numeric id as-is; the id segment of a twitter.com or x.com status URL; anything else unchanged. */
    static String extractTweetId(String input) {
        if (DIGITS.matcher(input).matches()) return input;
        try {
            URI uri = new URI(input);
            if (uri.getHost() == null || !TWITTER_HOST.matcher(uri.getHost()).matches() || uri.getPath() == null) {
                return input;
            }
            String[] parts = uri.getPath().split("/");
            if (parts.length >= 4 && "status".equals(parts[2]) && DIGITS.matcher(parts[3]).matches()) {
                return parts[3];
            }
            return input;
        } catch (URISyntaxException notAUrl) {
            return input;
        }
    }

    static String toIsoInstant(String value, String field) {
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(value.trim(),
                    ZonedDateTime::from, LocalDateTime::from);
            ZonedDateTime zoned = parsed instanceof ZonedDateTime z ? z
                    : ((LocalDateTime) parsed).atZone(ZoneId.systemDefault());
            return ISO_MILLIS.format(zoned.toInstant());
        } catch (DateTimeParseException e) {
            throw new StepExecutionException("Invalid " + field + ": " + value, e);
        }
    }

    private OAuth1Signer.Keys resolveKeys(TwitterStep step) {
        OAuth1Signer.Keys keys;
        if (notBlank(step.credentialId())) {
            Credential credential = credentialLookup.getCredential(step.credentialId());
            if (credential == null || !credential.isOfType("twitter")) {
                throw new CredentialException("Invalid or missing Twitter credential");
            }
            keys = new OAuth1Signer.Keys(credential.firstField("apiKey"), credential.firstField("apiSecret"),
                    credential.firstField("accessToken"), credential.firstField("accessSecret"));
        } else {
            keys = new OAuth1Signer.Keys(step.apiKey(), step.apiSecret(), step.accessToken(), step.accessSecret());
        }
        if (!notBlank(keys.consumerKey()) || !notBlank(keys.consumerSecret())
                || !notBlank(keys.token()) || !notBlank(keys.tokenSecret())) {
            throw new CredentialException("Twitter credentials require apiKey, apiSecret, accessToken and accessSecret");
        }
        return keys;
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
