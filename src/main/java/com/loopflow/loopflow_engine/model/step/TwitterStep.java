package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One call to the X (Twitter) v2 API, signed with OAuth 1.0a user context.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TwitterStep(NodeType type,
                          String text,
                          String replyToTweetId,
                          String quoteTweetId,
                          String mediaId,
                          String tweetId,
                          String searchQuery,
                          Integer maxResults,
                          String startTime,
                          String endTime,
                          String userId,
                          String username,
                          String storeKey,
                          String credentialId,
                          String apiKey,
                          String apiSecret,
                          String accessToken,
                          String accessSecret) implements Step {

    public TwitterStep {
        NodeType.requireFamily(type, NodeType.Family.TWITTER);
    }
}
