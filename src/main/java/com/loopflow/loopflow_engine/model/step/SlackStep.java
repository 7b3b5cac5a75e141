package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One Slack Web API call. Which fields matter depends on {@code type}; the token comes from
 * {@code credentialId} or, failing that, from {@code apiToken}/{@code botToken}.
 * {@code userIds} is either a comma separated string or a JSON array of ids.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SlackStep(NodeType type,
                        String channelId,
                        String channelName,
                        String channelDescription,
                        Boolean isPrivate,
                        Boolean includeNumMembers,
                        Boolean excludeArchived,
                        String text,
                        String threadTs,
                        Boolean replyBroadcast,
                        Boolean mrkdwn,
                        String blocksJson,
                        String timestamp,
                        String topic,
                        Object userIds,
                        String userId,
                        String reactionEmoji,
                        String oldestTimestamp,
                        String latestTimestamp,
                        Integer limit,
                        String storeKey,
                        String credentialId,
                        String apiToken,
                        String botToken) implements Step {

    public SlackStep {
        NodeType.requireFamily(type, NodeType.Family.SLACK);
    }
}
