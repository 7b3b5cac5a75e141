package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One Discord REST or webhook call. Bot calls need a token from a "discord" credential or
 * {@code botToken}; webhook posts need only {@code webhookUrl}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DiscordStep(NodeType type,
                          String channelId,
                          String messageId,
                          String content,
                          Boolean tts,
                          String webhookUrl,
                          String username,
                          String avatarUrl,
                          String embedsJson,
                          String emoji,
                          Integer limit,
                          String storeKey,
                          String credentialId,
                          String botToken) implements Step {

    public DiscordStep {
        NodeType.requireFamily(type, NodeType.Family.DISCORD);
    }
}
