package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Discriminator of every node kind, as written in the automation file's "type" field.
 * The set is closed: the step dispatcher refuses to start unless each step type has a handler.
 */
public enum NodeType {

    // Branch conditions
    BROWSER_CONDITIONAL("browserConditional", DomCondition.class,        Family.CONDITION),
    VARIABLE_CONDITIONAL("variableConditional", VariableCondition.class, Family.CONDITION),

    // Browser
    NAVIGATE("navigate",          NavigateStep.class,     Family.BROWSER),
    CLICK("click",                ClickStep.class,        Family.BROWSER),
    TYPE("type",                  TypeStep.class,         Family.BROWSER),
    WAIT("wait",                  WaitStep.class,         Family.TIMING),
    SCREENSHOT("screenshot",      ScreenshotStep.class,   Family.BROWSER),
    EXTRACT("extract",            ExtractStep.class,      Family.BROWSER),
    SCROLL("scroll",              ScrollStep.class,       Family.BROWSER),
    SELECT_OPTION("selectOption", SelectOptionStep.class, Family.BROWSER),
    FILE_UPLOAD("fileUpload",     FileUploadStep.class,   Family.BROWSER),
    HOVER("hover",                HoverStep.class,        Family.BROWSER),

    // Data
    SET_VARIABLE("setVariable",       SetVariableStep.class,    Family.DATA),
    MODIFY_VARIABLE("modifyVariable", ModifyVariableStep.class, Family.DATA),

    // Integration
    API_CALL("apiCall", ApiCallStep.class, Family.INTEGRATION),

    // AI
    AI_OPENAI("aiOpenAI",       AiCompletionStep.class, Family.AI),
    AI_ANTHROPIC("aiAnthropic", AiCompletionStep.class, Family.AI),
    AI_OLLAMA("aiOllama",       AiCompletionStep.class, Family.AI),

    // Slack
    SLACK_SEND_MESSAGE("slackSendMessage",           SlackStep.class, Family.SLACK),
    SLACK_UPDATE_MESSAGE("slackUpdateMessage",       SlackStep.class, Family.SLACK),
    SLACK_DELETE_MESSAGE("slackDeleteMessage",       SlackStep.class, Family.SLACK),
    SLACK_CREATE_CHANNEL("slackCreateChannel",       SlackStep.class, Family.SLACK),
    SLACK_GET_CHANNEL("slackGetChannel",             SlackStep.class, Family.SLACK),
    SLACK_LIST_CHANNELS("slackListChannels",         SlackStep.class, Family.SLACK),
    SLACK_INVITE_USERS("slackInviteUsers",           SlackStep.class, Family.SLACK),
    SLACK_LIST_MEMBERS("slackListMembers",           SlackStep.class, Family.SLACK),
    SLACK_SET_TOPIC("slackSetTopic",                 SlackStep.class, Family.SLACK),
    SLACK_ARCHIVE_CHANNEL("slackArchiveChannel",     SlackStep.class, Family.SLACK),
    SLACK_UNARCHIVE_CHANNEL("slackUnarchiveChannel", SlackStep.class, Family.SLACK),
    SLACK_GET_HISTORY("slackGetHistory",             SlackStep.class, Family.SLACK),
    SLACK_GET_USER("slackGetUser",                   SlackStep.class, Family.SLACK),
    SLACK_LIST_USERS("slackListUsers",               SlackStep.class, Family.SLACK),
    SLACK_ADD_REACTION("slackAddReaction",           SlackStep.class, Family.SLACK),

    // Discord
    DISCORD_SEND_MESSAGE("discordSendMessage",   DiscordStep.class, Family.DISCORD),
    DISCORD_SEND_WEBHOOK("discordSendWebhook",   DiscordStep.class, Family.DISCORD),
    DISCORD_REACT_MESSAGE("discordReactMessage", DiscordStep.class, Family.DISCORD),
    DISCORD_GET_MESSAGE("discordGetMessage",     DiscordStep.class, Family.DISCORD),
    DISCORD_LIST_MESSAGES("discordListMessages", DiscordStep.class, Family.DISCORD),
    DISCORD_DELETE_MESSAGE("discordDeleteMessage", DiscordStep.class, Family.DISCORD),

    // Twitter / X
    TWITTER_CREATE_TWEET("twitterCreateTweet",   TwitterStep.class, Family.TWITTER),
    TWITTER_DELETE_TWEET("twitterDeleteTweet",   TwitterStep.class, Family.TWITTER),
    TWITTER_LIKE_TWEET("twitterLikeTweet",       TwitterStep.class, Family.TWITTER),
    TWITTER_RETWEET("twitterRetweet",            TwitterStep.class, Family.TWITTER),
    TWITTER_SEARCH_TWEETS("twitterSearchTweets", TwitterStep.class, Family.TWITTER),
    TWITTER_SEND_DM("twitterSendDM",             TwitterStep.class, Family.TWITTER),
    TWITTER_SEARCH_USER("twitterSearchUser",     TwitterStep.class, Family.TWITTER),

    // Enterprise edition only
    FILE_SYSTEM("fileSystem",                   EnterpriseStep.class, Family.ENTERPRISE),
    SYSTEM_COMMAND("systemCommand",             EnterpriseStep.class, Family.ENTERPRISE),
    ENVIRONMENT_VARIABLE("environmentVariable", EnterpriseStep.class, Family.ENTERPRISE),
    DATABASE_QUERY("databaseQuery",             EnterpriseStep.class, Family.ENTERPRISE);

    public enum Family { CONDITION, BROWSER, TIMING, DATA, INTEGRATION, AI, SLACK, DISCORD, TWITTER, ENTERPRISE }

    private static final Map<String, NodeType> BY_JSON = Arrays.stream(values())
            .collect(Collectors.toMap(NodeType::getJsonName, Function.identity()));

    private final String jsonName;
    private final Class<? extends NodeKind> kindClass;
    private final Family family;

    NodeType(String jsonName, Class<? extends NodeKind> kindClass, Family family) {
        this.jsonName  = jsonName;
        this.kindClass = kindClass;
        this.family    = family;
    }

    @JsonValue
    public String getJsonName()                   { return jsonName; }
    public Class<? extends NodeKind> getKindClass() { return kindClass; }
    public Family getFamily()                     { return family; }

    public boolean isCondition() {
        return family == Family.CONDITION;
    }

    /** True for every node that drives the page: browser steps and DOM conditions. */
    public boolean requiresBrowser() {
        return family == Family.BROWSER || this == BROWSER_CONDITIONAL;
    }

    @JsonCreator
    public static NodeType fromJson(String name) {
        NodeType type = BY_JSON.get(name);
        if (type == null) {
            throw new IllegalArgumentException("Unknown node type: '" + name + "'");
        }
        return type;
    }

    static void requireFamily(NodeType type, Family family) {
        if (type == null || type.family != family) {
            throw new IllegalArgumentException("Node type " + type + " is not a " + family + " step");
        }
    }

    public static boolean isKnown(String name) {
        return name != null && BY_JSON.containsKey(name);
    }
}
