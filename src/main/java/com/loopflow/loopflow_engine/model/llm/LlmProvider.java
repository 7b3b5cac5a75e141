package com.loopflow.loopflow_engine.model.llm;

public enum LlmProvider {
    OPENAI("OpenAI", true),
    ANTHROPIC("Anthropic", true),
    OLLAMA("Ollama", false);

    private final String displayName;
    private final boolean requiresApiKey;

    LlmProvider(String displayName, boolean requiresApiKey) {
        this.displayName = displayName;
        this.requiresApiKey = requiresApiKey;
    }

    public String getDisplayName()   { return displayName; }
    public boolean requiresApiKey()  { return requiresApiKey; }
}
