package com.loopflow.loopflow_engine.model.llm;

/**
 * Provider-agnostic completion result. On failure {@code errorMessage} says why.
 */
public class LlmResponse {

    private boolean success;
    private String  rawText;       // reply text as the provider returned it
    private String  errorMessage;
    private String  model;
    private int     inputTokens;
    private int     outputTokens;

    public LlmResponse() {}

    public static LlmResponse ok(String rawText, String model, int in, int out) {
        LlmResponse r = new LlmResponse();
        r.success      = true;
        r.rawText      = rawText;
        r.model        = model;
        r.inputTokens  = in;
        r.outputTokens = out;
        return r;
    }

    public static LlmResponse error(String message) {
        LlmResponse r = new LlmResponse();
        r.success      = false;
        r.errorMessage = message;
        return r;
    }

    public boolean isSuccess()      { return success; }
    public String getRawText()      { return rawText; }
    public String getErrorMessage() { return errorMessage; }
    public String getModel()        { return model; }
    public int getInputTokens()     { return inputTokens; }
    public int getOutputTokens()    { return outputTokens; }
}
