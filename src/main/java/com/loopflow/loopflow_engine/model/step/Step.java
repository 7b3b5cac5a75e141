package com.loopflow.loopflow_engine.model.step;

/**
 * An action node. Each record carries its own discriminator and the fields its handler reads.
 */
public sealed interface Step extends NodeKind permits
        NavigateStep, ClickStep, TypeStep, WaitStep, ScreenshotStep, ExtractStep, ScrollStep,
        SelectOptionStep, FileUploadStep, HoverStep,
        SetVariableStep, ModifyVariableStep,
        ApiCallStep,
        AiCompletionStep,
        SlackStep, DiscordStep, TwitterStep,
        EnterpriseStep {

    /** Variable that receives the handler's result, or null when the result is discarded. */
    default String storeKey() {
        return null;
    }
}
