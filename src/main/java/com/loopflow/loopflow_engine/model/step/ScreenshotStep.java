package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ScreenshotStep(NodeType type, String savePath, String storeKey) implements Step {

    public ScreenshotStep {
        type = NodeType.SCREENSHOT;
    }

    public static ScreenshotStep to(String savePath) {
        return new ScreenshotStep(NodeType.SCREENSHOT, savePath, null);
    }
}
