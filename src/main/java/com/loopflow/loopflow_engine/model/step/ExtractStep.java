package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractStep(NodeType type, String selector, String storeKey) implements Step {

    public ExtractStep {
        type = NodeType.EXTRACT;
    }

    public static ExtractStep of(String selector, String storeKey) {
        return new ExtractStep(NodeType.EXTRACT, selector, storeKey);
    }
}
