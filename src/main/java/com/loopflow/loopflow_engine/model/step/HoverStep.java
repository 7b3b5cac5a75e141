package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HoverStep(NodeType type, String selector) implements Step {

    public HoverStep {
        type = NodeType.HOVER;
    }
}
