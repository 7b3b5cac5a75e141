package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ClickStep(NodeType type, String selector) implements Step {

    public ClickStep {
        type = NodeType.CLICK;
    }

    public static ClickStep of(String selector) {
        return new ClickStep(NodeType.CLICK, selector);
    }
}
