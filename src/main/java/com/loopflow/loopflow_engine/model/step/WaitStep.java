package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Pauses the run; {@code value} is a number of seconds, templated. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WaitStep(NodeType type, String value) implements Step {

    public WaitStep {
        type = NodeType.WAIT;
    }

    public static WaitStep seconds(String value) {
        return new WaitStep(NodeType.WAIT, value);
    }
}
