package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SetVariableStep(NodeType type, String variableName, String value) implements Step {

    public SetVariableStep {
        type = NodeType.SET_VARIABLE;
    }

    public static SetVariableStep of(String variableName, String value) {
        return new SetVariableStep(NodeType.SET_VARIABLE, variableName, value);
    }
}
