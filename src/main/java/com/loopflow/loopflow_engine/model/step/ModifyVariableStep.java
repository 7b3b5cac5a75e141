package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ModifyVariableStep(NodeType type,
                                 String variableName,
                                 ModifyOperation operation,
                                 String value) implements Step {

    public ModifyVariableStep {
        type = NodeType.MODIFY_VARIABLE;
        if (operation == null) operation = ModifyOperation.SET;
    }

    public static ModifyVariableStep of(String variableName, ModifyOperation operation, String value) {
        return new ModifyVariableStep(NodeType.MODIFY_VARIABLE, variableName, operation, value);
    }
}
