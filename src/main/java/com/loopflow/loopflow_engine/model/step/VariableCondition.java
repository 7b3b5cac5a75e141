package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record VariableCondition(NodeType type,
                                VariableCheck variableConditionType,
                                String variableName,
                                String expectedValue,
                                boolean parseAsNumber) implements BranchCondition {

    public VariableCondition {
        type = NodeType.VARIABLE_CONDITIONAL;
    }

    public static VariableCondition of(VariableCheck check, String variableName, String expectedValue, boolean parseAsNumber) {
        return new VariableCondition(null, check, variableName, expectedValue, parseAsNumber);
    }
}
