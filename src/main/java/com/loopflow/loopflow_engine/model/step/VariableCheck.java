package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum VariableCheck {
    @JsonProperty("variableExists")      VARIABLE_EXISTS,
    @JsonProperty("variableEquals")      VARIABLE_EQUALS,
    @JsonProperty("variableGreaterThan") VARIABLE_GREATER_THAN,
    @JsonProperty("variableLessThan")    VARIABLE_LESS_THAN,
    @JsonProperty("variableContains")    VARIABLE_CONTAINS
}
