package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ComparisonOperator {
    @JsonProperty("equals")      EQUALS,
    @JsonProperty("contains")    CONTAINS,
    @JsonProperty("greaterThan") GREATER_THAN,
    @JsonProperty("lessThan")    LESS_THAN
}
