package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ModifyOperation {
    @JsonProperty("set")       SET,
    @JsonProperty("increment") INCREMENT,
    @JsonProperty("decrement") DECREMENT,
    @JsonProperty("append")    APPEND
}
