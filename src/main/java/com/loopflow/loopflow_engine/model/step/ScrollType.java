package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ScrollType {
    @JsonProperty("toElement") TO_ELEMENT,
    @JsonProperty("byAmount")  BY_AMOUNT
}
