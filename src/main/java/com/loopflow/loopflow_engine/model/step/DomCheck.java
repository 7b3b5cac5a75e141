package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum DomCheck {
    @JsonProperty("elementExists") ELEMENT_EXISTS,
    @JsonProperty("valueMatches")  VALUE_MATCHES
}
