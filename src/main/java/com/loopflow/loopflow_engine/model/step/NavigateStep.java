package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NavigateStep(NodeType type, @JsonAlias("value") String url) implements Step {

    public NavigateStep {
        type = NodeType.NAVIGATE;
    }

    public static NavigateStep of(String url) {
        return new NavigateStep(NodeType.NAVIGATE, url);
    }
}
