package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Selects by {@code optionValue} when present, otherwise by {@code optionIndex}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SelectOptionStep(NodeType type, String selector, String optionValue, Integer optionIndex) implements Step {

    public SelectOptionStep {
        type = NodeType.SELECT_OPTION;
    }

    public static SelectOptionStep byValue(String selector, String optionValue) {
        return new SelectOptionStep(NodeType.SELECT_OPTION, selector, optionValue, null);
    }
}
