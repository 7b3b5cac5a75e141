package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** {@code selector} is read for {@link ScrollType#TO_ELEMENT}, {@code scrollAmount} for {@link ScrollType#BY_AMOUNT}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScrollStep(NodeType type, ScrollType scrollType, String selector, Integer scrollAmount) implements Step {

    public ScrollStep {
        type = NodeType.SCROLL;
    }

    public static ScrollStep toElement(String selector) {
        return new ScrollStep(NodeType.SCROLL, ScrollType.TO_ELEMENT, selector, null);
    }

    public static ScrollStep byAmount(int pixels) {
        return new ScrollStep(NodeType.SCROLL, ScrollType.BY_AMOUNT, null, pixels);
    }
}
