package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Branches on the page: whether an element exists, or whether its text matches
 * {@code expectedValue} after {@code transformType} is applied.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DomCondition(NodeType type,
                           DomCheck browserConditionType,
                           String selector,
                           String expectedValue,
                           ComparisonOperator condition,
                           ValueTransform transformType,
                           String transformPattern,
                           String transformReplace,
                           String transformChars,
                           boolean parseAsNumber) implements BranchCondition {

    public DomCondition {
        type = NodeType.BROWSER_CONDITIONAL;
        if (condition == null) condition = ComparisonOperator.EQUALS;
        if (transformType == null) transformType = ValueTransform.NONE;
    }

    public static DomCondition elementExists(String selector) {
        return new DomCondition(null, DomCheck.ELEMENT_EXISTS, selector, null, null, null, null, null, null, false);
    }

    public static DomCondition valueMatches(String selector, ComparisonOperator op, String expected,
                                            ValueTransform transform, boolean parseAsNumber) {
        return new DomCondition(null, DomCheck.VALUE_MATCHES, selector, expected, op, transform, null, null, null, parseAsNumber);
    }
}
