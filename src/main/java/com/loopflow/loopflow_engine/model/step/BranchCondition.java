package com.loopflow.loopflow_engine.model.step;

/**
 * A node whose evaluation picks exactly one of the "if" / "else" outgoing edges.
 */
public sealed interface BranchCondition extends NodeKind permits DomCondition, VariableCondition {

    String expectedValue();

    boolean parseAsNumber();
}
