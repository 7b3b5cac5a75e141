package com.loopflow.loopflow_engine.model.step;

/**
 * What a graph node does: either an action step or a branch condition.
 */
public sealed interface NodeKind permits Step, BranchCondition {

    NodeType type();
}
