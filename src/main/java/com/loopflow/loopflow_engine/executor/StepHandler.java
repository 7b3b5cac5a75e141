package com.loopflow.loopflow_engine.executor;

import com.loopflow.loopflow_engine.model.step.NodeType;
import com.loopflow.loopflow_engine.model.step.Step;

import java.util.Set;

public interface StepHandler {

    Set<NodeType> supportedTypes();

    // Runs the step against the context; throws to fail the node
    StepResult execute(Step step, StepContext context);
}
