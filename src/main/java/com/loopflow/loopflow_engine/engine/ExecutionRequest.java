package com.loopflow.loopflow_engine.engine;

import com.loopflow.loopflow_engine.model.scope.RuntimeVariableScope;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/** Everything one run needs besides the automation itself. */
@Value
@Builder
public class ExecutionRequest {

    @Builder.Default
    String runId = UUID.randomUUID().toString();

    @Builder.Default
    ExecutionMode mode = ExecutionMode.HEADLESS;

    RuntimeVariableScope scope;

    @Builder.Default
    NodeStatusListener listener = NodeStatusListener.NONE;

    @Builder.Default
    StopSignal stopSignal = new StopSignal();

    public static ExecutionRequest of(ExecutionMode mode, RuntimeVariableScope scope) {
        return ExecutionRequest.builder().mode(mode).scope(scope).build();
    }
}
