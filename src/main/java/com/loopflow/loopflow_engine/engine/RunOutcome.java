package com.loopflow.loopflow_engine.engine;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class RunOutcome {

    RunStatus status;
    String error;                  // null unless FAILED
    int stepsExecuted;             // node visits started
    int stepsSucceeded;
    List<String> visitedNodeIds;   // in visit order, repeats included
    Duration duration;
    Map<String, Object> finalVariables;

    public boolean isSuccess() {
        return status == RunStatus.COMPLETED;
    }
}
