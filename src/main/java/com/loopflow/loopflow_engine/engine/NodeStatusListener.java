package com.loopflow.loopflow_engine.engine;

/**
 * Progress callback of a run. Called on the run's own thread, once with RUNNING and once with
 * SUCCESS or ERROR for every node visit. {@code error} is null unless the status is ERROR.
 */
@FunctionalInterface
public interface NodeStatusListener {

    NodeStatusListener NONE = (nodeId, status, error) -> { };

    void onNodeStatus(String nodeId, NodeStatus status, String error);
}
