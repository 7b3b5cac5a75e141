package com.loopflow.loopflow_engine.engine;

public enum NodeStatus {
    RUNNING,
    SUCCESS,
    ERROR
}
