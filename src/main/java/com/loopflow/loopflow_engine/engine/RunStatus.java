package com.loopflow.loopflow_engine.engine;

public enum RunStatus {
    COMPLETED,
    FAILED,
    STOPPED
}
