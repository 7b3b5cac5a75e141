package com.loopflow.loopflow_engine.engine;

public enum ExecutionMode {
    HEADLESS,   // private Playwright browser, closed when the run ends
    WINDOWED    // the host's visible browser surface
}
