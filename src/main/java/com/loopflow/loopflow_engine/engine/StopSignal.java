package com.loopflow.loopflow_engine.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag. Checked before every node visit; a step already running
 * finishes its own I/O.
 */
public class StopSignal {

    private final AtomicBoolean stopped = new AtomicBoolean();

    public void stop() {
        stopped.set(true);
    }

    public boolean isStopped() {
        return stopped.get();
    }
}
