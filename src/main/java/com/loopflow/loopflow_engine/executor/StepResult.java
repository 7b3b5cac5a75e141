package com.loopflow.loopflow_engine.executor;

/**
 * What a handler produced. {@code storedKey} is set by the dispatcher once the value has been
 * written to the run's variables.
 */
public record StepResult(Object value, String storedKey) {

    private static final StepResult EMPTY = new StepResult(null, null);

    public static StepResult empty() {
        return EMPTY;
    }

    public static StepResult of(Object value) {
        return new StepResult(value, null);
    }

    public StepResult storedUnder(String key) {
        return new StepResult(value, key);
    }
}
