package com.loopflow.loopflow_engine.exception;

public class StepExecutionException extends AutomationException {

    public StepExecutionException(String message) {
        super(message);
    }

    public StepExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
