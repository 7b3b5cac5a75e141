package com.loopflow.loopflow_engine.exception;

/** An automation, schedule or log file could not be read or written. */
public class StorageException extends AutomationException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
