package com.loopflow.loopflow_engine.exception;

/**
 * Base type for every failure raised by the engine.
 * The message is always human readable; it is what a run log and the node status show.
 */
public class AutomationException extends RuntimeException {

    public AutomationException(String message) {
        super(message);
    }

    public AutomationException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Message of any throwable, falling back to its simple class name when it has none. */
    public static String describe(Throwable t) {
        if (t == null) return "Unknown error";
        String msg = t.getMessage();
        return msg != null && !msg.isBlank() ? msg : t.getClass().getSimpleName();
    }
}
