package com.loopflow.loopflow_engine.exception;

/**
 * Malformed automation graph: no nodes, no start node, duplicate branch labels,
 * or a condition node missing its required fields.
 */
public class InvalidGraphException extends AutomationException {

    public InvalidGraphException(String message) {
        super(message);
    }
}
