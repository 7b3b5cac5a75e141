package com.loopflow.loopflow_engine.exception;

public class CredentialException extends AutomationException {

    public CredentialException(String message) {
        super(message);
    }
}
