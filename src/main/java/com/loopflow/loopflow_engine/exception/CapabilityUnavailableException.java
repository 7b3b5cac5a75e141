package com.loopflow.loopflow_engine.exception;

/**
 * A step needs a facility this build or edition does not provide.
 * Never retried.
 */
public class CapabilityUnavailableException extends AutomationException {

    private final String capability;

    public CapabilityUnavailableException(String capability, String message) {
        super(message);
        this.capability = capability;
    }

    public String getCapability() {
        return capability;
    }
}
