package com.loopflow.loopflow_engine.exception;

public class ScheduleConfigurationException extends AutomationException {

    public ScheduleConfigurationException(String message) {
        super(message);
    }

    public ScheduleConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
