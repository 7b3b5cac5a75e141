package com.loopflow.loopflow_engine.service;

import org.springframework.scheduling.Trigger;

import java.time.ZoneId;

/** Turns a cron expression into a trigger the task scheduler can arm. */
public interface CronEngine {

    /**
     * @throws com.loopflow.loopflow_engine.exception.ScheduleConfigurationException
     *         when the expression cannot be parsed
     */
    Trigger trigger(String expression, ZoneId zone);
}
