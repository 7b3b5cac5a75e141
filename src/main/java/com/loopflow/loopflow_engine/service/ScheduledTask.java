package com.loopflow.loopflow_engine.service;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Read-only view of one armed timer. */
@Value
@Builder
public class ScheduledTask {
    String scheduleId;
    String automationId;
    String automationName;
    String scheduleType;
    boolean headless;
    Instant armedAt;
}
