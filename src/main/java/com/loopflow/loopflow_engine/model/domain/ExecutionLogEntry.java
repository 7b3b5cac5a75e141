package com.loopflow.loopflow_engine.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/** Outcome of one scheduled or triggered run. Written once, never updated. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionLogEntry {

    private String automationId;
    private String automationName;
    private Instant timestamp;
    private boolean success;
    private long durationMs;
    private String error;
    private int stepsExecuted;
    private int stepsSucceeded;

    // Only recorded for windowed runs
    private Map<String, Object> finalVariables;
}
