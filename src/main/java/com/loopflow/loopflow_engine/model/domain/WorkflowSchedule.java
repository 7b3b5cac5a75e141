package com.loopflow.loopflow_engine.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A stored schedule entry. Several entries may point at the same automation.
 * {@code headless} is optional; when absent the automation's own flag is used.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkflowSchedule {

    private String id;
    private String workflowId;
    private String workflowName;
    private ScheduleSpec schedule;

    @Builder.Default
    private boolean enabled = true;

    private Boolean headless;

    @Builder.Default
    private Instant createdAt = Instant.now();
}
