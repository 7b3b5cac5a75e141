package com.loopflow.loopflow_engine.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loopflow.loopflow_engine.config.LoopflowProperties;
import com.loopflow.loopflow_engine.model.domain.WorkflowSchedule;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/** Schedule entries as {@code {dataDir}/schedules/{id}.json}. */
@Repository
public class ScheduleRepository extends JsonFileStore<WorkflowSchedule> {

    public ScheduleRepository(LoopflowProperties properties, ObjectMapper objectMapper) {
        super(properties.dataPath().resolve("schedules"), WorkflowSchedule.class, objectMapper);
    }

    public WorkflowSchedule save(WorkflowSchedule schedule) {
        write(schedule.getId() + ".json", schedule);
        return schedule;
    }

    public Optional<WorkflowSchedule> findById(String id) {
        return read(id + ".json");
    }

    /** Newest first. */
    public List<WorkflowSchedule> findAll() {
        return readAll(listFileNames(name -> true)).stream()
                .sorted(Comparator.comparing(WorkflowSchedule::getCreatedAt,
                        Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .toList();
    }

    public List<WorkflowSchedule> findByWorkflowId(String workflowId) {
        return findAll().stream().filter(s -> workflowId.equals(s.getWorkflowId())).toList();
    }

    public boolean deleteById(String id) {
        return delete(id + ".json");
    }
}
