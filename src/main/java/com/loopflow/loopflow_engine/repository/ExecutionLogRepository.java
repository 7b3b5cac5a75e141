package com.loopflow.loopflow_engine.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loopflow.loopflow_engine.config.LoopflowProperties;
import com.loopflow.loopflow_engine.model.domain.ExecutionLogEntry;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Run logs as {@code {dataDir}/schedule_logs/{automationId}_{epochMillis}.json}.
 * Entries are only ever appended.
 */
@Repository
public class ExecutionLogRepository extends JsonFileStore<ExecutionLogEntry> {

    public ExecutionLogRepository(LoopflowProperties properties, ObjectMapper objectMapper) {
        super(properties.dataPath().resolve("schedule_logs"), ExecutionLogEntry.class, objectMapper);
    }

    public ExecutionLogEntry append(ExecutionLogEntry entry) {
        Instant at = entry.getTimestamp() != null ? entry.getTimestamp() : Instant.now();
        String name = entry.getAutomationId() + "_" + at.toEpochMilli() + ".json";
        // two entries in the same millisecond must not overwrite each other
        int suffix = 1;
        while (resolve(name).toFile().exists()) {
            name = entry.getAutomationId() + "_" + (at.toEpochMilli() + suffix++) + ".json";
        }
        write(name, entry);
        return entry;
    }

    /** Most recent first, by file name, at most {@code limit} entries. */
    public List<ExecutionLogEntry> findRecent(String automationId, int limit) {
        // "a" must not pick up the logs of "a_b"
        Pattern ownFiles = Pattern.compile(Pattern.quote(automationId) + "_\\d+\\.json");
        List<String> names = listFileNames(name -> ownFiles.matcher(name).matches()).stream()
                .sorted(Comparator.reverseOrder())
                .limit(Math.max(0, limit))
                .toList();
        return readAll(names);
    }
}
