package com.loopflow.loopflow_engine.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loopflow.loopflow_engine.config.LoopflowProperties;
import com.loopflow.loopflow_engine.model.domain.Automation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/** Automations as {@code {dataDir}/trees/tree_{id}.json}, one document each. */
@Slf4j
@Repository
public class AutomationRepository extends JsonFileStore<Automation> {

    private static final String PREFIX = "tree_";

    public AutomationRepository(LoopflowProperties properties, ObjectMapper objectMapper) {
        super(properties.dataPath().resolve("trees"), Automation.class, objectMapper);
    }

    /** Rejects graphs whose branch labels are inconsistent; nothing is written then. */
    public Automation save(Automation automation) {
        if (automation.getId() == null || automation.getId().isBlank()) {
            throw new IllegalArgumentException("Automation id is required");
        }
        automation.validateBranchLabels();
        write(fileName(automation.getId()), automation);
        log.debug("Saved automation {} ({} nodes)", automation.getId(), automation.getNodes().size());
        return automation;
    }

    public Optional<Automation> findById(String id) {
        return read(fileName(id));
    }

    public List<Automation> findAll() {
        return readAll(listFileNames(name -> name.startsWith(PREFIX))).stream()
                .sorted(Comparator.comparing(Automation::getName, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    public boolean deleteById(String id) {
        return delete(fileName(id));
    }

    private static String fileName(String id) {
        return PREFIX + id + ".json";
    }
}
