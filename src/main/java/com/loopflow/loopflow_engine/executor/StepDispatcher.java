package com.loopflow.loopflow_engine.executor;

import com.loopflow.loopflow_engine.model.step.NodeType;
import com.loopflow.loopflow_engine.model.step.Step;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes each step to the handler registered for its type and stores the result under the
 * step's {@code storeKey}. Startup fails when a step type has no handler.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StepDispatcher {

    private final List<StepHandler> handlers;
    private final Map<NodeType, StepHandler> registry = new EnumMap<>(NodeType.class);

    @PostConstruct
    public void init() {
        for (StepHandler handler : handlers) {
            for (NodeType type : handler.supportedTypes()) {
                StepHandler previous = registry.put(type, handler);
                if (previous != null && previous != handler) {
                    throw new IllegalStateException("Step type " + type.getJsonName() + " is claimed by both "
                            + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
                }
            }
        }
        List<String> missing = Arrays.stream(NodeType.values())
                .filter(type -> !type.isCondition())
                .filter(type -> !registry.containsKey(type))
                .map(NodeType::getJsonName)
                .toList();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No step handler registered for: " + missing);
        }
        log.debug("Step dispatcher ready: {} step types over {} handlers", registry.size(), handlers.size());
    }

    public StepResult execute(Step step, StepContext context) {
        StepHandler handler = registry.get(step.type());
        if (handler == null) {
            throw new UnsupportedOperationException("No handler registered for step type: " + step.type());
        }
        StepResult result = handler.execute(step, context);

        String storeKey = step.storeKey();
        if (storeKey != null && !storeKey.isBlank()) {
            context.scope().set(storeKey, result.value());
            log.debug("Stored {} result in '{}'", step.type().getJsonName(), storeKey);
            return result.storedUnder(storeKey);
        }
        return result;
    }
}
