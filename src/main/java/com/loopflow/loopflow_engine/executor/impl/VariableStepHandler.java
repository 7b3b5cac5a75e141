package com.loopflow.loopflow_engine.executor.impl;

import com.loopflow.loopflow_engine.exception.StepExecutionException;
import com.loopflow.loopflow_engine.executor.StepContext;
import com.loopflow.loopflow_engine.executor.StepHandler;
import com.loopflow.loopflow_engine.executor.StepResult;
import com.loopflow.loopflow_engine.model.scope.NumericText;
import com.loopflow.loopflow_engine.model.scope.RuntimeVariableScope;
import com.loopflow.loopflow_engine.model.step.ModifyVariableStep;
import com.loopflow.loopflow_engine.model.step.NodeType;
import com.loopflow.loopflow_engine.model.step.SetVariableStep;
import com.loopflow.loopflow_engine.model.step.Step;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * setVariable / modifyVariable. Values are substituted, then typed with
 * {@link RuntimeVariableScope#parseValue}; increment and decrement work on numbers.
 */
@Slf4j
@Component
public class VariableStepHandler implements StepHandler {

    @Override
    public Set<NodeType> supportedTypes() {
        return EnumSet.of(NodeType.SET_VARIABLE, NodeType.MODIFY_VARIABLE);
    }

    @Override
    public StepResult execute(Step step, StepContext context) {
        if (step instanceof SetVariableStep set) {
            return setVariable(set, context.scope());
        }
        if (step instanceof ModifyVariableStep modify) {
            return modifyVariable(modify, context.scope());
        }
        throw new UnsupportedOperationException("Not a variable step: " + step.type());
    }

    private StepResult setVariable(SetVariableStep step, RuntimeVariableScope scope) {
        String name = requireName(step.variableName());
        Object value = RuntimeVariableScope.parseValue(scope.substitute(step.value()));
        scope.set(name, value);
        log.debug("Variable '{}' set to {}", name, value);
        return StepResult.of(value);
    }

    private StepResult modifyVariable(ModifyVariableStep step, RuntimeVariableScope scope) {
        String name = requireName(step.variableName());
        String raw = scope.substitute(step.value());
        Object current = scope.asMap().get(name);

        Object result = switch (step.operation()) {
            case SET       -> RuntimeVariableScope.parseValue(raw);
            case INCREMENT -> NumericText.normalize(currentNumber(current) + amount(raw));
            case DECREMENT -> NumericText.normalize(currentNumber(current) - amount(raw));
            case APPEND    -> RuntimeVariableScope.stringify(current) + raw;
        };

        scope.set(name, result);
        log.debug("Variable '{}' {} → {}", name, step.operation(), result);
        return StepResult.of(result);
    }

    /** Missing or empty counts as 0; text is read by its leading number. */
    private static double currentNumber(Object current) {
        if (current == null || "".equals(current)) return 0d;
        return NumericText.toDouble(current);
    }

    private static double amount(String raw) {
        return NumericText.parseFloat(raw.isEmpty() ? "1" : raw);
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new StepExecutionException("Variable step has no variableName");
        }
        return name;
    }
}
