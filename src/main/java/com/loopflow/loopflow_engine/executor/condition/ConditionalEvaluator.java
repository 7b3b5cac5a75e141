package com.loopflow.loopflow_engine.executor.condition;

import com.loopflow.loopflow_engine.exception.InvalidGraphException;
import com.loopflow.loopflow_engine.io.PageQuery;
import com.loopflow.loopflow_engine.model.scope.NumericText;
import com.loopflow.loopflow_engine.model.scope.RuntimeVariableScope;
import com.loopflow.loopflow_engine.model.step.ComparisonOperator;
import com.loopflow.loopflow_engine.model.step.DomCondition;
import com.loopflow.loopflow_engine.model.step.ValueTransform;
import com.loopflow.loopflow_engine.model.step.VariableCheck;
import com.loopflow.loopflow_engine.model.step.VariableCondition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Decides which way a condition node branches.
 *
 * DOM conditions read the page through {@link PageQuery}; variable conditions only read the
 * run's variables. Neither mutates anything. A condition missing its type, selector or
 * variable name is a graph error, not a false result.
 */
@Slf4j
@Component
public class ConditionalEvaluator {

    private static final Pattern CURRENCY    = Pattern.compile("[$€£,\\s]");
    private static final Pattern NON_NUMERIC = Pattern.compile("[^0-9.-]");

    // ── DOM conditions ────────────────────────────────────────────────────────

    public boolean evaluateDomCondition(DomCondition condition, PageQuery page, RuntimeVariableScope scope) {
        if (condition.browserConditionType() == null || isBlank(condition.selector())) {
            throw new InvalidGraphException("Browser condition needs a condition type and a selector");
        }
        String selector = scope.substitute(condition.selector());

        boolean result;
        switch (condition.browserConditionType()) {
            case ELEMENT_EXISTS -> {
                result = page.elementExists(selector);
                log.debug("Element '{}' {}", selector, result ? "found" : "not found");
            }
            case VALUE_MATCHES -> {
                String raw = page.readText(selector);
                String transformed = applyTransform(raw, condition);
                String expected = scope.substitute(condition.expectedValue());
                result = compare(transformed, expected, condition.condition(), condition.parseAsNumber());
                log.debug("Value match on '{}': raw='{}' transformed='{}' {} '{}' → {}",
                        selector, raw, transformed, condition.condition(), expected, result);
            }
            default -> throw new InvalidGraphException("Unsupported browser condition: " + condition.browserConditionType());
        }
        return result;
    }

    String applyTransform(String raw, DomCondition condition) {
        if (raw == null || raw.isEmpty()) return raw == null ? "" : raw;
        ValueTransform transform = condition.transformType() != null ? condition.transformType() : ValueTransform.NONE;

        switch (transform) {
            case STRIP_CURRENCY -> {
                return CURRENCY.matcher(raw).replaceAll("");
            }
            case STRIP_NON_NUMERIC -> {
                return NON_NUMERIC.matcher(raw).replaceAll("");
            }
            case REMOVE_CHARS -> {
                if (isBlank(condition.transformChars())) return raw;
                String result = raw;
                for (char c : condition.transformChars().toCharArray()) {
                    result = result.replace(String.valueOf(c), "");
                }
                return result;
            }
            case REGEX_REPLACE -> {
                if (isBlank(condition.transformPattern())) return raw;
                try {
                    String replacement = condition.transformReplace() != null ? condition.transformReplace() : "";
                    return Pattern.compile(condition.transformPattern()).matcher(raw).replaceAll(replacement);
                } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
                    log.warn("Invalid regex transform '{}': {}; value left unchanged",
                            condition.transformPattern(), e.getMessage());
                    return raw;
                }
            }
            default -> {
                return raw;
            }
        }
    }

    private boolean compare(String actual, String expected, ComparisonOperator op, boolean parseAsNumber) {
        ComparisonOperator operator = op != null ? op : ComparisonOperator.EQUALS;

        if (parseAsNumber) {
            double a = NumericText.parseFloat(NON_NUMERIC.matcher(actual).replaceAll(""));
            double b = NumericText.parseFloat(NON_NUMERIC.matcher(expected).replaceAll(""));
            if (Double.isNaN(a) || Double.isNaN(b)) return false;
            return switch (operator) {
                case GREATER_THAN -> a > b;
                case LESS_THAN    -> a < b;
                case CONTAINS     -> actual.contains(expected);
                case EQUALS       -> a == b;
            };
        }

        return switch (operator) {
            case CONTAINS     -> actual.contains(expected);
            case GREATER_THAN -> NumericText.parseFloat(actual) > NumericText.parseFloat(expected);
            case LESS_THAN    -> NumericText.parseFloat(actual) < NumericText.parseFloat(expected);
            case EQUALS       -> actual.equals(expected);
        };
    }

    // ── Variable conditions ───────────────────────────────────────────────────

    public boolean evaluateVariableCondition(VariableCondition condition, RuntimeVariableScope scope) {
        if (condition.variableConditionType() == null || isBlank(condition.variableName())) {
            throw new InvalidGraphException("Variable condition needs a condition type and a variable name");
        }
        String name = scope.substitute(condition.variableName());
        Object value = scope.get(name);
        String actual = RuntimeVariableScope.stringify(value);
        String expected = scope.substitute(condition.expectedValue());

        boolean result;
        if (condition.variableConditionType() == VariableCheck.VARIABLE_EXISTS) {
            result = value != null && !"".equals(value);
        } else if (condition.parseAsNumber()) {
            double a = NumericText.parseFloat(actual);
            double b = NumericText.parseFloat(expected);
            if (Double.isNaN(a) || Double.isNaN(b)) {
                log.warn("Variable '{}' compared as number but '{}' / '{}' is not numeric", name, actual, expected);
                result = false;
            } else {
                result = switch (condition.variableConditionType()) {
                    case VARIABLE_GREATER_THAN -> a > b;
                    case VARIABLE_LESS_THAN    -> a < b;
                    case VARIABLE_CONTAINS     -> actual.contains(expected);
                    default                    -> a == b;
                };
            }
        } else {
            result = switch (condition.variableConditionType()) {
                case VARIABLE_GREATER_THAN -> actual.compareTo(expected) > 0;
                case VARIABLE_LESS_THAN    -> actual.compareTo(expected) < 0;
                case VARIABLE_CONTAINS     -> actual.contains(expected);
                default                    -> actual.equals(expected);
            };
        }

        log.debug("Variable condition {} on '{}' (value='{}', expected='{}') → {}",
                condition.variableConditionType(), name, actual, expected, result);
        return result;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
