package com.loopflow.loopflow_engine.service;

import com.loopflow.loopflow_engine.exception.ScheduleConfigurationException;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.ZoneId;

/**
 * Cron support on top of Spring's parser. Classic five-field expressions (minute first)
 * get a leading "0" seconds field; six-field expressions and macros such as "@daily"
 * are passed through.
 */
@Component
public class SpringCronEngine implements CronEngine {

    @Override
    public Trigger trigger(String expression, ZoneId zone) {
        String normalized = normalize(expression);
        try {
            CronExpression.parse(normalized);
            return new CronTrigger(normalized, zone);
        } catch (IllegalArgumentException e) {
            throw new ScheduleConfigurationException("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    static String normalize(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ScheduleConfigurationException("Cron expression is required");
        }
        String trimmed = expression.trim();
        if (trimmed.startsWith("@")) return trimmed;
        return trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
    }
}
