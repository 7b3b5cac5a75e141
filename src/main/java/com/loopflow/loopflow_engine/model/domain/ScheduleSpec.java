package com.loopflow.loopflow_engine.model.domain;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.loopflow.loopflow_engine.exception.ScheduleConfigurationException;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * When an automation runs by itself. Serialized with a "type" tag:
 * manual, interval, cron or once.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type", defaultImpl = ScheduleSpec.Manual.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = ScheduleSpec.Manual.class,   name = "manual"),
        @JsonSubTypes.Type(value = ScheduleSpec.Interval.class, name = "interval"),
        @JsonSubTypes.Type(value = ScheduleSpec.Cron.class,     name = "cron"),
        @JsonSubTypes.Type(value = ScheduleSpec.Once.class,     name = "once")
})
public sealed interface ScheduleSpec {

    String typeName();

    /** Never fires on its own. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Manual() implements ScheduleSpec {

        @JsonCreator
        public Manual {
        }

        @Override
        public String typeName() {
            return "manual";
        }
    }

    /** Fixed rate; the first firing is one period after arming. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Interval(@JsonAlias("intervalMinutes") long interval, IntervalUnit unit) implements ScheduleSpec {

        public Interval {
            if (unit == null) unit = IntervalUnit.MINUTES;
        }

        public Duration period() {
            if (interval <= 0) {
                throw new ScheduleConfigurationException("Interval must be positive, got " + interval);
            }
            return unit.toDuration(interval);
        }

        @Override
        public String typeName() {
            return "interval";
        }
    }

    /** Five-field (minute precision) or six-field (with seconds) cron expression. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Cron(String expression) implements ScheduleSpec {

        @Override
        public String typeName() {
            return "cron";
        }
    }

    /** Fires a single time at {@code datetime}, then the stored schedule is disabled. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Once(String datetime) implements ScheduleSpec {

        /**
         * Accepts an ISO instant ("2024-05-01T10:00:00Z"), an offset date-time
         * ("2024-05-01T12:00:00+02:00") or a local date-time read in {@code zone}.
         */
        public Instant resolveInstant(ZoneId zone) {
            if (datetime == null || datetime.isBlank()) {
                throw new ScheduleConfigurationException("One-time schedule has no datetime");
            }
            try {
                TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                        .parseBest(datetime.trim(), ZonedDateTime::from, LocalDateTime::from);
                if (parsed instanceof ZonedDateTime zoned) {
                    return zoned.toInstant();
                }
                return ((LocalDateTime) parsed).atZone(zone).toInstant();
            } catch (DateTimeParseException e) {
                throw new ScheduleConfigurationException("Unreadable datetime '" + datetime + "'", e);
            }
        }

        @Override
        public String typeName() {
            return "once";
        }
    }
}
