package com.loopflow.loopflow_engine.model.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

public enum IntervalUnit {
    @JsonProperty("minutes") MINUTES,
    @JsonProperty("hours")   HOURS,
    @JsonProperty("days")    DAYS;

    public Duration toDuration(long amount) {
        switch (this) {
            case HOURS: return Duration.ofHours(amount);
            case DAYS:  return Duration.ofDays(amount);
            default:    return Duration.ofMinutes(amount);
        }
    }
}
