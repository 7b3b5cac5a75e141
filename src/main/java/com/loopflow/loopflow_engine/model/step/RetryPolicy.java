package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Fixed-delay retry for outbound HTTP steps. Values outside the supported range are clamped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RetryPolicy(Integer maxAttempts, Long delayMs) {

    public static final int  MAX_ATTEMPTS_CEILING = 10;
    public static final long MAX_DELAY_MS         = 60_000L;

    public static final RetryPolicy NONE = new RetryPolicy(1, 0L);

    public int effectiveAttempts() {
        int attempts = maxAttempts != null ? maxAttempts : 1;
        return Math.max(1, Math.min(MAX_ATTEMPTS_CEILING, attempts));
    }

    public long effectiveDelayMs() {
        long delay = delayMs != null ? delayMs : 0L;
        return Math.max(0L, Math.min(MAX_DELAY_MS, delay));
    }
}
