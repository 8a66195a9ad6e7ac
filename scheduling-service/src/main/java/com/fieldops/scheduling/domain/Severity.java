package com.fieldops.scheduling.domain;

import java.time.Duration;

public enum Severity {
    LOW(15),
    MEDIUM(30),
    HIGH(60),
    CRITICAL(120);

    private final int defaultDelayMinutes;

    Severity(int defaultDelayMinutes) {
        this.defaultDelayMinutes = defaultDelayMinutes;
    }

    /** Delay assumed when a disruption arrives without an expected duration. */
    public Duration defaultDelay() {
        return Duration.ofMinutes(defaultDelayMinutes);
    }

    public boolean isHighPriority() {
        return this == HIGH || this == CRITICAL;
    }
}
