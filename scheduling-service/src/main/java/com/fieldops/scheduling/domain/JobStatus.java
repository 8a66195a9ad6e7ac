package com.fieldops.scheduling.domain;

public enum JobStatus {
    UNSCHEDULED,
    SCHEDULED,
    AT_RISK,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
