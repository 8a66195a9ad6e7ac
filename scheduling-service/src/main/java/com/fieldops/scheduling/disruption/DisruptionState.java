package com.fieldops.scheduling.disruption;

/**
 * RECEIVED -> SCOPED -> REOPTIMIZED -> APPLIED -> NOTIFIED, with REJECTED reachable from
 * SCOPED or REOPTIMIZED. Only APPLIED and NOTIFIED change the committed schedule.
 */
public enum DisruptionState {
    RECEIVED,
    SCOPED,
    REOPTIMIZED,
    APPLIED,
    NOTIFIED,
    REJECTED;

    public boolean isCommitted() {
        return this == APPLIED || this == NOTIFIED;
    }
}
