package com.fieldops.scheduling.engine;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Per-job limits applied when an existing schedule is repaired instead of rebuilt.
 *
 * A pinned job keeps its committed start on its committed technician. A movable job may not
 * start before {@code notBefore} nor after {@code latestStart}; {@code preferredTechnicianId}
 * is tried first and, once the job sits there, local search will not move it away.
 */
@Value
@Builder
public class RepairBound {

    Instant notBefore;
    Instant latestStart;

    Instant pinnedStart;
    String pinnedTechnicianId;
    /** Committed predecessor on the route; null when the job was first on its route. */
    String pinnedPredecessorJobId;

    String preferredTechnicianId;

    public boolean isPinned() {
        return pinnedStart != null;
    }
}
