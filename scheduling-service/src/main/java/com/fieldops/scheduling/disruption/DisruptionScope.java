package com.fieldops.scheduling.disruption;

import com.fieldops.scheduling.domain.Job;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The jobs a disruption is allowed to move, and how.
 */
@Value
@Builder(toBuilder = true)
public class DisruptionScope {

    /** Affected job ids in scoping order: seeds first, then downstream jobs. */
    @Builder.Default
    List<String> affectedJobIds = List.of();

    /** Why each affected job is in scope. */
    @Builder.Default
    Map<String, String> reasons = Map.of();

    /** Extra not-before offset per delayed job. */
    @Builder.Default
    Map<String, Duration> delays = Map.of();

    @Builder.Default
    Set<String> unavailableTechnicianIds = Set.of();

    Job emergencyJob;

    /** Technician the emergency job is steered to when the scope was widened around one route. */
    String forcedTechnicianId;

    /** Set when the disruption cannot be handled within the preferences. */
    String rejectionReason;

    public boolean isRejected() {
        return rejectionReason != null;
    }

    public boolean isAffected(String jobId) {
        return affectedJobIds.contains(jobId);
    }
}
