package com.fieldops.scheduling.disruption;

import com.fieldops.scheduling.domain.AdaptedJob;
import com.fieldops.scheduling.domain.ImpactSummary;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of one disruption. On REJECTED the committed schedule is unchanged and
 * {@code recommendations} says what relaxation would have let it through.
 */
@Value
@Builder
public class AdaptationOutcome {

    String adaptationId;
    String disruptionId;
    String runId;
    DisruptionState state;

    @Builder.Default
    List<DisruptionState> stateHistory = List.of();

    @Builder.Default
    List<String> affectedJobIds = List.of();

    @Builder.Default
    List<AdaptedJob> adaptedJobs = List.of();

    @Builder.Default
    ImpactSummary impactSummary = ImpactSummary.empty();

    @Builder.Default
    List<String> recommendations = List.of();

    long snapshotVersion;
    String rejectionReason;
}
