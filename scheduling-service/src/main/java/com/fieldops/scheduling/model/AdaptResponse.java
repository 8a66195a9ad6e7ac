package com.fieldops.scheduling.model;

import com.fieldops.scheduling.disruption.AdaptationOutcome;
import com.fieldops.scheduling.disruption.DisruptionState;
import com.fieldops.scheduling.domain.AdaptedJob;
import com.fieldops.scheduling.domain.ImpactSummary;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AdaptResponse {

    String adaptationId;
    String disruptionId;
    DisruptionState state;
    List<DisruptionState> stateHistory;
    List<String> affectedJobIds;
    List<AdaptedJob> adaptedJobs;
    ImpactSummary impactSummary;
    List<String> recommendations;
    long snapshotVersion;
    String rejectionReason;

    public static AdaptResponse from(AdaptationOutcome outcome) {
        return AdaptResponse.builder()
                .adaptationId(outcome.getAdaptationId())
                .disruptionId(outcome.getDisruptionId())
                .state(outcome.getState())
                .stateHistory(outcome.getStateHistory())
                .affectedJobIds(outcome.getAffectedJobIds())
                .adaptedJobs(outcome.getAdaptedJobs())
                .impactSummary(outcome.getImpactSummary())
                .recommendations(outcome.getRecommendations())
                .snapshotVersion(outcome.getSnapshotVersion())
                .rejectionReason(outcome.getRejectionReason())
                .build();
    }
}
