package com.fieldops.scheduling.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ImpactSummary {

    int jobsRescheduled;
    int reassignmentCount;
    int techniciansAffected;
    long totalDelayMinutes;
    long maxDelayMinutes;
    double averageImpactScore;
    int notificationsSent;

    public static ImpactSummary empty() {
        return ImpactSummary.builder().build();
    }
}
