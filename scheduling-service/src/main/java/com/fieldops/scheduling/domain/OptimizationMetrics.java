package com.fieldops.scheduling.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class OptimizationMetrics {

    int totalJobs;
    int scheduledJobs;
    int unscheduledJobs;
    double schedulingSuccessRate;
    double totalTravelMinutes;
    double averageTravelMinutes;
    double averageConfidence;
    double utilizationRate;
    double initialCost;
    double finalCost;
    double travelSavingsPercent;
    int techniciansUsed;
    int iterations;
    long elapsedMillis;
    boolean timedOut;
    boolean cancelled;
    boolean degraded;

    /** Mean impact score of the adapted jobs; adaptation runs only. */
    double averageImpactScore;

    @Builder.Default
    Map<String, Integer> demandBySkill = Map.of();
}
