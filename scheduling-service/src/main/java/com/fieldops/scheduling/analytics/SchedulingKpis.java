package com.fieldops.scheduling.analytics;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class SchedulingKpis {

    double utilizationRate;
    double onTimeRate;
    double averageTravelMinutes;
    double travelSavingsPercent;
    double schedulingSuccessRate;
    double averageJobsPerTechnicianPerDay;
    int runsAnalysed;
    int adaptationCount;
    double averageAdaptationImpact;
    int outcomesAnalysed;
}
