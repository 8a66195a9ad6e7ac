package com.fieldops.scheduling.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.LocalTime;
import java.util.Map;

/**
 * A validated ConstraintSet with defaults applied and objective weights summing to 1.0.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class NormalizedConstraints {

    Duration maxTravelTime;
    LocalTime workingHoursStart;
    LocalTime workingHoursEnd;
    String zoneId;
    int maxJobsPerTechnician;
    boolean skillMatchRequired;
    boolean overtimeAllowed;
    Map<Objective, Double> weights;

    public double weight(Objective objective) {
        return weights.getOrDefault(objective, 0.0);
    }
}
