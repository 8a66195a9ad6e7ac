package com.fieldops.scheduling.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.LocalTime;
import java.util.List;

/**
 * Raw, caller-supplied constraints. Null fields take the documented defaults
 * during validation; see {@code ConstraintValidator}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ConstraintSet {

    Duration maxTravelTime;
    LocalTime workingHoursStart;
    LocalTime workingHoursEnd;
    String zoneId;
    Integer maxJobsPerTechnician;
    Boolean skillMatchRequired;
    Boolean overtimeAllowed;
    List<WeightedObjective> objectives;
}
