package com.fieldops.scheduling.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Another technician who could feasibly take the job, with the change in total
 * weighted cost if the job were moved there (positive = worse).
 */
@Value
@Builder
@Jacksonized
public class AlternativeCandidate {

    String technicianId;
    double costDelta;
}
