package com.fieldops.scheduling.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Assignment {

    String jobId;
    String technicianId;
    int sequence;
    Instant scheduledStart;
    Instant scheduledEnd;
    Duration travelTimeFromPrevious;
    Duration travelTimeToNext;
    double confidenceScore;
    boolean overtime;

    @Builder.Default
    List<AlternativeCandidate> alternatives = List.of();
}
