package com.fieldops.scheduling.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.Set;

/**
 * A time-boxed unit of field work. The window bounds the whole visit:
 * the job may start at {@code window.start} at the earliest and must finish by {@code window.end}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Job {

    String id;

    @Builder.Default
    Set<String> requiredSkills = Set.of();

    @Builder.Default
    JobPriority priority = JobPriority.MEDIUM;

    GeoPoint location;
    Duration estimatedDuration;
    TimeWindow window;

    @Builder.Default
    JobStatus status = JobStatus.UNSCHEDULED;

    String customerId;
}
