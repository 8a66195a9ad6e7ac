package com.fieldops.scheduling.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Set;

/**
 * Post-hoc record of how a scheduled job actually went.
 */
@Value
@Builder
@Jacksonized
public class JobOutcome {

    String tenantId;
    String jobId;
    String technicianId;
    JobStatus status;
    Set<String> skills;
    Instant scheduledStart;
    Instant scheduledEnd;
    Instant actualStart;
    Instant actualEnd;
}
