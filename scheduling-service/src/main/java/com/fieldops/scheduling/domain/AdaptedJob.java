package com.fieldops.scheduling.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One job touched by an adaptation. {@code originalSlot} is null for an inserted emergency job.
 */
@Value
@Builder
@Jacksonized
public class AdaptedJob {

    String jobId;
    ScheduleSlot originalSlot;
    ScheduleSlot newSlot;
    String reason;
    double impactScore;
    boolean reassigned;
    long delayMinutes;
}
