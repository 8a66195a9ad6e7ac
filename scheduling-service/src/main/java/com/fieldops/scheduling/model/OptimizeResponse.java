package com.fieldops.scheduling.model;

import com.fieldops.scheduling.domain.Assignment;
import com.fieldops.scheduling.domain.OptimizationMetrics;
import com.fieldops.scheduling.domain.RunStatus;
import com.fieldops.scheduling.domain.UnscheduledJob;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class OptimizeResponse {

    String runId;
    RunStatus status;
    List<Assignment> assignments;
    OptimizationMetrics metrics;
    List<UnscheduledJob> warnings;
    boolean degraded;
    boolean timedOut;

    /** Version of the committed schedule; unchanged when the run was cancelled. */
    long snapshotVersion;
}
