package com.fieldops.scheduling.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class OptimizationRun {

    String id;
    String tenantId;
    RunType runType;
    RunStatus status;
    String inputHash;
    String algorithmVersion;
    Instant startedAt;
    Instant completedAt;

    @Builder.Default
    List<Assignment> assignments = List.of();

    @Builder.Default
    List<UnscheduledJob> warnings = List.of();

    OptimizationMetrics metrics;
    String failureReason;
}
