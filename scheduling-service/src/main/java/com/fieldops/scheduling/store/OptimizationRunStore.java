package com.fieldops.scheduling.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldops.scheduling.domain.Assignment;
import com.fieldops.scheduling.domain.OptimizationMetrics;
import com.fieldops.scheduling.domain.OptimizationRun;
import com.fieldops.scheduling.domain.RunStatus;
import com.fieldops.scheduling.domain.RunType;
import com.fieldops.scheduling.domain.UnscheduledJob;
import com.fieldops.scheduling.entity.OptimizationRunEntity;
import com.fieldops.scheduling.exception.SchedulingException;
import com.fieldops.scheduling.repository.OptimizationRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence of run records and their outputs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OptimizationRunStore {

    private static final TypeReference<List<Assignment>> ASSIGNMENTS = new TypeReference<>() {};
    private static final TypeReference<List<UnscheduledJob>> WARNINGS = new TypeReference<>() {};
    private static final int MAX_FAILURE_REASON = 512;

    private final OptimizationRunRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /** Registers a new run in QUEUED state. */
    @Transactional
    public OptimizationRun create(String tenantId, RunType runType, String inputHash, String algorithmVersion) {
        OptimizationRunEntity entity = repository.save(OptimizationRunEntity.builder()
                .id(UUID.randomUUID().toString())
                .tenantId(tenantId)
                .runType(runType)
                .status(RunStatus.QUEUED)
                .inputHash(inputHash)
                .algorithmVersion(algorithmVersion)
                .startedAt(clock.instant())
                .build());
        return toDomain(entity);
    }

    @Transactional
    public void markRunning(String runId) {
        OptimizationRunEntity entity = require(runId);
        if (entity.getStatus() != RunStatus.QUEUED) {
            throw new SchedulingException(SchedulingException.INVALID_STATE,
                    "Run " + runId + " cannot start from " + entity.getStatus());
        }
        entity.setStatus(RunStatus.RUNNING);
        repository.save(entity);
    }

    @Transactional
    public OptimizationRun complete(String runId, List<Assignment> assignments, List<UnscheduledJob> warnings,
                                    OptimizationMetrics metrics) {
        OptimizationRunEntity entity = require(runId);
        entity.setStatus(RunStatus.COMPLETED);
        entity.setCompletedAt(clock.instant());
        entity.setAssignmentsJson(toJson(assignments));
        entity.setWarningsJson(toJson(warnings));
        entity.setMetricsJson(toJson(metrics));
        return toDomain(repository.save(entity));
    }

    @Transactional
    public OptimizationRun fail(String runId, String reason) {
        OptimizationRunEntity entity = require(runId);
        entity.setStatus(RunStatus.FAILED);
        entity.setCompletedAt(clock.instant());
        entity.setFailureReason(truncate(reason));
        return toDomain(repository.save(entity));
    }

    @Transactional
    public OptimizationRun cancel(String runId, OptimizationMetrics metrics) {
        OptimizationRunEntity entity = require(runId);
        entity.setStatus(RunStatus.CANCELLED);
        entity.setCompletedAt(clock.instant());
        if (metrics != null) {
            entity.setMetricsJson(toJson(metrics));
        }
        return toDomain(repository.save(entity));
    }

    @Transactional(readOnly = true)
    public Optional<OptimizationRun> find(String tenantId, String runId) {
        return repository.findByIdAndTenantId(runId, tenantId).map(this::toDomain);
    }

    /** Most recent runs first, limited to the last {@code days} days. */
    @Transactional(readOnly = true)
    public List<OptimizationRun> history(String tenantId, int days, int limit) {
        Instant since = clock.instant().minus(Duration.ofDays(days));
        return repository.findByTenantIdAndStartedAtGreaterThanEqualOrderByStartedAtDesc(
                        tenantId, since, PageRequest.of(0, limit))
                .stream()
                .map(this::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<OptimizationRun> runsBetween(String tenantId, Instant from, Instant to) {
        return repository.findByTenantIdAndStartedAtBetweenOrderByStartedAtAsc(tenantId, from, to)
                .stream()
                .map(this::toDomain)
                .toList();
    }

    private OptimizationRunEntity require(String runId) {
        return repository.findById(runId)
                .orElseThrow(() -> new SchedulingException(SchedulingException.RUN_NOT_FOUND, "Run not found: " + runId));
    }

    OptimizationRun toDomain(OptimizationRunEntity entity) {
        return OptimizationRun.builder()
                .id(entity.getId())
                .tenantId(entity.getTenantId())
                .runType(entity.getRunType())
                .status(entity.getStatus())
                .inputHash(entity.getInputHash())
                .algorithmVersion(entity.getAlgorithmVersion())
                .startedAt(entity.getStartedAt())
                .completedAt(entity.getCompletedAt())
                .assignments(entity.getAssignmentsJson() != null ? fromJson(entity.getAssignmentsJson(), ASSIGNMENTS) : List.of())
                .warnings(entity.getWarningsJson() != null ? fromJson(entity.getWarningsJson(), WARNINGS) : List.of())
                .metrics(entity.getMetricsJson() != null ? fromJson(entity.getMetricsJson(), OptimizationMetrics.class) : null)
                .failureReason(entity.getFailureReason())
                .build();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise run payload", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt run payload", e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt run payload", e);
        }
    }

    private static String truncate(String reason) {
        if (reason == null || reason.length() <= MAX_FAILURE_REASON) {
            return reason;
        }
        return reason.substring(0, MAX_FAILURE_REASON);
    }
}
