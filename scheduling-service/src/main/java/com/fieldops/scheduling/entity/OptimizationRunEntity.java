package com.fieldops.scheduling.entity;

import com.fieldops.scheduling.domain.RunStatus;
import com.fieldops.scheduling.domain.RunType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * Audit record of one optimization or adaptation run.
 *
 * Lifecycle: QUEUED → RUNNING → COMPLETED | FAILED | CANCELLED
 *
 * Assignments, warnings and metrics are stored as JSON text; the run store owns (de)serialisation.
 */
@Entity
@Table(name = "optimization_runs",
        indexes = {
                @Index(name = "idx_runs_tenant_started", columnList = "tenant_id, started_at"),
                @Index(name = "idx_runs_status",         columnList = "status"),
                @Index(name = "idx_runs_started_at",     columnList = "started_at")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class OptimizationRunEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Version
    @Column(nullable = false)
    private Long version;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "run_type", nullable = false, length = 16)
    private RunType runType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RunStatus status;

    @Column(name = "input_hash", length = 64)
    private String inputHash;

    @Column(name = "algorithm_version", length = 64)
    private String algorithmVersion;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "assignments_json", columnDefinition = "TEXT")
    private String assignmentsJson;

    @Column(name = "warnings_json", columnDefinition = "TEXT")
    private String warningsJson;

    @Column(name = "metrics_json", columnDefinition = "TEXT")
    private String metricsJson;

    @Column(name = "failure_reason", length = 512)
    private String failureReason;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
