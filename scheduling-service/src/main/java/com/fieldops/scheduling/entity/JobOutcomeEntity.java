package com.fieldops.scheduling.entity;

import com.fieldops.scheduling.domain.JobStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "job_outcomes",
        uniqueConstraints = @UniqueConstraint(name = "uk_outcome_tenant_job", columnNames = {"tenant_id", "job_id"}),
        indexes = {
                @Index(name = "idx_outcome_tenant_scheduled", columnList = "tenant_id, scheduled_start"),
                @Index(name = "idx_outcome_technician",       columnList = "technician_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class JobOutcomeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "job_id", nullable = false)
    private String jobId;

    @Column(name = "technician_id")
    private String technicianId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private JobStatus status;

    /** Comma-separated required skills, kept for per-skill demand history. */
    @Column(name = "skills", length = 512)
    private String skills;

    @Column(name = "scheduled_start")
    private Instant scheduledStart;

    @Column(name = "scheduled_end")
    private Instant scheduledEnd;

    @Column(name = "actual_start")
    private Instant actualStart;

    @Column(name = "actual_end")
    private Instant actualEnd;

    @CreationTimestamp
    @Column(name = "recorded_at", updatable = false)
    private Instant recordedAt;
}
