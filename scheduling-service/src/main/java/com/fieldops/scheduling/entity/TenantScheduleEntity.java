package com.fieldops.scheduling.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * The committed schedule of one tenant: a single row replaced on every commit.
 *
 * {@code version} is the JPA optimistic lock; {@code snapshotVersion} is the business version
 * carried inside the snapshot and checked by the committing caller.
 */
@Entity
@Table(name = "tenant_schedules")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "tenantId")
public class TenantScheduleEntity {

    @Id
    @Column(name = "tenant_id", length = 128)
    private String tenantId;

    @Version
    @Column(nullable = false)
    private Long version;

    @Column(name = "snapshot_version", nullable = false)
    private long snapshotVersion;

    @Column(name = "run_id", length = 36)
    private String runId;

    @Column(name = "snapshot_json", nullable = false, columnDefinition = "TEXT")
    private String snapshotJson;

    @Column(name = "committed_at", nullable = false)
    private Instant committedAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
