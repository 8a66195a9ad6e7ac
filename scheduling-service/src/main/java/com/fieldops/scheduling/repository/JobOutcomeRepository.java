package com.fieldops.scheduling.repository;

import com.fieldops.scheduling.domain.JobStatus;
import com.fieldops.scheduling.entity.JobOutcomeEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface JobOutcomeRepository extends JpaRepository<JobOutcomeEntity, UUID> {

    Optional<JobOutcomeEntity> findByTenantIdAndJobId(String tenantId, String jobId);

    List<JobOutcomeEntity> findByTenantIdAndScheduledStartBetween(String tenantId, Instant from, Instant to);

    /**
     * Ids among {@code jobIds} that already have an outcome in one of {@code statuses}.
     */
    @Query("SELECT o.jobId FROM JobOutcomeEntity o WHERE o.tenantId = :tenantId "
            + "AND o.jobId IN :jobIds AND o.status IN :statuses")
    List<String> findJobIdsWithStatus(String tenantId, Collection<String> jobIds, Collection<JobStatus> statuses);
}
