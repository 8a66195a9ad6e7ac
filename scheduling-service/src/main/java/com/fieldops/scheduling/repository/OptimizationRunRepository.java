package com.fieldops.scheduling.repository;

import com.fieldops.scheduling.domain.RunStatus;
import com.fieldops.scheduling.entity.OptimizationRunEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface OptimizationRunRepository extends JpaRepository<OptimizationRunEntity, String> {

    Optional<OptimizationRunEntity> findByIdAndTenantId(String id, String tenantId);

    List<OptimizationRunEntity> findByTenantIdAndStartedAtGreaterThanEqualOrderByStartedAtDesc(
            String tenantId, Instant since, Pageable page);

    List<OptimizationRunEntity> findByTenantIdAndStartedAtBetweenOrderByStartedAtAsc(
            String tenantId, Instant from, Instant to);

    List<OptimizationRunEntity> findByStatusAndStartedAtBefore(RunStatus status, Instant startedBefore);

    @Modifying
    @Query("DELETE FROM OptimizationRunEntity r WHERE r.startedAt < :cutoff")
    int deleteStartedBefore(Instant cutoff);
}
