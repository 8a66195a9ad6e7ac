package com.fieldops.scheduling.store;

import com.fieldops.scheduling.config.SchedulingProperties;
import com.fieldops.scheduling.domain.RunStatus;
import com.fieldops.scheduling.entity.OptimizationRunEntity;
import com.fieldops.scheduling.repository.OptimizationRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Housekeeping for the run table.
 *
 *  1. Runs older than {@code scheduling.runs.retention} (default 90 days) are deleted.
 *  2. Runs stuck in QUEUED or RUNNING well past the optimizer budget belong to a crashed
 *     instance; they are marked FAILED so history and analytics stay consistent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RunRetentionJob {

    static final String ABANDONED = "Abandoned: no completion recorded within the run budget";

    private final OptimizationRunRepository repository;
    private final SchedulingProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${scheduling.runs.retention-interval-ms:3600000}")
    @Transactional
    public void purgeExpiredRuns() {
        Instant cutoff = clock.instant().minus(properties.getRuns().getRetention());
        int deleted = repository.deleteStartedBefore(cutoff);
        if (deleted > 0) {
            log.info("Retention: deleted {} run(s) started before {}", deleted, cutoff);
        }
    }

    @Scheduled(fixedDelayString = "${scheduling.runs.stale-check-interval-ms:300000}")
    @Transactional
    public void failAbandonedRuns() {
        Duration grace = properties.getOptimizer().getTimeBudget().multipliedBy(10);
        Instant threshold = clock.instant().minus(grace);
        for (RunStatus status : List.of(RunStatus.QUEUED, RunStatus.RUNNING)) {
            for (OptimizationRunEntity run : repository.findByStatusAndStartedAtBefore(status, threshold)) {
                run.setStatus(RunStatus.FAILED);
                run.setCompletedAt(clock.instant());
                run.setFailureReason(ABANDONED);
                repository.save(run);
                log.warn("Retention: run {} of tenant {} left {} since {}, marked FAILED",
                        run.getId(), run.getTenantId(), status, run.getStartedAt());
            }
        }
    }
}
