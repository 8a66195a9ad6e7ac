package com.fieldops.scheduling.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldops.scheduling.domain.Assignment;
import com.fieldops.scheduling.domain.Job;
import com.fieldops.scheduling.domain.JobStatus;
import com.fieldops.scheduling.domain.ScheduleSnapshot;
import com.fieldops.scheduling.entity.TenantScheduleEntity;
import com.fieldops.scheduling.exception.SchedulingException;
import com.fieldops.scheduling.repository.JobOutcomeRepository;
import com.fieldops.scheduling.repository.TenantScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The single committed schedule per tenant.
 *
 * Writers must hold the tenant lease; the snapshot version check below only guards against a
 * writer that lost its lease mid-run. Jobs that already have a terminal outcome are archived
 * (dropped together with their assignment) at commit time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommittedScheduleStore {

    private static final Set<JobStatus> TERMINAL = Set.of(JobStatus.COMPLETED, JobStatus.CANCELLED);

    private final TenantScheduleRepository scheduleRepository;
    private final JobOutcomeRepository outcomeRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(readOnly = true)
    public ScheduleSnapshot load(String tenantId) {
        return scheduleRepository.findById(tenantId)
                .map(entity -> read(entity.getSnapshotJson()))
                .orElseGet(() -> ScheduleSnapshot.empty(tenantId));
    }

    @Transactional(readOnly = true)
    public long currentVersion(String tenantId) {
        return scheduleRepository.findById(tenantId).map(TenantScheduleEntity::getSnapshotVersion).orElse(0L);
    }

    /**
     * Commits {@code snapshot} as the next version after {@code expectedVersion}.
     *
     * @throws SchedulingException INVALID_STATE when another commit landed first
     */
    @Transactional
    public ScheduleSnapshot commit(ScheduleSnapshot snapshot, long expectedVersion) {
        String tenantId = snapshot.getTenantId();
        TenantScheduleEntity entity = scheduleRepository.findById(tenantId).orElse(null);
        long currentVersion = entity != null ? entity.getSnapshotVersion() : 0L;
        if (currentVersion != expectedVersion) {
            throw new SchedulingException(SchedulingException.INVALID_STATE,
                    "Schedule of tenant " + tenantId + " moved to version " + currentVersion
                            + " while version " + expectedVersion + " was being replaced");
        }

        ScheduleSnapshot committed = archiveTerminalJobs(snapshot).toBuilder()
                .version(expectedVersion + 1)
                .committedAt(clock.instant())
                .build();

        if (entity == null) {
            entity = TenantScheduleEntity.builder().tenantId(tenantId).build();
        }
        entity.setSnapshotVersion(committed.getVersion());
        entity.setRunId(committed.getRunId());
        entity.setSnapshotJson(write(committed));
        entity.setCommittedAt(committed.getCommittedAt());
        scheduleRepository.save(entity);

        log.info("Committed schedule v{} for tenant {}: {} assignment(s), {} unscheduled, run={}",
                committed.getVersion(), tenantId, committed.getAssignments().size(),
                committed.getUnscheduled().size(), committed.getRunId());
        return committed;
    }

    private ScheduleSnapshot archiveTerminalJobs(ScheduleSnapshot snapshot) {
        List<String> jobIds = snapshot.getJobs().stream().map(Job::getId).toList();
        if (jobIds.isEmpty()) {
            return snapshot;
        }
        Set<String> archived = new HashSet<>(
                outcomeRepository.findJobIdsWithStatus(snapshot.getTenantId(), jobIds, TERMINAL));
        if (archived.isEmpty()) {
            return snapshot;
        }
        log.debug("Archiving {} finished job(s) from tenant {} schedule", archived.size(), snapshot.getTenantId());
        List<Job> jobs = snapshot.getJobs().stream().filter(j -> !archived.contains(j.getId())).toList();
        List<Assignment> assignments = snapshot.getAssignments().stream()
                .filter(a -> !archived.contains(a.getJobId()))
                .toList();
        return snapshot.toBuilder()
                .jobs(jobs)
                .assignments(assignments)
                .unscheduled(snapshot.getUnscheduled().stream().filter(u -> !archived.contains(u.getJobId())).toList())
                .build();
    }

    private String write(ScheduleSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise schedule of tenant " + snapshot.getTenantId(), e);
        }
    }

    private ScheduleSnapshot read(String json) {
        try {
            return objectMapper.readValue(json, ScheduleSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt committed schedule", e);
        }
    }
}
