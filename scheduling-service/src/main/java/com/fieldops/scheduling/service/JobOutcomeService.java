package com.fieldops.scheduling.service;

import com.fieldops.scheduling.analytics.TechnicianPerformanceCache;
import com.fieldops.scheduling.domain.Assignment;
import com.fieldops.scheduling.domain.Job;
import com.fieldops.scheduling.domain.JobOutcome;
import com.fieldops.scheduling.domain.JobStatus;
import com.fieldops.scheduling.domain.ScheduleSnapshot;
import com.fieldops.scheduling.entity.JobOutcomeEntity;
import com.fieldops.scheduling.exception.SchedulingException;
import com.fieldops.scheduling.model.JobOutcomeRequest;
import com.fieldops.scheduling.repository.JobOutcomeRepository;
import com.fieldops.scheduling.store.CommittedScheduleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Records how a committed job actually went. Outcomes feed analytics and the on-time rates used
 * by the confidence scorer; the job itself leaves the committed schedule at the next commit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobOutcomeService {

    private final CommittedScheduleStore scheduleStore;
    private final JobOutcomeRepository outcomeRepository;
    private final TechnicianPerformanceCache performanceCache;

    @Transactional
    public JobOutcome record(String tenantId, String jobId, JobOutcomeRequest request) {
        if (!request.getStatus().isTerminal()) {
            throw new SchedulingException(SchedulingException.INVALID_REQUEST,
                    "Outcome status must be COMPLETED or CANCELLED, got " + request.getStatus());
        }
        if (request.getStatus() == JobStatus.COMPLETED && request.getActualStart() == null) {
            throw new SchedulingException(SchedulingException.INVALID_REQUEST, "A completed job needs actualStart");
        }
        if (request.getActualStart() != null && request.getActualEnd() != null
                && request.getActualEnd().isBefore(request.getActualStart())) {
            throw new SchedulingException(SchedulingException.INVALID_REQUEST, "actualEnd must not precede actualStart");
        }

        ScheduleSnapshot snapshot = scheduleStore.load(tenantId);
        Job job = snapshot.job(jobId)
                .orElseThrow(() -> new SchedulingException(SchedulingException.JOB_NOT_FOUND,
                        "Job " + jobId + " is not in the committed schedule of tenant " + tenantId));
        Assignment assignment = snapshot.assignmentFor(jobId).orElse(null);

        JobOutcomeEntity entity = outcomeRepository.findByTenantIdAndJobId(tenantId, jobId)
                .orElseGet(() -> JobOutcomeEntity.builder().tenantId(tenantId).jobId(jobId).build());
        entity.setStatus(request.getStatus());
        entity.setSkills(String.join(",", new TreeSet<>(job.getRequiredSkills())));
        entity.setActualStart(request.getActualStart());
        entity.setActualEnd(request.getActualEnd());
        if (assignment != null) {
            entity.setTechnicianId(assignment.getTechnicianId());
            entity.setScheduledStart(assignment.getScheduledStart());
            entity.setScheduledEnd(assignment.getScheduledEnd());
        } else {
            entity.setScheduledStart(job.getWindow() != null ? job.getWindow().getStart() : null);
        }
        entity = outcomeRepository.save(entity);
        performanceCache.invalidate(tenantId);

        log.info("Recorded {} outcome for job {} of tenant {} (technician {})", entity.getStatus(), jobId, tenantId,
                entity.getTechnicianId());
        return toDomain(entity);
    }

    static JobOutcome toDomain(JobOutcomeEntity entity) {
        Set<String> skills = entity.getSkills() == null || entity.getSkills().isBlank()
                ? Set.of()
                : Arrays.stream(entity.getSkills().split(",")).collect(Collectors.toSet());
        return JobOutcome.builder()
                .tenantId(entity.getTenantId())
                .jobId(entity.getJobId())
                .technicianId(entity.getTechnicianId())
                .status(entity.getStatus())
                .skills(skills)
                .scheduledStart(entity.getScheduledStart())
                .scheduledEnd(entity.getScheduledEnd())
                .actualStart(entity.getActualStart())
                .actualEnd(entity.getActualEnd())
                .build();
    }
}
