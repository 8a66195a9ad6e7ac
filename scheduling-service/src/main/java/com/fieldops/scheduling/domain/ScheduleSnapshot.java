package com.fieldops.scheduling.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The committed schedule of one tenant, passed by value between the optimizer,
 * the scorers and the single guarded commit step.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ScheduleSnapshot {

    String tenantId;
    long version;
    String runId;
    TimeWindow horizon;
    NormalizedConstraints constraints;

    @Builder.Default
    List<Job> jobs = List.of();

    @Builder.Default
    List<Technician> technicians = List.of();

    @Builder.Default
    List<Assignment> assignments = List.of();

    @Builder.Default
    List<UnscheduledJob> unscheduled = List.of();

    boolean degraded;
    Instant committedAt;

    public static ScheduleSnapshot empty(String tenantId) {
        return ScheduleSnapshot.builder().tenantId(tenantId).version(0).build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return assignments.isEmpty() && jobs.isEmpty();
    }

    public Optional<Assignment> assignmentFor(String jobId) {
        return assignments.stream().filter(a -> a.getJobId().equals(jobId)).findFirst();
    }

    /** Assignments of one technician ordered by start. */
    public List<Assignment> routeOf(String technicianId) {
        return assignments.stream()
                .filter(a -> a.getTechnicianId().equals(technicianId))
                .sorted(Comparator.comparing(Assignment::getScheduledStart))
                .toList();
    }

    public Optional<Job> job(String jobId) {
        return jobs.stream().filter(j -> j.getId().equals(jobId)).findFirst();
    }
}
