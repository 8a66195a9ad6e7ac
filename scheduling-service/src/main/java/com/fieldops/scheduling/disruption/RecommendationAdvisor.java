package com.fieldops.scheduling.disruption;

import com.fieldops.scheduling.constraint.ConstraintValidator;
import com.fieldops.scheduling.domain.AdaptationPreferences;
import com.fieldops.scheduling.domain.Job;
import com.fieldops.scheduling.domain.ScheduleSnapshot;
import com.fieldops.scheduling.domain.Technician;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Explains a rejected adaptation by dry-running relaxed preferences against the same disruption.
 * Dry runs never commit; the caller supplies them as a function of the preferences to try.
 */
@Slf4j
@Component
public class RecommendationAdvisor {

    public List<String> recommend(ScheduleSnapshot snapshot,
                                  AdaptationPreferences preferences,
                                  Function<AdaptationPreferences, RepairResult> dryRun,
                                  Collection<String> failedJobIds,
                                  List<Job> extraJobs) {
        Set<String> recommendations = new LinkedHashSet<>();

        if (!preferences.isAllowOvertime()
                && succeeds(dryRun, preferences.toBuilder().allowOvertime(true).build())) {
            recommendations.add("Allow overtime so the affected technicians can finish past their shift end");
        }

        Duration ceiling = ConstraintValidator.MAX_SCHEDULE_DELAY_CEILING;
        Duration current = preferences.getMaxScheduleDelay();
        Set<Duration> delays = new TreeSet<>(List.of(min(current.multipliedBy(2), ceiling), ceiling));
        for (Duration delay : delays) {
            if (delay.compareTo(current) > 0
                    && succeeds(dryRun, preferences.toBuilder().maxScheduleDelay(delay).build())) {
                recommendations.add("Increase maxScheduleDelay to " + delay.toMinutes() + " minutes");
                break;
            }
        }

        int maxReassignments = ConstraintValidator.MAX_REASSIGNMENTS_CEILING;
        if (preferences.getMaxReassignments() < maxReassignments) {
            RepairResult relaxed = dryRun.apply(preferences.toBuilder()
                    .maxReassignments(maxReassignments)
                    .preferSameTechnician(false)
                    .build());
            if (relaxed.isSuccess()) {
                int needed = Math.max(preferences.getMaxReassignments() + 1,
                        relaxed.reassignmentCount(snapshot.getAssignments()));
                recommendations.add("Allow up to " + needed + " reassignment(s) to other technicians");
            }
        }

        for (String hint : missingSkillHints(snapshot, failedJobIds, extraJobs)) {
            recommendations.add(hint);
        }

        if (recommendations.isEmpty() && !failedJobIds.isEmpty()) {
            recommendations.add("Reschedule job(s) " + new TreeSet<>(failedJobIds) + " to another day");
        }

        log.debug("Recommendations for tenant {}: {}", snapshot.getTenantId(), recommendations);
        return new ArrayList<>(recommendations);
    }

    private List<String> missingSkillHints(ScheduleSnapshot snapshot, Collection<String> failedJobIds, List<Job> extraJobs) {
        List<String> hints = new ArrayList<>();
        for (String jobId : new TreeSet<>(failedJobIds)) {
            Job job = snapshot.job(jobId)
                    .orElseGet(() -> extraJobs.stream().filter(j -> j.getId().equals(jobId)).findFirst().orElse(null));
            if (job == null || job.getRequiredSkills().isEmpty()) {
                continue;
            }
            boolean covered = false;
            for (Technician technician : snapshot.getTechnicians()) {
                if (technician.getSkills().containsAll(job.getRequiredSkills())) {
                    covered = true;
                    break;
                }
            }
            if (!covered) {
                hints.add("Add a technician with skills " + new TreeSet<>(job.getRequiredSkills()) + " for job " + jobId);
            }
        }
        return hints;
    }

    private static boolean succeeds(Function<AdaptationPreferences, RepairResult> dryRun, AdaptationPreferences preferences) {
        return dryRun.apply(preferences).isSuccess();
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
