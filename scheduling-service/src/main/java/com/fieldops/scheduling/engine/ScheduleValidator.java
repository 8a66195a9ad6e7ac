package com.fieldops.scheduling.engine;

import com.fieldops.scheduling.domain.Assignment;
import com.fieldops.scheduling.domain.Job;
import com.fieldops.scheduling.domain.NormalizedConstraints;
import com.fieldops.scheduling.domain.Technician;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Re-checks a finished assignment set against the schedule invariants:
 * one assignment per job, skill cover, no overlap along a route (travel included), the per-technician
 * job cap and confidence bounds. Returns human-readable violations; empty means valid.
 */
@Component
public class ScheduleValidator {

    public List<String> validate(List<Assignment> assignments, List<Job> jobs, List<Technician> technicians,
                                 NormalizedConstraints constraints) {
        Map<String, Job> jobsById = jobs.stream().collect(Collectors.toMap(Job::getId, Function.identity(), (a, b) -> a));
        Map<String, Technician> techsById = technicians.stream()
                .collect(Collectors.toMap(Technician::getId, Function.identity(), (a, b) -> a));
        List<String> violations = new ArrayList<>();

        Set<String> seen = new HashSet<>();
        Map<String, List<Assignment>> routes = new LinkedHashMap<>();
        for (Assignment a : assignments) {
            if (!seen.add(a.getJobId())) {
                violations.add("job " + a.getJobId() + " is assigned more than once");
            }
            if (a.getConfidenceScore() < 0.0 || a.getConfidenceScore() > 1.0 || Double.isNaN(a.getConfidenceScore())) {
                violations.add("job " + a.getJobId() + " has confidence " + a.getConfidenceScore() + " outside [0,1]");
            }
            Job job = jobsById.get(a.getJobId());
            Technician technician = techsById.get(a.getTechnicianId());
            if (job == null || technician == null) {
                violations.add("assignment " + a.getJobId() + " -> " + a.getTechnicianId() + " references an unknown job or technician");
                continue;
            }
            if (constraints.isSkillMatchRequired() && !technician.getSkills().containsAll(job.getRequiredSkills())) {
                violations.add("technician " + technician.getId() + " lacks skills for job " + job.getId());
            }
            if (!a.getScheduledEnd().equals(a.getScheduledStart().plus(job.getEstimatedDuration()))) {
                violations.add("job " + job.getId() + " is not scheduled for its estimated duration");
            }
            routes.computeIfAbsent(a.getTechnicianId(), k -> new ArrayList<>()).add(a);
        }

        routes.forEach((technicianId, route) -> {
            int cap = Math.min(techsById.get(technicianId).getMaxJobsPerDay(), constraints.getMaxJobsPerTechnician());
            if (route.size() > cap) {
                violations.add("technician " + technicianId + " has " + route.size() + " jobs, cap is " + cap);
            }
            route.sort(Comparator.comparing(Assignment::getScheduledStart));
            for (int k = 0; k + 1 < route.size(); k++) {
                Assignment current = route.get(k);
                Assignment next = route.get(k + 1);
                if (current.getScheduledEnd().plus(current.getTravelTimeToNext()).isAfter(next.getScheduledStart())) {
                    violations.add("jobs " + current.getJobId() + " and " + next.getJobId()
                            + " overlap on technician " + technicianId);
                }
            }
        });
        return violations;
    }
}
