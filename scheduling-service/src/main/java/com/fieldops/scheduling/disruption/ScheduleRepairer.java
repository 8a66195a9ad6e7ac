package com.fieldops.scheduling.disruption;

import com.fieldops.scheduling.config.SchedulingProperties;
import com.fieldops.scheduling.domain.AdaptationPreferences;
import com.fieldops.scheduling.domain.Assignment;
import com.fieldops.scheduling.domain.GeoPoint;
import com.fieldops.scheduling.domain.Job;
import com.fieldops.scheduling.domain.ScheduleSnapshot;
import com.fieldops.scheduling.domain.Technician;
import com.fieldops.scheduling.domain.UnscheduledJob;
import com.fieldops.scheduling.domain.UnscheduledReason;
import com.fieldops.scheduling.engine.CancellationToken;
import com.fieldops.scheduling.engine.CostModel;
import com.fieldops.scheduling.engine.InsertionHeuristic;
import com.fieldops.scheduling.engine.InsertionResult;
import com.fieldops.scheduling.engine.LocalSearch;
import com.fieldops.scheduling.engine.LocalSearchResult;
import com.fieldops.scheduling.engine.ProblemBuilder;
import com.fieldops.scheduling.engine.ProblemInstance;
import com.fieldops.scheduling.engine.ProblemSpec;
import com.fieldops.scheduling.engine.RepairBound;
import com.fieldops.scheduling.engine.RouteSchedule;
import com.fieldops.scheduling.engine.ScheduleAssembler;
import com.fieldops.scheduling.engine.SearchLimits;
import com.fieldops.scheduling.engine.Solution;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Incremental repair of a committed schedule.
 *
 * Only the jobs in the scope move. Every other committed stop is pinned to its technician and start,
 * so reinsertion may only use the gaps between pinned stops. Moved jobs may not start before their
 * committed start (plus the disruption delay for delayed jobs) nor later than committed start plus
 * {@code maxScheduleDelay}. A short relocate/swap pass restricted to the moved jobs follows.
 *
 * Untouched assignments are returned as the very same objects. A stop is rebuilt when it moved or
 * when its previous or next stop changed, and copied with a new sequence when a stop ahead of it was removed or
 * inserted. Every rebuilt or resequenced stop is listed in {@link RepairResult#getTouchedJobIds()}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduleRepairer {

    private final ProblemBuilder problemBuilder;
    private final ScheduleAssembler assembler;
    private final SchedulingProperties properties;

    public RepairResult repair(ScheduleSnapshot snapshot, DisruptionScope scope, AdaptationPreferences preferences,
                               Map<String, GeoPoint> startLocations, Map<String, Double> onTimeRates) {
        Map<String, Assignment> originals = new HashMap<>();
        Map<String, String> committedNext = new HashMap<>();
        Map<String, String> committedPrevious = new HashMap<>();
        Map<String, RepairBound> bounds = new HashMap<>();
        Set<String> affected = new HashSet<>(scope.getAffectedJobIds());
        Duration maxDelay = preferences.getMaxScheduleDelay();

        for (Technician technician : snapshot.getTechnicians()) {
            String previous = null;
            for (Assignment a : snapshot.routeOf(technician.getId())) {
                originals.put(a.getJobId(), a);
                if (previous != null) {
                    committedNext.put(previous, a.getJobId());
                    committedPrevious.put(a.getJobId(), previous);
                }
                if (affected.contains(a.getJobId())) {
                    Duration delay = scope.getDelays().getOrDefault(a.getJobId(), Duration.ZERO);
                    boolean keepTechnician = preferences.isPreferSameTechnician()
                            && !scope.getUnavailableTechnicianIds().contains(a.getTechnicianId());
                    bounds.put(a.getJobId(), RepairBound.builder()
                            .notBefore(a.getScheduledStart().plus(delay))
                            .latestStart(a.getScheduledStart().plus(maxDelay))
                            .preferredTechnicianId(keepTechnician ? a.getTechnicianId() : null)
                            .build());
                } else {
                    bounds.put(a.getJobId(), RepairBound.builder()
                            .pinnedStart(a.getScheduledStart())
                            .pinnedTechnicianId(a.getTechnicianId())
                            .pinnedPredecessorJobId(previous)
                            .build());
                }
                previous = a.getJobId();
            }
        }

        List<Job> jobs = new ArrayList<>();
        for (Job job : snapshot.getJobs()) {
            if (originals.containsKey(job.getId())) {
                jobs.add(job);
            }
        }
        Job emergency = scope.getEmergencyJob();
        if (emergency != null) {
            jobs.add(emergency);
            if (scope.getForcedTechnicianId() != null) {
                bounds.put(emergency.getId(), RepairBound.builder()
                        .preferredTechnicianId(scope.getForcedTechnicianId())
                        .build());
            }
        }

        ProblemInstance problem = problemBuilder.build(ProblemSpec.builder()
                .jobs(jobs)
                .technicians(snapshot.getTechnicians())
                .horizon(snapshot.getHorizon())
                .constraints(snapshot.getConstraints().toBuilder()
                        .overtimeAllowed(preferences.isAllowOvertime() || snapshot.getConstraints().isOvertimeAllowed())
                        .build())
                .startLocations(startLocations)
                .onTimeRates(onTimeRates)
                .overtimeAllowance(properties.getOptimizer().getOvertimeAllowance())
                .repairBounds(bounds)
                .unavailableTechnicianIds(scope.getUnavailableTechnicianIds())
                .build());

        int[][] routes = new int[problem.technicianCount()][];
        for (int t = 0; t < problem.technicianCount(); t++) {
            routes[t] = snapshot.routeOf(problem.technician(t).getId()).stream()
                    .map(Assignment::getJobId)
                    .filter(id -> !affected.contains(id))
                    .mapToInt(problem::jobIndex)
                    .toArray();
        }

        Solution pinned;
        try {
            pinned = Solution.of(problem, routes);
        } catch (IllegalStateException e) {
            log.warn("Committed schedule of tenant {} no longer evaluates: {}", snapshot.getTenantId(), e.getMessage());
            return RepairResult.builder()
                    .success(false)
                    .failures(scope.getAffectedJobIds().stream()
                            .map(id -> UnscheduledJob.builder().jobId(id).reason(UnscheduledReason.NO_SLOT)
                                    .detail("committed routes are no longer feasible").build())
                            .toList())
                    .build();
        }

        Set<Integer> movable = new LinkedHashSet<>();
        for (String jobId : scope.getAffectedJobIds()) {
            int index = problem.jobIndex(jobId);
            if (index >= 0) {
                movable.add(index);
            }
        }

        InsertionResult inserted = InsertionHeuristic.insertAll(problem, pinned, movable);
        if (!inserted.unscheduled().isEmpty()) {
            log.info("Repair for tenant {} could not place {} job(s): {}", snapshot.getTenantId(),
                    inserted.unscheduled().size(), inserted.unscheduled());
            return RepairResult.builder()
                    .success(false)
                    .failures(inserted.unscheduled())
                    .degraded(problem.isDegraded())
                    .build();
        }

        SearchLimits limits = SearchLimits.of(properties.getOptimizer().getRepairMaxIterations(),
                properties.getOptimizer().getTimeBudget());
        LocalSearchResult improved = LocalSearch.improve(problem, inserted.solution(), limits,
                CancellationToken.none(), movable);
        Solution solution = improved.solution();

        List<Assignment> assignments = new ArrayList<>(solution.assignedCount());
        Set<String> touched = new LinkedHashSet<>();
        Set<Integer> changedRoutes = new HashSet<>();
        for (int t = 0; t < problem.technicianCount(); t++) {
            RouteSchedule route = solution.schedule(t);
            String technicianId = problem.technician(t).getId();
            for (int k = 0; k < route.size(); k++) {
                String jobId = problem.job(route.jobAt(k)).getId();
                String next = k + 1 < route.size() ? problem.job(route.jobAt(k + 1)).getId() : null;
                String previous = k > 0 ? problem.job(route.jobAt(k - 1)).getId() : null;
                Assignment original = originals.get(jobId);

                boolean unchanged = original != null
                        && !affected.contains(jobId)
                        && original.getTechnicianId().equals(technicianId)
                        && Objects.equals(committedPrevious.get(jobId), previous)
                        && Objects.equals(committedNext.get(jobId), next)
                        && (next == null || startsAt(originals.get(next), route.start(k + 1)));

                if (unchanged && original.getSequence() == k) {
                    assignments.add(original);
                } else if (unchanged) {
                    assignments.add(original.toBuilder().sequence(k).build());
                    touched.add(jobId);
                } else {
                    assignments.add(assembler.assignmentAt(problem, solution, t, k, true));
                    touched.add(jobId);
                    changedRoutes.add(t);
                    if (original != null) {
                        changedRoutes.add(problem.technicianIndex(original.getTechnicianId()));
                    }
                }
            }
        }
        for (String jobId : scope.getAffectedJobIds()) {
            Assignment original = originals.get(jobId);
            if (original != null) {
                changedRoutes.add(problem.technicianIndex(original.getTechnicianId()));
            }
        }

        double before = 0.0;
        double after = 0.0;
        for (int t : changedRoutes) {
            before += committedCost(problem, t, snapshot.routeOf(problem.technician(t).getId()));
            after += solution.schedule(t).cost();
        }

        log.debug("Repair for tenant {}: {} touched job(s), {} iteration(s), cost delta {}",
                snapshot.getTenantId(), touched.size(), improved.iterations(), after - before);
        return RepairResult.builder()
                .success(true)
                .assignments(assignments)
                .touchedJobIds(touched)
                .costDelta(after - before)
                .iterations(improved.iterations())
                .degraded(problem.isDegraded())
                .build();
    }

    private static boolean startsAt(Assignment assignment, long epochSecond) {
        return assignment != null && assignment.getScheduledStart().getEpochSecond() == epochSecond;
    }

    private static double committedCost(ProblemInstance problem, int technician, List<Assignment> route) {
        int[] jobs = new int[route.size()];
        long[] starts = new long[route.size()];
        long travel = 0;
        for (int k = 0; k < route.size(); k++) {
            Assignment a = route.get(k);
            jobs[k] = problem.jobIndex(a.getJobId());
            starts[k] = a.getScheduledStart().getEpochSecond();
            travel += a.getTravelTimeFromPrevious().getSeconds();
        }
        return CostModel.routeCost(problem, technician, jobs, starts, travel);
    }
}
