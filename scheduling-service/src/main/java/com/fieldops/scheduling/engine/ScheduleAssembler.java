package com.fieldops.scheduling.engine;

import com.fieldops.scheduling.domain.AlternativeCandidate;
import com.fieldops.scheduling.domain.Assignment;
import com.fieldops.scheduling.domain.Job;
import com.fieldops.scheduling.domain.OptimizationMetrics;
import com.fieldops.scheduling.scoring.ConfidenceScorer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns evaluated routes into {@link Assignment} records and aggregate metrics.
 */
@Component
public class ScheduleAssembler {

    static final int MAX_ALTERNATIVES = 3;
    static final String GENERAL_SKILL = "general";

    /** Assignments ordered by technician id, then sequence. */
    public List<Assignment> assemble(ProblemInstance problem, Solution solution) {
        List<Assignment> assignments = new ArrayList<>(solution.assignedCount());
        for (int t = 0; t < problem.technicianCount(); t++) {
            RouteSchedule route = solution.schedule(t);
            for (int k = 0; k < route.size(); k++) {
                assignments.add(assignmentAt(problem, solution, t, k, true));
            }
        }
        return assignments;
    }

    public Assignment assignmentAt(ProblemInstance problem, Solution solution, int technician, int position,
                                   boolean withAlternatives) {
        RouteSchedule route = solution.schedule(technician);
        int job = route.jobAt(position);
        long start = route.start(position);
        long end = start + problem.duration(job);
        boolean last = position == route.size() - 1;

        long toNext = last ? 0 : route.legInto(position + 1);
        long slack = last
                ? problem.shiftEnd(technician) - end
                : route.start(position + 1) - (end + toNext);

        double confidence = ConfidenceScorer.score(Duration.ofSeconds(Math.max(0, slack)),
                problem.isDegraded(),
                1.0 - problem.skillMismatch(job, technician),
                problem.onTimeRate(technician));

        return Assignment.builder()
                .jobId(problem.job(job).getId())
                .technicianId(problem.technician(technician).getId())
                .sequence(position)
                .scheduledStart(Instant.ofEpochSecond(start))
                .scheduledEnd(Instant.ofEpochSecond(end))
                .travelTimeFromPrevious(Duration.ofSeconds(route.legInto(position)))
                .travelTimeToNext(Duration.ofSeconds(toNext))
                .confidenceScore(confidence)
                .overtime(route.isOvertime(position))
                .alternatives(withAlternatives ? alternatives(problem, solution, technician, position) : List.of())
                .build();
    }

    /**
     * Up to three other technicians that could take the job, ranked by the change in solution cost
     * (cheapest insertion there minus the saving of removing it here), then technician id.
     */
    List<AlternativeCandidate> alternatives(ProblemInstance problem, Solution solution, int technician, int position) {
        RouteSchedule route = solution.schedule(technician);
        int job = route.jobAt(position);
        RouteSchedule without = RouteEvaluator.evaluate(problem, technician, Routes.remove(route.route(), position));
        if (!without.isFeasible()) {
            return List.of();
        }
        double removal = without.cost() - route.cost();

        List<AlternativeCandidate> candidates = new ArrayList<>();
        for (int t = 0; t < problem.technicianCount(); t++) {
            if (t == technician || !problem.isCandidate(job, t)) {
                continue;
            }
            Placement placement = InsertionHeuristic.bestOnRoute(problem, solution, job, t, null);
            if (placement != null) {
                candidates.add(AlternativeCandidate.builder()
                        .technicianId(problem.technician(t).getId())
                        .costDelta(round(placement.marginalCost() + removal))
                        .build());
            }
        }
        candidates.sort(Comparator.comparingDouble(AlternativeCandidate::getCostDelta)
                .thenComparing(AlternativeCandidate::getTechnicianId));
        return candidates.size() > MAX_ALTERNATIVES ? List.copyOf(candidates.subList(0, MAX_ALTERNATIVES)) : candidates;
    }

    public OptimizationMetrics metrics(ProblemInstance problem, EngineResult result, List<Assignment> assignments,
                                       Double baselineTravelMinutes, long elapsedMillis) {
        Solution solution = result.solution();
        int total = problem.jobCount();
        int scheduled = assignments.size();

        long travel = 0;
        long productive = 0;
        long shifts = 0;
        int used = 0;
        for (int t = 0; t < problem.technicianCount(); t++) {
            RouteSchedule route = solution.schedule(t);
            travel += route.travelSeconds();
            productive += route.productiveSeconds();
            shifts += problem.shiftSeconds(t);
            if (route.size() > 0) {
                used++;
            }
        }
        double travelMinutes = travel / 60.0;
        double baseline = baselineTravelMinutes != null ? baselineTravelMinutes : result.initialTravelSeconds() / 60.0;

        Map<String, Integer> demand = new TreeMap<>();
        for (Job job : problem.jobs()) {
            if (job.getRequiredSkills().isEmpty()) {
                demand.merge(GENERAL_SKILL, 1, Integer::sum);
            }
            job.getRequiredSkills().forEach(skill -> demand.merge(skill, 1, Integer::sum));
        }

        return OptimizationMetrics.builder()
                .totalJobs(total)
                .scheduledJobs(scheduled)
                .unscheduledJobs(result.unscheduled().size())
                .schedulingSuccessRate(total > 0 ? (double) scheduled / total : 0.0)
                .totalTravelMinutes(round(travelMinutes))
                .averageTravelMinutes(scheduled > 0 ? round(travelMinutes / scheduled) : 0.0)
                .averageConfidence(round(assignments.stream().mapToDouble(Assignment::getConfidenceScore).average().orElse(0.0)))
                .utilizationRate(shifts > 0 ? round((double) productive / shifts) : 0.0)
                .initialCost(round(result.initialCost()))
                .finalCost(round(solution.cost()))
                .travelSavingsPercent(baseline > 0 ? round((baseline - travelMinutes) / baseline * 100.0) : 0.0)
                .techniciansUsed(used)
                .iterations(result.iterations())
                .elapsedMillis(elapsedMillis)
                .timedOut(result.timedOut())
                .cancelled(result.cancelled())
                .degraded(problem.isDegraded())
                .demandBySkill(demand)
                .build();
    }

    static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
