package com.fieldops.scheduling.engine;

import com.fieldops.scheduling.domain.Job;
import com.fieldops.scheduling.domain.UnscheduledJob;
import com.fieldops.scheduling.domain.UnscheduledReason;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Greedy cheapest insertion.
 *
 * Jobs are taken by priority weight (highest first), then window start, then id. Each job goes to
 * the feasible position with the lowest marginal cost; ties keep the lowest technician index, then
 * the earliest position. A job with a preferred technician is placed there whenever that route
 * can take it. The cancellation token is checked before each job.
 */
@Slf4j
public final class InsertionHeuristic {

    static final double EPSILON = 1e-9;

    private InsertionHeuristic() {}

    public static InsertionResult insertAll(ProblemInstance problem, Solution initial, Collection<Integer> jobs) {
        return insertAll(problem, initial, jobs, CancellationToken.none());
    }

    public static InsertionResult insertAll(ProblemInstance problem, Solution initial, Collection<Integer> jobs,
                                            CancellationToken token) {
        Solution solution = initial;
        List<UnscheduledJob> unscheduled = new ArrayList<>();
        boolean cancelled = false;

        for (int j : order(problem, jobs)) {
            if (token.isCancellationRequested()) {
                cancelled = true;
                log.debug("Insertion cancelled before job {}", problem.job(j).getId());
                break;
            }
            Placement placement = bestPlacement(problem, solution, j);
            if (placement != null) {
                solution = solution.with(placement.technician(), placement.schedule());
                log.debug("Placed job {} on technician {} at position {} (delta={})",
                        problem.job(j).getId(), problem.technician(placement.technician()).getId(),
                        placement.position(), placement.marginalCost());
            } else {
                UnscheduledJob reason = classify(problem, j);
                unscheduled.add(reason);
                log.debug("Job {} left unscheduled: {}", reason.getJobId(), reason.getReason());
            }
        }

        unscheduled.sort(Comparator.comparing(UnscheduledJob::getJobId));
        return new InsertionResult(solution, List.copyOf(unscheduled), cancelled);
    }

    static List<Integer> order(ProblemInstance problem, Collection<Integer> jobs) {
        List<Integer> ordered = new ArrayList<>(jobs);
        ordered.sort(Comparator
                .comparingInt((Integer j) -> -problem.job(j).getPriority().weight())
                .thenComparingLong(problem::earliest)
                .thenComparing(j -> problem.job(j).getId()));
        return ordered;
    }

    static Placement bestPlacement(ProblemInstance problem, Solution solution, int job) {
        int preferred = problem.preferredTechnician(job);
        if (preferred >= 0 && problem.isCandidate(job, preferred)) {
            Placement onPreferred = bestOnRoute(problem, solution, job, preferred, null);
            if (onPreferred != null) {
                return onPreferred;
            }
        }

        Placement best = null;
        for (int t = 0; t < problem.technicianCount(); t++) {
            if (problem.isCandidate(job, t)) {
                best = bestOnRoute(problem, solution, job, t, best);
            }
        }
        return best;
    }

    /**
     * Cheapest feasible position for {@code job} on route {@code technician}, or {@code incumbent}
     * when nothing there beats it by more than {@link #EPSILON}.
     */
    static Placement bestOnRoute(ProblemInstance problem, Solution solution, int job, int technician,
                                 Placement incumbent) {
        RouteSchedule current = solution.schedule(technician);
        if (current.size() >= problem.capacity(technician)) {
            return incumbent;
        }
        Placement best = incumbent;
        int[] route = current.route();
        for (int position = 0; position <= route.length; position++) {
            RouteSchedule trial = RouteEvaluator.evaluate(problem, technician, Routes.insert(route, position, job));
            if (!trial.isFeasible()) {
                continue;
            }
            double delta = trial.cost() - current.cost();
            if (best == null || delta < best.marginalCost() - EPSILON) {
                best = new Placement(technician, position, trial, delta);
            }
        }
        return best;
    }

    /**
     * Explains why a job found no feasible position.
     *
     * NO_CANDIDATE when no technician qualifies or every qualified technician could take the job
     * on an empty route (they are all booked); TRAVEL_TIME_EXCEEDED when some technician could take
     * it only with the leg limit lifted; NO_SLOT otherwise.
     */
    static UnscheduledJob classify(ProblemInstance problem, int job) {
        Job subject = problem.job(job);
        int candidates = 0;
        int busy = 0;
        boolean travelBound = false;
        int[] alone = {job};

        for (int t = 0; t < problem.technicianCount(); t++) {
            if (!problem.isCandidate(job, t)) {
                continue;
            }
            candidates++;
            if (RouteEvaluator.evaluate(problem, t, alone).isFeasible()) {
                busy++;
            } else if (RouteEvaluator.evaluate(problem, t, alone, false).isFeasible()) {
                travelBound = true;
            }
        }

        if (candidates == 0) {
            return unscheduled(subject, UnscheduledReason.NO_CANDIDATE,
                    "No technician with skills " + subject.getRequiredSkills()
                            + ", free capacity and working hours covering the window");
        }
        if (busy == candidates) {
            return unscheduled(subject, UnscheduledReason.NO_CANDIDATE,
                    "All " + candidates + " qualified technician(s) are fully booked in the window");
        }
        if (travelBound) {
            return unscheduled(subject, UnscheduledReason.TRAVEL_TIME_EXCEEDED,
                    "Reachable only with a leg longer than " + problem.maxTravelSeconds() / 60 + " min");
        }
        return unscheduled(subject, UnscheduledReason.NO_SLOT,
                "No feasible slot inside the window and working hours");
    }

    private static UnscheduledJob unscheduled(Job job, UnscheduledReason reason, String detail) {
        return UnscheduledJob.builder().jobId(job.getId()).reason(reason).detail(detail).build();
    }
}
