package com.fieldops.scheduling.engine;

import lombok.extern.slf4j.Slf4j;

import java.util.Set;

/**
 * Best-improvement local search over inter-route relocate and swap moves.
 *
 * Every iteration scans all moves in a fixed order (technician, then position, then target) and
 * applies the one with the lowest cost delta, provided it is below -1e-9. Ties keep the first move
 * found. The search stops at a local optimum, after {@code maxIterations} applied moves, when the
 * deadline passes or when the token is cancelled; the token and deadline are checked before each
 * iteration.
 *
 * Pinned jobs never move. A job already on its preferred technician stays there.
 */
@Slf4j
public final class LocalSearch {

    private LocalSearch() {}

    private record Move(String kind, int first, RouteSchedule firstSchedule,
                        int second, RouteSchedule secondSchedule, double delta) {
    }

    /**
     * @param movable jobs allowed to move, or null for every unpinned job
     */
    public static LocalSearchResult improve(ProblemInstance problem, Solution start, SearchLimits limits,
                                            CancellationToken token, Set<Integer> movable) {
        Solution current = start;
        int iterations = 0;
        boolean timedOut = false;
        boolean cancelled = false;

        while (iterations < limits.maxIterations()) {
            if (token.isCancellationRequested()) {
                cancelled = true;
                break;
            }
            if (limits.isExpired()) {
                timedOut = true;
                break;
            }
            Move move = bestMove(problem, current, movable);
            if (move == null) {
                break;
            }
            current = current.with(move.first(), move.firstSchedule(), move.second(), move.secondSchedule());
            iterations++;
            log.debug("Iteration {}: {} between {} and {} (delta={})", iterations, move.kind(),
                    problem.technician(move.first()).getId(), problem.technician(move.second()).getId(), move.delta());
        }

        return new LocalSearchResult(current, iterations, timedOut, cancelled);
    }

    private static Move bestMove(ProblemInstance problem, Solution solution, Set<Integer> movable) {
        Move best = null;
        double bestDelta = -InsertionHeuristic.EPSILON;
        int technicians = problem.technicianCount();

        // relocate
        for (int a = 0; a < technicians; a++) {
            RouteSchedule from = solution.schedule(a);
            for (int i = 0; i < from.size(); i++) {
                int job = from.jobAt(i);
                if (!canMove(problem, job, a, movable)) {
                    continue;
                }
                RouteSchedule shrunk = RouteEvaluator.evaluate(problem, a, Routes.remove(from.route(), i));
                if (!shrunk.isFeasible()) {
                    continue;
                }
                double removal = shrunk.cost() - from.cost();
                for (int b = 0; b < technicians; b++) {
                    if (b == a || !problem.isCandidate(job, b)) {
                        continue;
                    }
                    RouteSchedule to = solution.schedule(b);
                    if (to.size() >= problem.capacity(b)) {
                        continue;
                    }
                    for (int position = 0; position <= to.size(); position++) {
                        RouteSchedule grown = RouteEvaluator.evaluate(problem, b, Routes.insert(to.route(), position, job));
                        if (!grown.isFeasible()) {
                            continue;
                        }
                        double delta = removal + grown.cost() - to.cost();
                        if (delta < bestDelta) {
                            bestDelta = delta;
                            best = new Move("relocate", a, shrunk, b, grown, delta);
                        }
                    }
                }
            }
        }

        // swap
        for (int a = 0; a < technicians; a++) {
            RouteSchedule left = solution.schedule(a);
            for (int b = a + 1; b < technicians; b++) {
                RouteSchedule right = solution.schedule(b);
                for (int i = 0; i < left.size(); i++) {
                    int x = left.jobAt(i);
                    if (!canMove(problem, x, a, movable) || !problem.isCandidate(x, b)) {
                        continue;
                    }
                    for (int k = 0; k < right.size(); k++) {
                        int y = right.jobAt(k);
                        if (!canMove(problem, y, b, movable) || !problem.isCandidate(y, a)) {
                            continue;
                        }
                        RouteSchedule newLeft = RouteEvaluator.evaluate(problem, a, Routes.replace(left.route(), i, y));
                        if (!newLeft.isFeasible()) {
                            continue;
                        }
                        RouteSchedule newRight = RouteEvaluator.evaluate(problem, b, Routes.replace(right.route(), k, x));
                        if (!newRight.isFeasible()) {
                            continue;
                        }
                        double delta = newLeft.cost() + newRight.cost() - left.cost() - right.cost();
                        if (delta < bestDelta) {
                            bestDelta = delta;
                            best = new Move("swap", a, newLeft, b, newRight, delta);
                        }
                    }
                }
            }
        }
        return best;
    }

    private static boolean canMove(ProblemInstance problem, int job, int technician, Set<Integer> movable) {
        if (problem.isPinned(job) || (movable != null && !movable.contains(job))) {
            return false;
        }
        return problem.preferredTechnician(job) != technician;
    }
}
