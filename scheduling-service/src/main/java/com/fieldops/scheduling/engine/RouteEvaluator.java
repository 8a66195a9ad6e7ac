package com.fieldops.scheduling.engine;

/**
 * Forward pass over one technician route.
 *
 * Each stop starts at the earliest of: arrival from the previous stop, the window start and the
 * repair not-before bound. Pinned stops start exactly at their committed time. A pinned stop that
 * still follows its committed predecessor is taken as committed; its leg is not re-checked because
 * the committed schedule already proved it.
 */
public final class RouteEvaluator {

    private RouteEvaluator() {}

    public static RouteSchedule evaluate(ProblemInstance problem, int technician, int[] route) {
        return evaluate(problem, technician, route, true);
    }

    /**
     * @param enforceTravelLimit false to lift the per-leg travel limit, used to classify why a job failed
     */
    public static RouteSchedule evaluate(ProblemInstance problem, int technician, int[] route,
                                         boolean enforceTravelLimit) {
        int n = route.length;
        if (n > problem.capacity(technician)) {
            return RouteSchedule.infeasible(route, InfeasibilityKind.CAPACITY, n - 1);
        }

        long[] starts = new long[n];
        long[] legs = new long[n];
        boolean[] overtime = new boolean[n];
        boolean skillsRequired = problem.constraints().isSkillMatchRequired();
        long maxLeg = problem.maxTravelSeconds();
        long shiftEnd = problem.shiftEnd(technician);
        long routeEnd = problem.routeEnd(technician);

        long time = problem.shiftStart(technician);
        int previousNode = problem.originNode(technician);
        int previousJob = ProblemInstance.ROUTE_START;
        long travel = 0;
        long productive = 0;

        for (int k = 0; k < n; k++) {
            int j = route[k];
            boolean pinned = problem.isPinned(j);

            if (problem.isExcluded(technician) && !pinned) {
                return RouteSchedule.infeasible(route, InfeasibilityKind.UNAVAILABLE, k);
            }
            if (skillsRequired && !problem.skillMatch(j, technician)) {
                return RouteSchedule.infeasible(route, InfeasibilityKind.SKILL, k);
            }

            long leg = problem.travelSeconds(previousNode, problem.jobNode(j));
            long start;
            if (pinned) {
                if (problem.pinnedTechnician(j) != technician) {
                    return RouteSchedule.infeasible(route, InfeasibilityKind.PINNED_START, k);
                }
                start = problem.pinnedStart(j);
                boolean committedLeg = problem.pinnedPredecessor(j) == previousJob
                        && (previousJob == ProblemInstance.ROUTE_START || problem.isPinned(previousJob));
                if (!committedLeg) {
                    if (enforceTravelLimit && leg > maxLeg) {
                        return RouteSchedule.infeasible(route, InfeasibilityKind.TRAVEL_LIMIT, k);
                    }
                    if (time + leg > start) {
                        return RouteSchedule.infeasible(route, InfeasibilityKind.PINNED_START, k);
                    }
                }
            } else {
                if (enforceTravelLimit && leg > maxLeg) {
                    return RouteSchedule.infeasible(route, InfeasibilityKind.TRAVEL_LIMIT, k);
                }
                start = Math.max(time + leg, Math.max(problem.earliest(j), problem.notBefore(j)));
                long latestStart = problem.latestStart(j);
                if (latestStart != ProblemInstance.NONE && start > latestStart) {
                    return RouteSchedule.infeasible(route, InfeasibilityKind.DELAY, k);
                }
                long finish = start + problem.duration(j);
                if (finish > problem.latest(j)) {
                    return RouteSchedule.infeasible(route, InfeasibilityKind.WINDOW, k);
                }
                if (finish > routeEnd) {
                    return RouteSchedule.infeasible(route, InfeasibilityKind.WORKING_HOURS, k);
                }
            }

            long end = start + problem.duration(j);
            starts[k] = start;
            legs[k] = leg;
            overtime[k] = end > shiftEnd;
            travel += leg;
            productive += problem.duration(j);

            time = end;
            previousNode = problem.jobNode(j);
            previousJob = j;
        }

        double cost = CostModel.routeCost(problem, technician, route, starts, travel);
        return new RouteSchedule(route, starts, legs, overtime, travel, productive, cost);
    }
}
