package com.fieldops.scheduling.engine;

/**
 * One evaluated route per technician, indexed like {@link ProblemInstance#technician(int)}.
 * Moves produce a new Solution sharing every untouched {@link RouteSchedule}.
 */
public final class Solution {

    private final RouteSchedule[] schedules;
    private final double cost;

    Solution(RouteSchedule[] schedules) {
        this.schedules = schedules;
        this.cost = CostModel.solutionCost(schedules);
    }

    public static Solution empty(ProblemInstance problem) {
        return of(problem, new int[problem.technicianCount()][]);
    }

    /**
     * Evaluates the given routes; a null entry is an empty route.
     *
     * @throws IllegalStateException when a route is infeasible
     */
    public static Solution of(ProblemInstance problem, int[][] routes) {
        RouteSchedule[] schedules = new RouteSchedule[problem.technicianCount()];
        for (int t = 0; t < schedules.length; t++) {
            int[] route = routes[t] != null ? routes[t] : Routes.EMPTY;
            RouteSchedule schedule = RouteEvaluator.evaluate(problem, t, route);
            if (!schedule.isFeasible()) {
                throw new IllegalStateException("Route of technician " + problem.technician(t).getId()
                        + " is infeasible: " + schedule.infeasibility());
            }
            schedules[t] = schedule;
        }
        return new Solution(schedules);
    }

    public RouteSchedule schedule(int technician) {
        return schedules[technician];
    }

    public int technicianCount() {
        return schedules.length;
    }

    public double cost() {
        return cost;
    }

    public int assignedCount() {
        int total = 0;
        for (RouteSchedule schedule : schedules) {
            total += schedule.size();
        }
        return total;
    }

    /** Technician currently serving {@code job}, or -1. */
    public int technicianOf(int job) {
        for (int t = 0; t < schedules.length; t++) {
            if (Routes.indexOf(schedules[t].route(), job) >= 0) {
                return t;
            }
        }
        return -1;
    }

    Solution with(int technician, RouteSchedule schedule) {
        RouteSchedule[] next = schedules.clone();
        next[technician] = schedule;
        return new Solution(next);
    }

    Solution with(int first, RouteSchedule firstSchedule, int second, RouteSchedule secondSchedule) {
        RouteSchedule[] next = schedules.clone();
        next[first] = firstSchedule;
        next[second] = secondSchedule;
        return new Solution(next);
    }
}
