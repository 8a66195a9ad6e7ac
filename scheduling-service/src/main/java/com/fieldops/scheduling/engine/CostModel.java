package com.fieldops.scheduling.engine;

import com.fieldops.scheduling.domain.NormalizedConstraints;
import com.fieldops.scheduling.domain.Objective;

/**
 * Decomposable route cost. Each objective contributes a normalised term times its weight:
 *
 * <pre>
 * MINIMIZE_TRAVEL_TIME            sum(legs) / maxTravelTime
 * MAXIMIZE_UTILIZATION            1 - productive / shift length
 * BALANCE_WORKLOAD                (jobs / capacity)^2
 * MINIMIZE_SKILL_MISMATCH         sum of missing-skill fractions
 * MAXIMIZE_CUSTOMER_SATISFACTION  sum of start lateness within each window, 0..1 per job
 * </pre>
 *
 * A solution costs the sum of its route costs, so a move only needs the routes it touches.
 */
public final class CostModel {

    private CostModel() {}

    public static double routeCost(ProblemInstance problem, int technician, int[] route,
                                   long[] starts, long travelSeconds) {
        NormalizedConstraints constraints = problem.constraints();
        int n = route.length;

        double travel = (double) travelSeconds / Math.max(1, problem.maxTravelSeconds());

        long productive = 0;
        double mismatch = 0.0;
        double lateness = 0.0;
        for (int k = 0; k < n; k++) {
            int j = route[k];
            productive += problem.duration(j);
            mismatch += problem.skillMismatch(j, technician);
            long range = problem.latest(j) - problem.duration(j) - problem.earliest(j);
            if (range > 0) {
                double late = (double) (starts[k] - problem.earliest(j)) / range;
                lateness += Math.max(0.0, Math.min(1.0, late));
            }
        }

        long shift = problem.shiftSeconds(technician);
        double idle = shift > 0 ? 1.0 - Math.min(1.0, (double) productive / shift) : 1.0;

        int capacity = problem.capacity(technician);
        double load = capacity > 0 ? (double) n / capacity : 0.0;

        return constraints.weight(Objective.MINIMIZE_TRAVEL_TIME) * travel
                + constraints.weight(Objective.MAXIMIZE_UTILIZATION) * idle
                + constraints.weight(Objective.BALANCE_WORKLOAD) * load * load
                + constraints.weight(Objective.MINIMIZE_SKILL_MISMATCH) * mismatch
                + constraints.weight(Objective.MAXIMIZE_CUSTOMER_SATISFACTION) * lateness;
    }

    public static double solutionCost(RouteSchedule[] schedules) {
        double total = 0.0;
        for (RouteSchedule schedule : schedules) {
            total += schedule.cost();
        }
        return total;
    }
}
