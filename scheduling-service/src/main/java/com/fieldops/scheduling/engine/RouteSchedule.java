package com.fieldops.scheduling.engine;

/**
 * Result of evaluating one technician route: per-stop start times and inbound legs plus the
 * route cost, or the first infeasibility found. Instances are never mutated.
 */
public final class RouteSchedule {

    private static final long[] NO_TIMES = new long[0];
    private static final boolean[] NO_FLAGS = new boolean[0];

    private final int[] route;
    private final boolean feasible;
    private final InfeasibilityKind infeasibility;
    private final int failedPosition;
    private final long[] starts;
    private final long[] legs;
    private final boolean[] overtime;
    private final long travelSeconds;
    private final long productiveSeconds;
    private final double cost;

    RouteSchedule(int[] route, long[] starts, long[] legs, boolean[] overtime,
                  long travelSeconds, long productiveSeconds, double cost) {
        this.route = route;
        this.feasible = true;
        this.infeasibility = null;
        this.failedPosition = -1;
        this.starts = starts;
        this.legs = legs;
        this.overtime = overtime;
        this.travelSeconds = travelSeconds;
        this.productiveSeconds = productiveSeconds;
        this.cost = cost;
    }

    private RouteSchedule(int[] route, InfeasibilityKind infeasibility, int failedPosition) {
        this.route = route;
        this.feasible = false;
        this.infeasibility = infeasibility;
        this.failedPosition = failedPosition;
        this.starts = NO_TIMES;
        this.legs = NO_TIMES;
        this.overtime = NO_FLAGS;
        this.travelSeconds = 0;
        this.productiveSeconds = 0;
        this.cost = Double.POSITIVE_INFINITY;
    }

    static RouteSchedule infeasible(int[] route, InfeasibilityKind kind, int position) {
        return new RouteSchedule(route, kind, position);
    }

    public int[] route() {
        return route;
    }

    public int size() {
        return route.length;
    }

    public int jobAt(int position) {
        return route[position];
    }

    public boolean isFeasible() {
        return feasible;
    }

    public InfeasibilityKind infeasibility() {
        return infeasibility;
    }

    public int failedPosition() {
        return failedPosition;
    }

    public long start(int position) {
        return starts[position];
    }

    /** Travel into the stop at {@code position} from the previous stop or the route origin. */
    public long legInto(int position) {
        return legs[position];
    }

    public boolean isOvertime(int position) {
        return overtime[position];
    }

    public long travelSeconds() {
        return travelSeconds;
    }

    public long productiveSeconds() {
        return productiveSeconds;
    }

    public double cost() {
        return cost;
    }
}
