package com.fieldops.scheduling.engine;

/**
 * A feasible position for one job on one technician route, with the marginal cost of taking it.
 */
record Placement(int technician, int position, RouteSchedule schedule, double marginalCost) {
}
