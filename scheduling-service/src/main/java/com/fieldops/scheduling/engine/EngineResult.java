package com.fieldops.scheduling.engine;

import com.fieldops.scheduling.domain.UnscheduledJob;

import java.util.List;

/**
 * Raw engine output before assembly into assignments.
 *
 * @param initialCost cost after greedy insertion
 * @param initialTravelSeconds travel total after greedy insertion, the default savings baseline
 */
public record EngineResult(Solution solution,
                           List<UnscheduledJob> unscheduled,
                           double initialCost,
                           long initialTravelSeconds,
                           int iterations,
                           boolean timedOut,
                           boolean cancelled) {
}
