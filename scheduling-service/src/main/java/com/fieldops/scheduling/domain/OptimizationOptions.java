package com.fieldops.scheduling.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class OptimizationOptions {

    public enum Algorithm {
        /** Greedy insertion only. */
        GREEDY,
        /** Greedy insertion followed by bounded relocate/swap local search. */
        INTELLIGENT
    }

    @Builder.Default
    Algorithm algorithm = Algorithm.INTELLIGENT;

    /** Null means the configured default budget. */
    Duration timeBudget;

    /** Null means the configured default iteration cap. */
    Integer maxIterations;

    /** Optional pre-optimization travel total used for the savings metric. */
    Double baselineTotalTravelMinutes;

    @Builder.Default
    boolean notifyTechnicians = false;

    public static OptimizationOptions defaults() {
        return OptimizationOptions.builder().build();
    }
}
