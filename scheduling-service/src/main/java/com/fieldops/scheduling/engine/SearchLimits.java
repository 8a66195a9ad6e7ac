package com.fieldops.scheduling.engine;

import java.time.Duration;

/**
 * @param maxIterations applied moves before the search stops
 * @param deadlineNanos {@link System#nanoTime()} value after which no further iteration starts
 */
public record SearchLimits(int maxIterations, long deadlineNanos) {

    public static SearchLimits of(int maxIterations, Duration budget) {
        return new SearchLimits(maxIterations, System.nanoTime() + budget.toNanos());
    }

    boolean isExpired() {
        return System.nanoTime() - deadlineNanos > 0;
    }
}
