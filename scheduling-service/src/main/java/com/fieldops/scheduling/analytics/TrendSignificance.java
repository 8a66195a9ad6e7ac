package com.fieldops.scheduling.analytics;

public enum TrendSignificance {
    LOW,
    MEDIUM,
    HIGH;

    /** LOW below 10 %, MEDIUM below 25 %, HIGH otherwise. */
    public static TrendSignificance of(double changePercent) {
        double magnitude = Math.abs(changePercent);
        if (magnitude < 10.0) {
            return LOW;
        }
        return magnitude < 25.0 ? MEDIUM : HIGH;
    }
}
