package com.fieldops.scheduling.analytics;

/**
 * Optional narrowing of an analytics request. Null fields do not filter.
 */
public record AnalyticsFilter(String technicianId, String skill) {

    public static AnalyticsFilter none() {
        return new AnalyticsFilter(null, null);
    }
}
