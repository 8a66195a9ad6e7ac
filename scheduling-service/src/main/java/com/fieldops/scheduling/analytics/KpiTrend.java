package com.fieldops.scheduling.analytics;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One KPI compared between the first and the second half of the analysed period.
 */
@Value
@Builder
@Jacksonized
public class KpiTrend {

    String kpi;
    double firstHalf;
    double secondHalf;
    double changePercent;
    TrendDirection direction;
    TrendSignificance significance;
}
