package com.fieldops.scheduling.analytics;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@Jacksonized
public class AnalyticsReport {

    String tenantId;
    Instant from;
    Instant to;
    SchedulingKpis kpis;

    @Builder.Default
    List<KpiTrend> trendAnalysis = List.of();

    @Builder.Default
    List<DemandForecast> predictions = List.of();

    @Builder.Default
    List<String> recommendations = List.of();
}
