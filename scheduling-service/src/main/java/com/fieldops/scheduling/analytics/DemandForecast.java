package com.fieldops.scheduling.analytics;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class DemandForecast {

    String skill;

    /** Days of history the forecast was fitted on. */
    int observedDays;

    List<ForecastPoint> points;
}
