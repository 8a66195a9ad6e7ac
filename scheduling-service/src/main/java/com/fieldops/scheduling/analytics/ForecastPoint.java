package com.fieldops.scheduling.analytics;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class ForecastPoint {

    LocalDate date;
    double expectedJobs;
    double lowerBound;
    double upperBound;
}
