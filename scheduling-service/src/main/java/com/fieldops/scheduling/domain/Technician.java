package com.fieldops.scheduling.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Set;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Technician {

    String id;

    @Builder.Default
    Set<String> skills = Set.of();

    GeoPoint homeLocation;
    GeoPoint lastKnownLocation;
    Instant lastKnownAt;
    TimeWindow workingHours;

    @Builder.Default
    int maxJobsPerDay = 8;
}
