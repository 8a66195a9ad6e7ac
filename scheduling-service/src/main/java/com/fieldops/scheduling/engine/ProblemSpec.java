package com.fieldops.scheduling.engine;

import com.fieldops.scheduling.domain.GeoPoint;
import com.fieldops.scheduling.domain.Job;
import com.fieldops.scheduling.domain.NormalizedConstraints;
import com.fieldops.scheduling.domain.Technician;
import com.fieldops.scheduling.domain.TimeWindow;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything needed to build a {@link ProblemInstance}: an immutable input snapshot.
 */
@Value
@Builder(toBuilder = true)
public class ProblemSpec {

    List<Job> jobs;
    List<Technician> technicians;
    TimeWindow horizon;
    NormalizedConstraints constraints;

    /** Resolved route origin per technician id; missing entries fall back to the home location. */
    @Builder.Default
    Map<String, GeoPoint> startLocations = Map.of();

    @Builder.Default
    Map<String, Double> onTimeRates = Map.of();

    @Builder.Default
    Duration overtimeAllowance = Duration.ofMinutes(120);

    @Builder.Default
    Map<String, RepairBound> repairBounds = Map.of();

    @Builder.Default
    Set<String> unavailableTechnicianIds = Set.of();
}
