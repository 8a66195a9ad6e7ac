package com.fieldops.scheduling.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class DisruptionEvent {

    String id;
    DisruptionType type;

    @Builder.Default
    List<String> affectedJobIds = List.of();

    @Builder.Default
    List<String> affectedTechnicianIds = List.of();

    @Builder.Default
    Severity severity = Severity.MEDIUM;

    Duration expectedDuration;
    GeoPoint location;

    /** The new job to place; only meaningful for EMERGENCY_INSERTION. */
    Job emergencyJob;

    Instant occurredAt;

    /** An explicit {@code "severity": null} reads as MEDIUM, like an omitted one. */
    public Severity getSeverity() {
        return severity != null ? severity : Severity.MEDIUM;
    }

    /**
     * High-priority disruptions may preempt a running full optimization for the same tenant.
     */
    @JsonIgnore
    public boolean isHighPriority() {
        return type == DisruptionType.EMERGENCY_INSERTION || getSeverity().isHighPriority();
    }

    public Duration effectiveDelay() {
        return expectedDuration != null ? expectedDuration : getSeverity().defaultDelay();
    }
}
