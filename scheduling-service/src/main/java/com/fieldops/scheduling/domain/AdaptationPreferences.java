package com.fieldops.scheduling.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class AdaptationPreferences {

    @Builder.Default
    boolean allowOvertime = false;

    @Builder.Default
    Duration maxScheduleDelay = Duration.ofMinutes(60);

    @Builder.Default
    int maxReassignments = 5;

    @Builder.Default
    boolean preferSameTechnician = true;

    @Builder.Default
    boolean notifyCustomers = true;

    @Builder.Default
    boolean notifyTechnicians = true;

    public static AdaptationPreferences defaults() {
        return AdaptationPreferences.builder().build();
    }
}
