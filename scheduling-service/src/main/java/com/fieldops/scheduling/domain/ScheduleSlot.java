package com.fieldops.scheduling.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class ScheduleSlot {

    String technicianId;
    Instant start;
    Instant end;

    public static ScheduleSlot of(Assignment assignment) {
        return new ScheduleSlot(assignment.getTechnicianId(),
                assignment.getScheduledStart(), assignment.getScheduledEnd());
    }
}
