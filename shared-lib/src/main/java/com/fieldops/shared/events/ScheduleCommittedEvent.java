package com.fieldops.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleCommittedEvent {

    public static final String TOPIC = "schedule.committed";

    private String tenantId;
    private String runId;
    private long snapshotVersion;
    private int scheduledJobs;
    private int unscheduledJobs;
    private boolean degraded;
    private boolean timedOut;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant committedAt;
}
