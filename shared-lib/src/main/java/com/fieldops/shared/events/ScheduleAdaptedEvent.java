package com.fieldops.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleAdaptedEvent {

    public static final String TOPIC = "schedule.adapted";

    private String tenantId;
    private String adaptationId;
    private String disruptionType;
    private String severity;
    private String state;
    private List<String> affectedJobIds;
    private int reassignmentCount;
    private long snapshotVersion;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant adaptedAt;
}
