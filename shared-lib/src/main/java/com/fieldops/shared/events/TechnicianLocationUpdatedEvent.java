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
public class TechnicianLocationUpdatedEvent {

    public static final String TOPIC = "technician.location.updated";

    private String tenantId;
    private String technicianId;
    private double latitude;
    private double longitude;
    private String status;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant timestamp;
}
