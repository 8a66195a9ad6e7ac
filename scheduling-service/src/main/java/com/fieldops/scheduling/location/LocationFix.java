package com.fieldops.scheduling.location;

import com.fieldops.scheduling.domain.GeoPoint;
import com.fieldops.scheduling.domain.TechnicianStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Last reported position of a technician.
 */
@Value
@Builder
public class LocationFix {

    String technicianId;
    GeoPoint location;
    TechnicianStatus status;
    Instant recordedAt;
}
