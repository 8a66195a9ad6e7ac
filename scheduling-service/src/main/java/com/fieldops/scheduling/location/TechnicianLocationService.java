package com.fieldops.scheduling.location;

import com.fieldops.scheduling.config.SchedulingProperties;
import com.fieldops.scheduling.domain.GeoPoint;
import com.fieldops.scheduling.domain.Technician;
import com.fieldops.scheduling.domain.TechnicianStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Technician position intake and route-origin resolution.
 *
 * Updates are fire-and-forget: they are queued on a small dedicated executor and the caller
 * returns at once. A position is trusted as a route origin only while it is younger than
 * {@code scheduling.location.staleness}; otherwise the home location is used.
 */
@Slf4j
@Service
public class TechnicianLocationService {

    private final TechnicianLocationStore store;
    private final Executor executor;
    private final Clock clock;
    private final Duration staleness;

    public TechnicianLocationService(TechnicianLocationStore store,
                                     @Qualifier("locationWriterExecutor") Executor executor,
                                     Clock clock,
                                     SchedulingProperties properties) {
        this.store = store;
        this.executor = executor;
        this.clock = clock;
        this.staleness = properties.getLocation().getStaleness();
    }

    public void updateLocation(String tenantId, String technicianId, GeoPoint location, TechnicianStatus status) {
        LocationFix fix = LocationFix.builder()
                .technicianId(technicianId)
                .location(location)
                .status(status != null ? status : TechnicianStatus.AVAILABLE)
                .recordedAt(clock.instant())
                .build();
        try {
            executor.execute(() -> write(tenantId, fix));
        } catch (RejectedExecutionException e) {
            log.warn("Location update for technician {} tenant {} dropped, writer queue is full", technicianId, tenantId);
        }
    }

    private void write(String tenantId, LocationFix fix) {
        try {
            store.save(tenantId, fix);
        } catch (RuntimeException e) {
            log.warn("Failed to store location for technician {} tenant {}: {}",
                    fix.getTechnicianId(), tenantId, e.getMessage());
        }
    }

    /**
     * Route origin per technician: the freshest of the stored fix and the position supplied with the
     * technician, when younger than the staleness bound at {@code now}; the home location otherwise.
     */
    public Map<String, GeoPoint> startLocations(String tenantId, Collection<Technician> technicians, Instant now) {
        List<String> ids = technicians.stream().map(Technician::getId).toList();
        Map<String, LocationFix> fixes = store.snapshot(tenantId, ids);
        Instant oldestAccepted = now.minus(staleness);

        Map<String, GeoPoint> origins = new HashMap<>();
        for (Technician technician : technicians) {
            GeoPoint origin = technician.getHomeLocation();
            Instant seenAt = null;

            if (technician.getLastKnownLocation() != null && technician.getLastKnownAt() != null
                    && !technician.getLastKnownAt().isBefore(oldestAccepted)) {
                origin = technician.getLastKnownLocation();
                seenAt = technician.getLastKnownAt();
            }
            LocationFix fix = fixes.get(technician.getId());
            if (fix != null && !fix.getRecordedAt().isBefore(oldestAccepted)
                    && (seenAt == null || fix.getRecordedAt().isAfter(seenAt))) {
                origin = fix.getLocation();
            }
            if (origin != null) {
                origins.put(technician.getId(), origin);
            }
        }
        return origins;
    }
}
