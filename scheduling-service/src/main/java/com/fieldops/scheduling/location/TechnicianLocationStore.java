package com.fieldops.scheduling.location;

import java.util.Collection;
import java.util.Map;

public interface TechnicianLocationStore {

    void save(String tenantId, LocationFix fix);

    /**
     * Latest fix per technician id. Technicians without a stored fix are absent from the map.
     * Never throws: an unreachable store yields an empty snapshot.
     */
    Map<String, LocationFix> snapshot(String tenantId, Collection<String> technicianIds);
}
