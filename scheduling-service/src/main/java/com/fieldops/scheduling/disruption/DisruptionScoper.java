package com.fieldops.scheduling.disruption;

import com.fieldops.scheduling.domain.AdaptationPreferences;
import com.fieldops.scheduling.domain.Assignment;
import com.fieldops.scheduling.domain.DisruptionEvent;
import com.fieldops.scheduling.domain.DisruptionType;
import com.fieldops.scheduling.domain.ScheduleSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Works out which committed jobs a disruption may move.
 *
 * Seeds depend on the disruption type:
 *   TRAFFIC_DELAY, WEATHER, EQUIPMENT_FAILURE  listed jobs, plus the next open job of each listed technician; delayed
 *   CUSTOMER_RESCHEDULE                        listed jobs; delayed
 *   RESOURCE_UNAVAILABLE                       listed jobs, plus jobs of listed technicians overlapping
 *                                              [now, now + expected duration) or the rest of the horizon
 *   EMERGENCY_INSERTION                        listed jobs and the new job
 *
 * The seed set is then closed over routes: jobs after a seed on the same route join in route order,
 * at most {@code maxReassignments} of them in total.
 */
@Slf4j
@Component
public class DisruptionScoper {

    static final String REASON_DOWNSTREAM = "downstream_of:";

    public DisruptionScope scope(ScheduleSnapshot snapshot, DisruptionEvent event, AdaptationPreferences preferences,
                                 Instant now, Duration weatherAdjustment) {
        String seedReason = event.getType().name().toLowerCase(Locale.ROOT);
        Duration delay = effectiveDelay(event, weatherAdjustment);

        Map<String, String> reasons = new LinkedHashMap<>();
        Map<String, Duration> delays = new LinkedHashMap<>();
        Set<String> unavailable = new LinkedHashSet<>();
        List<Assignment> seeds = new ArrayList<>();

        for (String jobId : event.getAffectedJobIds()) {
            snapshot.assignmentFor(jobId).ifPresentOrElse(seeds::add,
                    () -> log.warn("Disruption {} names job {} which has no committed assignment", event.getId(), jobId));
        }

        switch (event.getType()) {
            case TRAFFIC_DELAY, WEATHER, EQUIPMENT_FAILURE -> {
                for (String technicianId : event.getAffectedTechnicianIds()) {
                    snapshot.routeOf(technicianId).stream()
                            .filter(a -> a.getScheduledEnd().isAfter(now))
                            .findFirst()
                            .ifPresent(seeds::add);
                }
            }
            case RESOURCE_UNAVAILABLE -> {
                unavailable.addAll(event.getAffectedTechnicianIds());
                if (unavailable.isEmpty()) {
                    seeds.forEach(a -> unavailable.add(a.getTechnicianId()));
                }
                Instant until = event.getExpectedDuration() != null
                        ? now.plus(event.getExpectedDuration())
                        : snapshot.getHorizon().getEnd();
                for (String technicianId : unavailable) {
                    snapshot.routeOf(technicianId).stream()
                            .filter(a -> a.getScheduledStart().isBefore(until) && a.getScheduledEnd().isAfter(now))
                            .forEach(seeds::add);
                }
            }
            case CUSTOMER_RESCHEDULE, EMERGENCY_INSERTION -> {
                // listed jobs only
            }
        }

        seeds.sort(Comparator.comparing(Assignment::getScheduledStart).thenComparing(Assignment::getJobId));
        boolean delayed = event.getType() != DisruptionType.RESOURCE_UNAVAILABLE
                && event.getType() != DisruptionType.EMERGENCY_INSERTION;
        for (Assignment seed : seeds) {
            if (reasons.putIfAbsent(seed.getJobId(), seedReason) == null && delayed) {
                delays.put(seed.getJobId(), delay);
            }
        }

        DisruptionScope.DisruptionScopeBuilder scope = DisruptionScope.builder()
                .unavailableTechnicianIds(Set.copyOf(unavailable));

        if (event.getType() == DisruptionType.RESOURCE_UNAVAILABLE) {
            long leaving = reasons.keySet().stream()
                    .filter(id -> snapshot.assignmentFor(id).map(a -> unavailable.contains(a.getTechnicianId())).orElse(false))
                    .count();
            if (leaving > preferences.getMaxReassignments()) {
                return scope.affectedJobIds(List.copyOf(reasons.keySet()))
                        .reasons(reasons)
                        .rejectionReason(leaving + " job(s) must be reassigned but maxReassignments is "
                                + preferences.getMaxReassignments())
                        .build();
            }
        }

        if (event.getType() == DisruptionType.EMERGENCY_INSERTION) {
            if (event.getEmergencyJob() == null) {
                return scope.rejectionReason("Emergency insertion carries no job").build();
            }
            if (snapshot.job(event.getEmergencyJob().getId()).isPresent()) {
                return scope.rejectionReason("Job " + event.getEmergencyJob().getId() + " is already in the schedule").build();
            }
            reasons.put(event.getEmergencyJob().getId(), seedReason);
            scope.emergencyJob(event.getEmergencyJob());
        }

        if (reasons.isEmpty()) {
            return scope.rejectionReason("No committed job is affected by disruption " + event.getId()).build();
        }

        closeOverRoutes(snapshot, seeds, unavailable, preferences.getMaxReassignments(), reasons);
        return scope.affectedJobIds(List.copyOf(reasons.keySet()))
                .reasons(Map.copyOf(reasons))
                .delays(Map.copyOf(delays))
                .build();
    }

    /**
     * Widens an emergency scope around one route: the technician's open jobs become movable so the
     * new job can be fitted in between, and the new job is steered to that technician.
     */
    public DisruptionScope widenAround(ScheduleSnapshot snapshot, DisruptionScope scope, String technicianId,
                                       AdaptationPreferences preferences, Instant now) {
        Map<String, String> reasons = new LinkedHashMap<>(scope.getReasons());
        int added = 0;
        for (Assignment a : snapshot.routeOf(technicianId)) {
            if (added >= preferences.getMaxReassignments()) {
                break;
            }
            if (a.getScheduledStart().isAfter(now) && reasons.putIfAbsent(a.getJobId(), "make_room_for:"
                    + scope.getEmergencyJob().getId()) == null) {
                added++;
            }
        }
        return scope.toBuilder()
                .affectedJobIds(List.copyOf(reasons.keySet()))
                .reasons(Map.copyOf(reasons))
                .forcedTechnicianId(technicianId)
                .build();
    }

    private void closeOverRoutes(ScheduleSnapshot snapshot, List<Assignment> seeds, Set<String> unavailable,
                                 int cap, Map<String, String> reasons) {
        int added = 0;
        for (Assignment seed : seeds) {
            if (unavailable.contains(seed.getTechnicianId())) {
                continue;
            }
            boolean after = false;
            for (Assignment a : snapshot.routeOf(seed.getTechnicianId())) {
                if (a.getJobId().equals(seed.getJobId())) {
                    after = true;
                    continue;
                }
                if (!after || reasons.containsKey(a.getJobId())) {
                    continue;
                }
                if (added >= cap) {
                    return;
                }
                reasons.put(a.getJobId(), REASON_DOWNSTREAM + seed.getJobId());
                added++;
            }
        }
    }

    static Duration effectiveDelay(DisruptionEvent event, Duration weatherAdjustment) {
        Duration delay = event.effectiveDelay();
        if (event.getType() == DisruptionType.WEATHER && weatherAdjustment != null
                && weatherAdjustment.compareTo(delay) > 0) {
            return weatherAdjustment;
        }
        return delay;
    }
}
