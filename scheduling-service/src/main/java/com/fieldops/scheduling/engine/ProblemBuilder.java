package com.fieldops.scheduling.engine;

import com.fieldops.scheduling.domain.GeoPoint;
import com.fieldops.scheduling.domain.Job;
import com.fieldops.scheduling.domain.NormalizedConstraints;
import com.fieldops.scheduling.domain.Technician;
import com.fieldops.scheduling.domain.TimeWindow;
import com.fieldops.scheduling.scoring.ConfidenceScorer;
import com.fieldops.scheduling.travel.ResilientTravelTimeService;
import com.fieldops.scheduling.travel.TravelTimeMatrix;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Turns a {@link ProblemSpec} into a {@link ProblemInstance}: sorts the arenas, fetches the travel
 * matrix in one batch and precomputes shifts, capacities, skill fit and repair bounds.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProblemBuilder {

    private final ResilientTravelTimeService travelTimeService;

    public ProblemInstance build(ProblemSpec spec) {
        List<Job> jobs = new ArrayList<>(spec.getJobs());
        jobs.sort(Comparator.comparing(Job::getId));
        List<Technician> technicians = new ArrayList<>(spec.getTechnicians());
        technicians.sort(Comparator.comparing(Technician::getId));

        NormalizedConstraints constraints = spec.getConstraints();
        TimeWindow horizon = spec.getHorizon();
        long horizonStart = horizon.getStart().getEpochSecond();
        long horizonEnd = horizon.getEnd().getEpochSecond();
        int jobCount = jobs.size();
        int techCount = technicians.size();

        List<GeoPoint> nodes = new ArrayList<>(techCount + jobCount);
        for (Technician technician : technicians) {
            GeoPoint origin = spec.getStartLocations().get(technician.getId());
            nodes.add(origin != null ? origin : technician.getHomeLocation());
        }
        for (Job job : jobs) {
            nodes.add(job.getLocation());
        }
        TravelTimeMatrix matrix = travelTimeService.buildMatrix(nodes);

        long[] shiftStart = new long[techCount];
        long[] shiftEnd = new long[techCount];
        long[] overtimeEnd = new long[techCount];
        int[] capacity = new int[techCount];
        double[] onTimeRate = new double[techCount];
        boolean[] excluded = new boolean[techCount];
        long allowance = spec.getOvertimeAllowance().getSeconds();

        for (int t = 0; t < techCount; t++) {
            Technician technician = technicians.get(t);
            TimeWindow hours = technician.getWorkingHours();
            long start = Math.max(hours != null ? hours.getStart().getEpochSecond() : horizonStart, horizonStart);
            long end = Math.min(hours != null ? hours.getEnd().getEpochSecond() : horizonEnd, horizonEnd);

            if (constraints.getWorkingHoursStart() != null) {
                ZoneId zone = ZoneId.of(constraints.getZoneId());
                LocalDate day = LocalDate.ofInstant(Instant.ofEpochSecond(start), zone);
                start = Math.max(start, day.atTime(constraints.getWorkingHoursStart()).atZone(zone).toEpochSecond());
                end = Math.min(end, day.atTime(constraints.getWorkingHoursEnd()).atZone(zone).toEpochSecond());
            }
            end = Math.max(start, end);

            shiftStart[t] = start;
            shiftEnd[t] = end;
            overtimeEnd[t] = Math.max(end, Math.min(end + allowance, horizonEnd));
            capacity[t] = Math.max(0, Math.min(technician.getMaxJobsPerDay(), constraints.getMaxJobsPerTechnician()));
            onTimeRate[t] = spec.getOnTimeRates().getOrDefault(technician.getId(), ConfidenceScorer.DEFAULT_ON_TIME_RATE);
            excluded[t] = spec.getUnavailableTechnicianIds().contains(technician.getId());
        }

        long[] earliest = new long[jobCount];
        long[] latest = new long[jobCount];
        long[] duration = new long[jobCount];
        boolean[][] skillMatch = new boolean[jobCount][techCount];
        double[][] skillMismatch = new double[jobCount][techCount];

        for (int j = 0; j < jobCount; j++) {
            Job job = jobs.get(j);
            TimeWindow window = job.getWindow() != null ? job.getWindow() : horizon;
            earliest[j] = Math.max(window.getStart().getEpochSecond(), horizonStart);
            latest[j] = Math.min(window.getEnd().getEpochSecond(), horizonEnd);
            duration[j] = job.getEstimatedDuration().getSeconds();

            Set<String> required = job.getRequiredSkills();
            for (int t = 0; t < techCount; t++) {
                Set<String> skills = technicians.get(t).getSkills();
                long missing = required.stream().filter(s -> !skills.contains(s)).count();
                skillMatch[j][t] = missing == 0;
                skillMismatch[j][t] = required.isEmpty() ? 0.0 : (double) missing / required.size();
            }
        }

        long[] notBefore = filled(jobCount, ProblemInstance.NONE);
        long[] latestStart = filled(jobCount, ProblemInstance.NONE);
        long[] pinnedStart = filled(jobCount, ProblemInstance.NONE);
        int[] pinnedTechnician = new int[jobCount];
        int[] pinnedPredecessor = new int[jobCount];
        int[] preferredTechnician = new int[jobCount];
        Arrays.fill(pinnedTechnician, -1);
        Arrays.fill(pinnedPredecessor, ProblemInstance.NO_PREDECESSOR);
        Arrays.fill(preferredTechnician, -1);

        for (int j = 0; j < jobCount; j++) {
            RepairBound bound = spec.getRepairBounds().get(jobs.get(j).getId());
            if (bound == null) {
                continue;
            }
            if (bound.getNotBefore() != null) {
                notBefore[j] = bound.getNotBefore().getEpochSecond();
            }
            if (bound.getLatestStart() != null) {
                latestStart[j] = bound.getLatestStart().getEpochSecond();
            }
            if (bound.isPinned()) {
                pinnedStart[j] = bound.getPinnedStart().getEpochSecond();
                pinnedTechnician[j] = indexOfTechnician(technicians, bound.getPinnedTechnicianId());
                pinnedPredecessor[j] = bound.getPinnedPredecessorJobId() == null
                        ? ProblemInstance.ROUTE_START
                        : indexOfJob(jobs, bound.getPinnedPredecessorJobId(), ProblemInstance.NO_PREDECESSOR);
            }
            if (bound.getPreferredTechnicianId() != null) {
                preferredTechnician[j] = indexOfTechnician(technicians, bound.getPreferredTechnicianId());
            }
        }

        log.debug("Built problem: {} job(s), {} technician(s), degraded={}", jobCount, techCount, matrix.isDegraded());
        return new ProblemInstance(jobs, technicians, horizon, constraints, matrix,
                shiftStart, shiftEnd, overtimeEnd, capacity, onTimeRate, excluded,
                earliest, latest, duration, skillMatch, skillMismatch,
                notBefore, latestStart, pinnedStart, pinnedTechnician, pinnedPredecessor, preferredTechnician);
    }

    private static long[] filled(int size, long value) {
        long[] array = new long[size];
        Arrays.fill(array, value);
        return array;
    }

    private static int indexOfTechnician(List<Technician> technicians, String id) {
        for (int t = 0; t < technicians.size(); t++) {
            if (technicians.get(t).getId().equals(id)) {
                return t;
            }
        }
        return -1;
    }

    private static int indexOfJob(List<Job> jobs, String id, int missing) {
        for (int j = 0; j < jobs.size(); j++) {
            if (jobs.get(j).getId().equals(id)) {
                return j;
            }
        }
        return missing;
    }
}
