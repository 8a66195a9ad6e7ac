package com.fieldops.scheduling.engine;

import com.fieldops.scheduling.domain.Job;
import com.fieldops.scheduling.domain.NormalizedConstraints;
import com.fieldops.scheduling.domain.Technician;
import com.fieldops.scheduling.domain.TimeWindow;
import com.fieldops.scheduling.travel.TravelTimeMatrix;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, index-addressed view of one optimization problem.
 *
 * Jobs and technicians are sorted by id and referred to by their position. Matrix nodes are
 * laid out technicians first (route origins), then jobs. All instants are epoch seconds so that
 * route evaluation stays allocation-free apart from the result arrays.
 */
public final class ProblemInstance {

    public static final long NONE = Long.MIN_VALUE;
    public static final int ROUTE_START = -1;
    public static final int NO_PREDECESSOR = -2;

    private final List<Job> jobs;
    private final List<Technician> technicians;
    private final TimeWindow horizon;
    private final NormalizedConstraints constraints;
    private final TravelTimeMatrix matrix;

    private final long maxTravelSeconds;
    private final long[] shiftStart;
    private final long[] shiftEnd;
    private final long[] overtimeEnd;
    private final int[] capacity;
    private final double[] onTimeRate;
    private final boolean[] excluded;

    private final long[] earliest;
    private final long[] latest;
    private final long[] duration;
    private final boolean[][] skillMatch;
    private final double[][] skillMismatch;

    private final long[] notBefore;
    private final long[] latestStart;
    private final long[] pinnedStart;
    private final int[] pinnedTechnician;
    private final int[] pinnedPredecessor;
    private final int[] preferredTechnician;

    private final Map<String, Integer> jobIndex;
    private final Map<String, Integer> technicianIndex;

    ProblemInstance(List<Job> jobs, List<Technician> technicians, TimeWindow horizon,
                    NormalizedConstraints constraints, TravelTimeMatrix matrix,
                    long[] shiftStart, long[] shiftEnd, long[] overtimeEnd, int[] capacity,
                    double[] onTimeRate, boolean[] excluded,
                    long[] earliest, long[] latest, long[] duration,
                    boolean[][] skillMatch, double[][] skillMismatch,
                    long[] notBefore, long[] latestStart, long[] pinnedStart,
                    int[] pinnedTechnician, int[] pinnedPredecessor, int[] preferredTechnician) {
        this.jobs = List.copyOf(jobs);
        this.technicians = List.copyOf(technicians);
        this.horizon = horizon;
        this.constraints = constraints;
        this.matrix = matrix;
        this.maxTravelSeconds = constraints.getMaxTravelTime().getSeconds();
        this.shiftStart = shiftStart;
        this.shiftEnd = shiftEnd;
        this.overtimeEnd = overtimeEnd;
        this.capacity = capacity;
        this.onTimeRate = onTimeRate;
        this.excluded = excluded;
        this.earliest = earliest;
        this.latest = latest;
        this.duration = duration;
        this.skillMatch = skillMatch;
        this.skillMismatch = skillMismatch;
        this.notBefore = notBefore;
        this.latestStart = latestStart;
        this.pinnedStart = pinnedStart;
        this.pinnedTechnician = pinnedTechnician;
        this.pinnedPredecessor = pinnedPredecessor;
        this.preferredTechnician = preferredTechnician;

        Map<String, Integer> jobs0 = new HashMap<>();
        for (int j = 0; j < this.jobs.size(); j++) {
            jobs0.put(this.jobs.get(j).getId(), j);
        }
        Map<String, Integer> techs0 = new HashMap<>();
        for (int t = 0; t < this.technicians.size(); t++) {
            techs0.put(this.technicians.get(t).getId(), t);
        }
        this.jobIndex = Collections.unmodifiableMap(jobs0);
        this.technicianIndex = Collections.unmodifiableMap(techs0);
    }

    public int jobCount() {
        return jobs.size();
    }

    public int technicianCount() {
        return technicians.size();
    }

    public Job job(int j) {
        return jobs.get(j);
    }

    public Technician technician(int t) {
        return technicians.get(t);
    }

    public List<Job> jobs() {
        return jobs;
    }

    public List<Technician> technicians() {
        return technicians;
    }

    public TimeWindow horizon() {
        return horizon;
    }

    public NormalizedConstraints constraints() {
        return constraints;
    }

    public TravelTimeMatrix matrix() {
        return matrix;
    }

    public boolean isDegraded() {
        return matrix.isDegraded();
    }

    public int jobIndex(String jobId) {
        Integer index = jobIndex.get(jobId);
        return index != null ? index : -1;
    }

    public int technicianIndex(String technicianId) {
        Integer index = technicianIndex.get(technicianId);
        return index != null ? index : -1;
    }

    public int originNode(int t) {
        return t;
    }

    public int jobNode(int j) {
        return technicians.size() + j;
    }

    public long travelSeconds(int fromNode, int toNode) {
        return matrix.seconds(fromNode, toNode);
    }

    public long maxTravelSeconds() {
        return maxTravelSeconds;
    }

    public long shiftStart(int t) {
        return shiftStart[t];
    }

    public long shiftEnd(int t) {
        return shiftEnd[t];
    }

    /** Latest allowed finish on the route: the overtime end when overtime is allowed. */
    public long routeEnd(int t) {
        return constraints.isOvertimeAllowed() ? overtimeEnd[t] : shiftEnd[t];
    }

    public long shiftSeconds(int t) {
        return Math.max(0, shiftEnd[t] - shiftStart[t]);
    }

    public int capacity(int t) {
        return capacity[t];
    }

    public double onTimeRate(int t) {
        return onTimeRate[t];
    }

    public boolean isExcluded(int t) {
        return excluded[t];
    }

    public long earliest(int j) {
        return earliest[j];
    }

    public long latest(int j) {
        return latest[j];
    }

    public long duration(int j) {
        return duration[j];
    }

    public boolean skillMatch(int j, int t) {
        return skillMatch[j][t];
    }

    public double skillMismatch(int j, int t) {
        return skillMismatch[j][t];
    }

    public long notBefore(int j) {
        return notBefore[j];
    }

    public long latestStart(int j) {
        return latestStart[j];
    }

    public boolean isPinned(int j) {
        return pinnedStart[j] != NONE;
    }

    public long pinnedStart(int j) {
        return pinnedStart[j];
    }

    public int pinnedTechnician(int j) {
        return pinnedTechnician[j];
    }

    public int pinnedPredecessor(int j) {
        return pinnedPredecessor[j];
    }

    public int preferredTechnician(int j) {
        return preferredTechnician[j];
    }

    /**
     * Static candidate test: skills, shift overlap, non-zero capacity and exclusion.
     * Remaining capacity on a partly filled route is checked by the evaluator.
     */
    public boolean isCandidate(int j, int t) {
        if (excluded[t] || capacity[t] <= 0) {
            return false;
        }
        if (constraints.isSkillMatchRequired() && !skillMatch[j][t]) {
            return false;
        }
        if (isPinned(j)) {
            return pinnedTechnician[j] == t;
        }
        long from = Math.max(shiftStart[t], Math.max(earliest[j], notBefore[j]));
        long to = Math.min(routeEnd(t), latest[j]);
        return to - from >= duration[j];
    }
}
