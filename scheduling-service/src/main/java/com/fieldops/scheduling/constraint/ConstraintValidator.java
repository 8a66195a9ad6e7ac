package com.fieldops.scheduling.constraint;

import com.fieldops.scheduling.domain.AdaptationPreferences;
import com.fieldops.scheduling.domain.ConstraintSet;
import com.fieldops.scheduling.domain.NormalizedConstraints;
import com.fieldops.scheduling.domain.Objective;
import com.fieldops.scheduling.domain.WeightedObjective;
import com.fieldops.scheduling.exception.ConstraintValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Validates and normalises caller-supplied constraints before any schedule state is touched.
 *
 * Every violated field is collected in a single pass and reported together.
 *
 * Defaults:
 *   maxTravelTime          120 min per leg
 *   maxJobsPerTechnician   8
 *   skillMatchRequired     true
 *   overtimeAllowed        false
 *   zoneId                 UTC
 *   objectives             [MINIMIZE_TRAVEL_TIME, MAXIMIZE_UTILIZATION]
 *
 * Objective weights: supplied weights are scaled to sum to 1.0. Without weights the
 * i-th of n objectives (0-based) gets (n - i) / (1 + 2 + ... + n), so earlier
 * objectives dominate; the default pair becomes 2/3 and 1/3.
 */
@Slf4j
@Component
public class ConstraintValidator {

    public static final Duration DEFAULT_MAX_TRAVEL_TIME   = Duration.ofMinutes(120);
    public static final Duration MAX_TRAVEL_TIME_CEILING   = Duration.ofMinutes(480);
    public static final int      DEFAULT_MAX_JOBS          = 8;
    public static final int      MAX_JOBS_CEILING          = 100;
    public static final String   DEFAULT_ZONE              = "UTC";
    public static final List<Objective> DEFAULT_OBJECTIVES =
            List.of(Objective.MINIMIZE_TRAVEL_TIME, Objective.MAXIMIZE_UTILIZATION);

    public static final Duration MAX_SCHEDULE_DELAY_CEILING = Duration.ofMinutes(480);
    public static final int      MAX_REASSIGNMENTS_CEILING  = 20;

    public NormalizedConstraints validate(ConstraintSet constraints) {
        ConstraintSet input = constraints != null ? constraints : ConstraintSet.builder().build();
        List<FieldViolation> violations = new ArrayList<>();

        Duration maxTravel = input.getMaxTravelTime() != null ? input.getMaxTravelTime() : DEFAULT_MAX_TRAVEL_TIME;
        if (maxTravel.isZero() || maxTravel.isNegative()) {
            violations.add(new FieldViolation("maxTravelTime", "must be positive"));
        } else if (maxTravel.compareTo(MAX_TRAVEL_TIME_CEILING) > 0) {
            violations.add(new FieldViolation("maxTravelTime", "must not exceed " + MAX_TRAVEL_TIME_CEILING.toMinutes() + " minutes"));
        }

        if (input.getWorkingHoursStart() != null ^ input.getWorkingHoursEnd() != null) {
            violations.add(new FieldViolation("workingHours", "start and end must be supplied together"));
        } else if (input.getWorkingHoursStart() != null
                && !input.getWorkingHoursEnd().isAfter(input.getWorkingHoursStart())) {
            violations.add(new FieldViolation("workingHours", "end must be after start"));
        }

        String zoneId = input.getZoneId() != null ? input.getZoneId() : DEFAULT_ZONE;
        try {
            ZoneId.of(zoneId);
        } catch (DateTimeException e) {
            violations.add(new FieldViolation("zoneId", "unknown time zone '" + zoneId + "'"));
        }

        int maxJobs = input.getMaxJobsPerTechnician() != null ? input.getMaxJobsPerTechnician() : DEFAULT_MAX_JOBS;
        if (maxJobs < 0) {
            violations.add(new FieldViolation("maxJobsPerTechnician", "must not be negative"));
        } else if (maxJobs > MAX_JOBS_CEILING) {
            violations.add(new FieldViolation("maxJobsPerTechnician", "must not exceed " + MAX_JOBS_CEILING));
        }

        Map<Objective, Double> weights = normalizeObjectives(input.getObjectives(), violations);

        if (!violations.isEmpty()) {
            log.warn("Rejected constraint set with {} violation(s): {}", violations.size(), violations);
            throw new ConstraintValidationException(violations);
        }

        return NormalizedConstraints.builder()
                .maxTravelTime(maxTravel)
                .workingHoursStart(input.getWorkingHoursStart())
                .workingHoursEnd(input.getWorkingHoursEnd())
                .zoneId(zoneId)
                .maxJobsPerTechnician(maxJobs)
                .skillMatchRequired(!Boolean.FALSE.equals(input.getSkillMatchRequired()))
                .overtimeAllowed(Boolean.TRUE.equals(input.getOvertimeAllowed()))
                .weights(weights)
                .build();
    }

    public AdaptationPreferences validate(AdaptationPreferences preferences) {
        AdaptationPreferences input = preferences != null ? preferences : AdaptationPreferences.defaults();
        List<FieldViolation> violations = new ArrayList<>();

        Duration delay = input.getMaxScheduleDelay();
        if (delay == null) {
            violations.add(new FieldViolation("maxScheduleDelay", "is required"));
        } else if (delay.isNegative()) {
            violations.add(new FieldViolation("maxScheduleDelay", "must not be negative"));
        } else if (delay.compareTo(MAX_SCHEDULE_DELAY_CEILING) > 0) {
            violations.add(new FieldViolation("maxScheduleDelay",
                    "must not exceed " + MAX_SCHEDULE_DELAY_CEILING.toMinutes() + " minutes"));
        }

        if (input.getMaxReassignments() < 0 || input.getMaxReassignments() > MAX_REASSIGNMENTS_CEILING) {
            violations.add(new FieldViolation("maxReassignments",
                    "must be between 0 and " + MAX_REASSIGNMENTS_CEILING));
        }

        if (!violations.isEmpty()) {
            throw new ConstraintValidationException(violations);
        }
        return input;
    }

    private Map<Objective, Double> normalizeObjectives(List<WeightedObjective> supplied,
                                                       List<FieldViolation> violations) {
        List<WeightedObjective> objectives = supplied != null
                ? supplied
                : DEFAULT_OBJECTIVES.stream().map(WeightedObjective::of).toList();

        if (objectives.isEmpty()) {
            violations.add(new FieldViolation("objectives", "must contain at least one objective"));
            return Map.of();
        }

        Set<Objective> seen = EnumSet.noneOf(Objective.class);
        int weighted = 0;
        double sum = 0.0;
        for (int i = 0; i < objectives.size(); i++) {
            WeightedObjective wo = objectives.get(i);
            if (wo == null || wo.getObjective() == null) {
                violations.add(new FieldViolation("objectives[" + i + "]", "objective is required"));
                continue;
            }
            if (!seen.add(wo.getObjective())) {
                violations.add(new FieldViolation("objectives[" + i + "]", "duplicate objective " + wo.getObjective()));
            }
            if (wo.getWeight() != null) {
                weighted++;
                double w = wo.getWeight();
                if (Double.isNaN(w) || Double.isInfinite(w) || w < 0) {
                    violations.add(new FieldViolation("objectives[" + i + "].weight", "must be a non-negative number"));
                } else {
                    sum += w;
                }
            }
        }

        if (weighted > 0 && weighted < objectives.size()) {
            violations.add(new FieldViolation("objectives", "weights must be supplied for every objective or for none"));
        } else if (weighted > 0 && sum <= 0.0) {
            violations.add(new FieldViolation("objectives", "weights must not all be zero"));
        }

        if (!violations.isEmpty()) {
            return Map.of();
        }

        Map<Objective, Double> weights = new EnumMap<>(Objective.class);
        int n = objectives.size();
        double rankTotal = n * (n + 1) / 2.0;
        for (int i = 0; i < n; i++) {
            WeightedObjective wo = objectives.get(i);
            double w = weighted > 0
                    ? Objects.requireNonNull(wo.getWeight()) / sum
                    : (n - i) / rankTotal;
            weights.put(wo.getObjective(), w);
        }
        return Collections.unmodifiableMap(weights);
    }
}
