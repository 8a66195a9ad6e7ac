package com.fieldops.scheduling.support;

import com.fieldops.scheduling.config.SchedulingProperties;
import com.fieldops.scheduling.constraint.ConstraintValidator;
import com.fieldops.scheduling.domain.Assignment;
import com.fieldops.scheduling.domain.ConstraintSet;
import com.fieldops.scheduling.domain.GeoPoint;
import com.fieldops.scheduling.domain.Job;
import com.fieldops.scheduling.domain.NormalizedConstraints;
import com.fieldops.scheduling.domain.ScheduleSnapshot;
import com.fieldops.scheduling.domain.Technician;
import com.fieldops.scheduling.domain.TimeWindow;
import com.fieldops.scheduling.engine.ProblemBuilder;
import com.fieldops.scheduling.travel.HaversineTravelTimeEstimator;
import com.fieldops.scheduling.travel.ResilientTravelTimeService;
import com.fieldops.scheduling.travel.TravelTimeProvider;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.timelimiter.TimeLimiter;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

/**
 * Builders shared by the scheduling tests. All times fall on {@link #DAY} in UTC.
 */
public final class SchedulingFixtures {

    public static final String TENANT = "acme";
    public static final Instant DAY = Instant.parse("2026-03-02T00:00:00Z");

    public static final GeoPoint DEPOT = GeoPoint.of(40.7128, -74.0060);

    private SchedulingFixtures() {}

    public static Instant at(String hhmm) {
        return DAY.plus(Duration.between(LocalTime.MIDNIGHT, LocalTime.parse(hhmm)));
    }

    public static TimeWindow window(String from, String to) {
        return TimeWindow.of(at(from), at(to));
    }

    public static Job job(String id, GeoPoint location, TimeWindow window, int minutes, String... skills) {
        return Job.builder()
                .id(id)
                .location(location)
                .window(window)
                .estimatedDuration(Duration.ofMinutes(minutes))
                .requiredSkills(Set.of(skills))
                .build();
    }

    public static Technician technician(String id, GeoPoint home, TimeWindow hours, String... skills) {
        return Technician.builder()
                .id(id)
                .homeLocation(home)
                .workingHours(hours)
                .skills(Set.of(skills))
                .build();
    }

    public static NormalizedConstraints defaultConstraints() {
        return new ConstraintValidator().validate((ConstraintSet) null);
    }

    /**
     * Provider calls run inline on the calling thread.
     */
    public static ResilientTravelTimeService travelService(TravelTimeProvider provider) {
        return new ResilientTravelTimeService(provider, new HaversineTravelTimeEstimator(),
                TimeLimiter.of(Duration.ofSeconds(5)), CircuitBreaker.ofDefaults("test-travel"), Runnable::run);
    }

    public static ProblemBuilder problemBuilder(TravelTimeProvider provider) {
        return new ProblemBuilder(travelService(provider));
    }

    public static SchedulingProperties properties() {
        return new SchedulingProperties();
    }

    public static Assignment assignment(String jobId, String technicianId, int sequence, Instant start, int minutes) {
        return Assignment.builder()
                .jobId(jobId)
                .technicianId(technicianId)
                .sequence(sequence)
                .scheduledStart(start)
                .scheduledEnd(start.plus(Duration.ofMinutes(minutes)))
                .travelTimeFromPrevious(Duration.ZERO)
                .travelTimeToNext(Duration.ZERO)
                .confidenceScore(0.9)
                .build();
    }

    public static ScheduleSnapshot snapshot(List<Job> jobs, List<Technician> technicians, List<Assignment> assignments) {
        return ScheduleSnapshot.builder()
                .tenantId(TENANT)
                .version(3)
                .runId("run-committed")
                .horizon(window("06:00", "22:00"))
                .constraints(defaultConstraints())
                .jobs(jobs)
                .technicians(technicians)
                .assignments(assignments)
                .committedAt(at("07:00"))
                .build();
    }
}
