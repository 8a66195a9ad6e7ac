package com.fieldops.scheduling.engine;

import com.fieldops.scheduling.constraint.ConstraintValidator;
import com.fieldops.scheduling.domain.Assignment;
import com.fieldops.scheduling.domain.ConstraintSet;
import com.fieldops.scheduling.domain.GeoPoint;
import com.fieldops.scheduling.domain.Job;
import com.fieldops.scheduling.domain.NormalizedConstraints;
import com.fieldops.scheduling.domain.OptimizationMetrics;
import com.fieldops.scheduling.domain.OptimizationOptions.Algorithm;
import com.fieldops.scheduling.domain.Technician;
import com.fieldops.scheduling.domain.UnscheduledJob;
import com.fieldops.scheduling.domain.UnscheduledReason;
import com.fieldops.scheduling.support.FixedTravelTimes;
import com.fieldops.scheduling.travel.TravelTimeProvider;
import com.fieldops.scheduling.travel.TravelTimeProviderException;
import com.fieldops.scheduling.travel.TravelLeg;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.fieldops.scheduling.support.SchedulingFixtures.at;
import static com.fieldops.scheduling.support.SchedulingFixtures.defaultConstraints;
import static com.fieldops.scheduling.support.SchedulingFixtures.job;
import static com.fieldops.scheduling.support.SchedulingFixtures.problemBuilder;
import static com.fieldops.scheduling.support.SchedulingFixtures.technician;
import static com.fieldops.scheduling.support.SchedulingFixtures.window;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * End-to-end engine runs: problem building, greedy insertion, local search and assembly.
 */
class OptimizerEngineTest {

    private static final GeoPoint HOME = GeoPoint.of(40.70, -74.00);
    private static final GeoPoint SITE_A = GeoPoint.of(40.72, -74.00);
    private static final GeoPoint SITE_B = GeoPoint.of(40.70, -73.97);

    private final OptimizerEngine engine = new OptimizerEngine();
    private final ScheduleAssembler assembler = new ScheduleAssembler();
    private final ScheduleValidator validator = new ScheduleValidator();

    private record Run(ProblemInstance problem, EngineResult result, List<Assignment> assignments) {
    }

    private Run run(TravelTimeProvider travel, List<Job> jobs, List<Technician> technicians,
                    NormalizedConstraints constraints, Algorithm algorithm, CancellationToken token) {
        ProblemInstance problem = problemBuilder(travel).build(ProblemSpec.builder()
                .jobs(jobs)
                .technicians(technicians)
                .horizon(window("08:00", "18:00"))
                .constraints(constraints)
                .build());
        EngineResult result = engine.solve(problem, algorithm, SearchLimits.of(500, Duration.ofSeconds(10)), token);
        return new Run(problem, result, assembler.assemble(problem, result.solution()));
    }

    private Run run(TravelTimeProvider travel, List<Job> jobs, List<Technician> technicians) {
        return run(travel, jobs, technicians, defaultConstraints(), Algorithm.INTELLIGENT, CancellationToken.none());
    }

    @Test
    @DisplayName("Two jobs that cannot share a route: the first is placed after travel, the second has no candidate")
    void singleTechnicianCannotReachSecondJobInWindow() {
        FixedTravelTimes travel = new FixedTravelTimes()
                .between(HOME, SITE_A, 10)
                .between(HOME, SITE_B, 10)
                .between(SITE_A, SITE_B, 30);
        List<Job> jobs = List.of(
                job("job-a", SITE_A, window("09:00", "10:20"), 60),
                job("job-b", SITE_B, window("09:00", "10:20"), 60));
        List<Technician> technicians = List.of(technician("tech-1", HOME, window("09:00", "17:00")));

        Run run = run(travel, jobs, technicians);

        assertThat(run.assignments()).hasSize(1);
        Assignment placed = run.assignments().get(0);
        assertThat(placed.getJobId()).isEqualTo("job-a");
        assertThat(placed.getTechnicianId()).isEqualTo("tech-1");
        assertThat(placed.getScheduledStart()).isEqualTo(at("09:10"));
        assertThat(placed.getScheduledEnd()).isEqualTo(at("10:10"));
        assertThat(placed.getTravelTimeFromPrevious()).isEqualTo(Duration.ofMinutes(10));

        assertThat(run.result().unscheduled())
                .extracting(UnscheduledJob::getJobId, UnscheduledJob::getReason)
                .containsExactly(tuple("job-b", UnscheduledReason.NO_CANDIDATE));
    }

    @Test
    @DisplayName("A zero job cap leaves every job unscheduled with NO_CANDIDATE")
    void zeroJobCapSchedulesNothing() {
        NormalizedConstraints noCapacity = new ConstraintValidator().validate(
                ConstraintSet.builder().maxJobsPerTechnician(0).build());
        List<Job> jobs = List.of(
                job("job-1", SITE_A, window("09:00", "12:00"), 30),
                job("job-2", SITE_B, window("09:00", "12:00"), 30));

        Run run = run(new FixedTravelTimes(), jobs, List.of(technician("tech-1", HOME, window("08:00", "17:00"))),
                noCapacity, Algorithm.INTELLIGENT, CancellationToken.none());

        assertThat(run.assignments()).isEmpty();
        assertThat(run.result().unscheduled())
                .extracting(UnscheduledJob::getReason)
                .containsOnly(UnscheduledReason.NO_CANDIDATE);
        assertThat(run.result().unscheduled()).hasSize(2);
    }

    @Test
    @DisplayName("Jobs go only to technicians holding every required skill")
    void requiredSkillsAreHonoured() {
        List<Job> jobs = List.of(
                job("job-hvac", SITE_A, window("09:00", "12:00"), 45, "hvac"),
                job("job-elec", SITE_B, window("09:00", "12:00"), 45, "electrical", "permit"));
        List<Technician> technicians = List.of(
                technician("tech-plumber", HOME, window("08:00", "17:00"), "plumbing"),
                technician("tech-hvac", HOME, window("08:00", "17:00"), "hvac", "electrical"));

        Run run = run(new FixedTravelTimes(), jobs, technicians);

        assertThat(run.assignments()).singleElement().satisfies(a -> {
            assertThat(a.getJobId()).isEqualTo("job-hvac");
            assertThat(a.getTechnicianId()).isEqualTo("tech-hvac");
        });
        assertThat(run.result().unscheduled()).singleElement().satisfies(u -> {
            assertThat(u.getJobId()).isEqualTo("job-elec");
            assertThat(u.getReason()).isEqualTo(UnscheduledReason.NO_CANDIDATE);
        });
    }

    @Test
    @DisplayName("A job reachable only over a leg above maxTravelTime is reported as TRAVEL_TIME_EXCEEDED")
    void legLimitIsReported() {
        NormalizedConstraints shortLegs = new ConstraintValidator().validate(
                ConstraintSet.builder().maxTravelTime(Duration.ofMinutes(15)).build());
        FixedTravelTimes travel = new FixedTravelTimes().between(HOME, SITE_A, 40);

        Run run = run(travel, List.of(job("job-far", SITE_A, window("09:00", "16:00"), 30)),
                List.of(technician("tech-1", HOME, window("08:00", "17:00"))),
                shortLegs, Algorithm.GREEDY, CancellationToken.none());

        assertThat(run.assignments()).isEmpty();
        assertThat(run.result().unscheduled()).singleElement()
                .extracting(UnscheduledJob::getReason)
                .isEqualTo(UnscheduledReason.TRAVEL_TIME_EXCEEDED);
    }

    @Test
    @DisplayName("Routes never overlap once travel is counted, and every job ends inside its window")
    void routesDoNotOverlap() {
        List<Job> jobs = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            GeoPoint site = GeoPoint.of(40.70 + 0.01 * (i % 4), -74.00 + 0.01 * (i / 4));
            jobs.add(job(String.format("job-%02d", i), site, window("08:00", "17:00"), 40 + 5 * (i % 3)));
        }
        List<Technician> technicians = List.of(
                technician("tech-1", HOME, window("08:00", "17:00")),
                technician("tech-2", SITE_B, window("08:00", "17:00")));

        Run run = run(new FixedTravelTimes(), jobs, technicians);

        assertThat(validator.validate(run.assignments(), jobs, technicians, defaultConstraints())).isEmpty();
        Map<String, List<Assignment>> routes = run.assignments().stream()
                .collect(Collectors.groupingBy(Assignment::getTechnicianId));
        routes.values().forEach(route -> {
            List<Assignment> ordered = route.stream().sorted(Comparator.comparing(Assignment::getScheduledStart)).toList();
            for (int k = 1; k < ordered.size(); k++) {
                Assignment previous = ordered.get(k - 1);
                Assignment next = ordered.get(k);
                assertThat(previous.getScheduledEnd().plus(next.getTravelTimeFromPrevious()))
                        .isBeforeOrEqualTo(next.getScheduledStart());
            }
        });
        assertThat(run.assignments()).allSatisfy(a ->
                assertThat(a.getScheduledEnd()).isBeforeOrEqualTo(at("17:00")));
        assertThat(run.assignments().size() + run.result().unscheduled().size()).isEqualTo(jobs.size());
    }

    @Test
    @DisplayName("Same input twice gives the same assignments")
    void optimizationIsDeterministic() {
        List<Job> jobs = List.of(
                job("job-1", SITE_A, window("08:00", "12:00"), 60),
                job("job-2", SITE_B, window("08:00", "12:00"), 60),
                job("job-3", HOME, window("10:00", "15:00"), 30),
                job("job-4", SITE_A, window("13:00", "16:00"), 45));
        List<Technician> technicians = List.of(
                technician("tech-1", HOME, window("08:00", "17:00")),
                technician("tech-2", SITE_B, window("08:00", "17:00")));

        Run first = run(new FixedTravelTimes(), jobs, technicians);
        Run second = run(new FixedTravelTimes(), jobs, technicians);

        assertThat(second.assignments()).isEqualTo(first.assignments());
        assertThat(second.result().unscheduled()).isEqualTo(first.result().unscheduled());
    }

    @Test
    @DisplayName("Local search never ends worse than greedy insertion")
    void localSearchDoesNotWorsenCost() {
        List<Job> jobs = List.of(
                job("job-1", SITE_A, window("08:00", "17:00"), 30),
                job("job-2", SITE_B, window("08:00", "17:00"), 30),
                job("job-3", SITE_A, window("08:00", "17:00"), 30),
                job("job-4", SITE_B, window("08:00", "17:00"), 30));
        List<Technician> technicians = List.of(
                technician("tech-1", SITE_A, window("08:00", "17:00")),
                technician("tech-2", SITE_B, window("08:00", "17:00")));

        Run greedy = run(new FixedTravelTimes(), jobs, technicians, defaultConstraints(), Algorithm.GREEDY,
                CancellationToken.none());
        Run intelligent = run(new FixedTravelTimes(), jobs, technicians);

        assertThat(greedy.result().iterations()).isZero();
        assertThat(intelligent.result().solution().cost())
                .isLessThanOrEqualTo(greedy.result().solution().cost() + InsertionHeuristic.EPSILON);
        assertThat(intelligent.assignments()).hasSameSizeAs(greedy.assignments());
    }

    @Test
    @DisplayName("A cancelled token stops local search before its first iteration")
    void cancellationStopsSearch() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        Run run = run(new FixedTravelTimes(),
                List.of(job("job-1", SITE_A, window("08:00", "17:00"), 30)),
                List.of(technician("tech-1", HOME, window("08:00", "17:00"))),
                defaultConstraints(), Algorithm.INTELLIGENT, token);

        assertThat(run.result().cancelled()).isTrue();
        assertThat(run.result().iterations()).isZero();
    }

    @Test
    @DisplayName("A cancelled token stops greedy insertion before any job is placed")
    void cancellationStopsInsertion() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        Run run = run(new FixedTravelTimes(),
                List.of(job("job-1", SITE_A, window("08:00", "17:00"), 30),
                        job("job-2", SITE_B, window("08:00", "17:00"), 30)),
                List.of(technician("tech-1", HOME, window("08:00", "17:00"))),
                defaultConstraints(), Algorithm.GREEDY, token);

        assertThat(run.result().cancelled()).isTrue();
        assertThat(run.assignments()).isEmpty();
        assertThat(run.result().unscheduled()).isEmpty();
    }

    @Test
    @DisplayName("A failing travel provider degrades the run to estimates but still schedules")
    void failingProviderDegradesRun() {
        TravelTimeProvider broken = new TravelTimeProvider() {
            @Override
            public List<Duration> travelTimes(List<TravelLeg> legs) {
                throw new TravelTimeProviderException("upstream 503");
            }

            @Override
            public String name() {
                return "broken";
            }
        };
        List<Job> jobs = List.of(job("job-1", SITE_A, window("08:00", "17:00"), 30));
        List<Technician> technicians = List.of(technician("tech-1", HOME, window("08:00", "17:00")));

        Run degraded = run(broken, jobs, technicians);
        Run healthy = run(new FixedTravelTimes(), jobs, technicians);

        assertThat(degraded.problem().isDegraded()).isTrue();
        assertThat(healthy.problem().isDegraded()).isFalse();
        assertThat(degraded.assignments()).hasSize(1);
        assertThat(degraded.assignments().get(0).getConfidenceScore())
                .isLessThan(healthy.assignments().get(0).getConfidenceScore());

        OptimizationMetrics metrics = assembler.metrics(degraded.problem(), degraded.result(), degraded.assignments(), null, 5);
        assertThat(metrics.isDegraded()).isTrue();
        assertThat(metrics.getSchedulingSuccessRate()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Metrics count scheduled jobs, travel and skill demand")
    void metricsSummariseTheRun() {
        FixedTravelTimes travel = new FixedTravelTimes().between(HOME, SITE_A, 20);
        List<Job> jobs = List.of(
                job("job-1", SITE_A, window("08:00", "17:00"), 60, "hvac"),
                job("job-2", SITE_A, window("08:00", "17:00"), 60));
        Run run = run(travel, jobs, List.of(technician("tech-1", HOME, window("08:00", "17:00"), "hvac")));

        OptimizationMetrics metrics = assembler.metrics(run.problem(), run.result(), run.assignments(), 40.0, 12);

        assertThat(metrics.getTotalJobs()).isEqualTo(2);
        assertThat(metrics.getScheduledJobs()).isEqualTo(2);
        assertThat(metrics.getTotalTravelMinutes()).isEqualTo(20.0);
        assertThat(metrics.getTravelSavingsPercent()).isEqualTo(50.0);
        assertThat(metrics.getTechniciansUsed()).isEqualTo(1);
        assertThat(metrics.getDemandBySkill()).containsEntry("hvac", 1).containsEntry("general", 1);
        assertThat(metrics.getAverageConfidence()).isBetween(0.0, 1.0);
    }
}
