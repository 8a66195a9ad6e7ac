package com.fieldops.scheduling.service;

import com.fieldops.scheduling.analytics.TechnicianPerformanceCache;
import com.fieldops.scheduling.config.SchedulingProperties;
import com.fieldops.scheduling.constraint.ConstraintValidator;
import com.fieldops.scheduling.constraint.FieldViolation;
import com.fieldops.scheduling.disruption.AdaptationOutcome;
import com.fieldops.scheduling.disruption.DisruptionHandler;
import com.fieldops.scheduling.domain.Assignment;
import com.fieldops.scheduling.domain.DisruptionEvent;
import com.fieldops.scheduling.domain.GeoPoint;
import com.fieldops.scheduling.domain.Job;
import com.fieldops.scheduling.domain.JobStatus;
import com.fieldops.scheduling.domain.NormalizedConstraints;
import com.fieldops.scheduling.domain.OptimizationMetrics;
import com.fieldops.scheduling.domain.OptimizationOptions;
import com.fieldops.scheduling.domain.OptimizationOptions.Algorithm;
import com.fieldops.scheduling.domain.OptimizationRun;
import com.fieldops.scheduling.domain.RunStatus;
import com.fieldops.scheduling.domain.RunType;
import com.fieldops.scheduling.domain.ScheduleSnapshot;
import com.fieldops.scheduling.domain.Technician;
import com.fieldops.scheduling.domain.TimeWindow;
import com.fieldops.scheduling.domain.UnscheduledJob;
import com.fieldops.scheduling.engine.CancellationToken;
import com.fieldops.scheduling.engine.EngineResult;
import com.fieldops.scheduling.engine.OptimizerEngine;
import com.fieldops.scheduling.engine.ProblemBuilder;
import com.fieldops.scheduling.engine.ProblemInstance;
import com.fieldops.scheduling.engine.ProblemSpec;
import com.fieldops.scheduling.engine.ScheduleAssembler;
import com.fieldops.scheduling.engine.ScheduleValidator;
import com.fieldops.scheduling.engine.SearchLimits;
import com.fieldops.scheduling.exception.ConstraintValidationException;
import com.fieldops.scheduling.exception.ScheduleBusyException;
import com.fieldops.scheduling.exception.SchedulingException;
import com.fieldops.scheduling.lease.TenantLease;
import com.fieldops.scheduling.lease.TenantLeaseManager;
import com.fieldops.scheduling.location.TechnicianLocationService;
import com.fieldops.scheduling.metrics.SchedulingMetrics;
import com.fieldops.scheduling.model.AdaptRequest;
import com.fieldops.scheduling.model.AdaptResponse;
import com.fieldops.scheduling.model.OptimizeRequest;
import com.fieldops.scheduling.model.OptimizeResponse;
import com.fieldops.scheduling.model.RunCancellation;
import com.fieldops.scheduling.notification.NotificationPublisher;
import com.fieldops.scheduling.notification.ScheduleEventPublisher;
import com.fieldops.scheduling.run.ActiveRunRegistry;
import com.fieldops.scheduling.store.CommittedScheduleStore;
import com.fieldops.scheduling.store.InputFingerprint;
import com.fieldops.scheduling.store.OptimizationRunStore;
import com.fieldops.shared.events.ScheduleCommittedEvent;
import com.fieldops.shared.events.ScheduleNotificationEvent;
import com.fieldops.shared.featureflag.FeatureFlagService;
import com.fieldops.shared.util.GeoUtil;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Core scheduling orchestrator.
 *
 * Optimize flow:
 *  1. Check kill switch and validate the request (all violations in one pass)
 *  2. Take the tenant lease without waiting; a held lease means 409 SCHEDULE_BUSY
 *  3. Record the run (QUEUED -> RUNNING) and register its cancellation token
 *  4. Build the problem (one travel-matrix batch), solve within the time budget, assemble
 *  5. Commit the new snapshot unless the run was cancelled, then publish schedule.committed
 *
 * Adapt flow:
 *  High-priority disruptions that find the lease held cancel the tenant's running optimization
 *  and wait up to {@code scheduling.lease.preemption-wait} for it. Everything else is rejected
 *  as busy straight away.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchedulingOrchestrator {

    static final int MAX_HISTORY_DAYS = 90;
    static final int MAX_HISTORY_LIMIT = 200;

    private final ConstraintValidator constraintValidator;
    private final TenantLeaseManager leaseManager;
    private final ActiveRunRegistry activeRuns;
    private final OptimizationRunStore runStore;
    private final CommittedScheduleStore scheduleStore;
    private final ProblemBuilder problemBuilder;
    private final OptimizerEngine engine;
    private final ScheduleAssembler assembler;
    private final ScheduleValidator scheduleValidator;
    private final DisruptionHandler disruptionHandler;
    private final TechnicianLocationService locationService;
    private final TechnicianPerformanceCache performanceCache;
    private final NotificationPublisher notificationPublisher;
    private final ScheduleEventPublisher eventPublisher;
    private final InputFingerprint fingerprint;
    private final FeatureFlagService featureFlagService;
    private final SchedulingMetrics metrics;
    private final SchedulingProperties properties;
    private final Clock clock;

    // --- optimize ---

    public OptimizeResponse optimize(String tenantId, OptimizeRequest request) {
        checkKillSwitch(tenantId);
        NormalizedConstraints constraints = validate(request);
        OptimizationOptions options = request.getOptions() != null ? request.getOptions() : OptimizationOptions.defaults();

        TenantLease lease = leaseManager.tryAcquire(tenantId, Duration.ZERO).orElseThrow(() -> busy(tenantId));
        try (lease) {
            OptimizationRun run = runStore.create(tenantId, RunType.OPTIMIZATION,
                    fingerprint.of(request.getJobs(), request.getTechnicians(), request.getTimeWindow(), constraints, options),
                    OptimizerEngine.ALGORITHM_VERSION);
            runStore.markRunning(run.getId());
            CancellationToken token = activeRuns.register(tenantId, run.getId());
            Timer.Sample sample = Timer.start();
            try {
                return execute(tenantId, run.getId(), request, constraints, options, token);
            } catch (RuntimeException e) {
                log.error("Optimization run {} for tenant {} failed: {}", run.getId(), tenantId, e.getMessage(), e);
                runStore.fail(run.getId(), e.getMessage());
                metrics.recordRun(RunStatus.FAILED);
                throw e;
            } finally {
                activeRuns.unregister(run.getId());
                sample.stop(metrics.getOptimizationLatencyTimer());
            }
        }
    }

    private OptimizeResponse execute(String tenantId, String runId, OptimizeRequest request,
                                     NormalizedConstraints constraints, OptimizationOptions options,
                                     CancellationToken token) {
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        long baseVersion = scheduleStore.currentVersion(tenantId);

        Duration budget = options.getTimeBudget() != null
                ? options.getTimeBudget()
                : properties.getOptimizer().getTimeBudget();
        int maxIterations = options.getMaxIterations() != null
                ? options.getMaxIterations()
                : properties.getOptimizer().getMaxIterations();
        Algorithm algorithm = options.getAlgorithm();
        if (algorithm == Algorithm.INTELLIGENT
                && !featureFlagService.isEnabled(tenantId, FeatureFlagService.LOCAL_SEARCH_ENABLED, true)) {
            log.info("Local search disabled by feature flag for tenant {}, run {} uses greedy insertion only",
                    tenantId, runId);
            algorithm = Algorithm.GREEDY;
        }

        Map<String, GeoPoint> starts = locationService.startLocations(tenantId, request.getTechnicians(), startedAt);
        ProblemInstance problem = problemBuilder.build(ProblemSpec.builder()
                .jobs(request.getJobs())
                .technicians(request.getTechnicians())
                .horizon(request.getTimeWindow())
                .constraints(constraints)
                .startLocations(starts)
                .onTimeRates(performanceCache.onTimeRates(tenantId))
                .overtimeAllowance(properties.getOptimizer().getOvertimeAllowance())
                .build());

        Duration spent = Duration.ofNanos(System.nanoTime() - startNanos);
        Duration searchBudget = budget.minus(properties.getOptimizer().getCommitReserve()).minus(spent);
        SearchLimits limits = SearchLimits.of(maxIterations, searchBudget.isNegative() ? Duration.ZERO : searchBudget);
        EngineResult result = engine.solve(problem, algorithm, limits, token);

        List<Assignment> assignments = assembler.assemble(problem, result.solution());
        long elapsed = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        OptimizationMetrics runMetrics = assembler.metrics(problem, result, assignments,
                options.getBaselineTotalTravelMinutes(), elapsed);

        if (result.cancelled() || token.isCancellationRequested()) {
            runStore.cancel(runId, runMetrics);
            metrics.recordRun(RunStatus.CANCELLED);
            log.info("Optimization run {} for tenant {} cancelled after {} iteration(s); schedule v{} kept",
                    runId, tenantId, result.iterations(), baseVersion);
            return OptimizeResponse.builder()
                    .runId(runId)
                    .status(RunStatus.CANCELLED)
                    .assignments(List.of())
                    .metrics(runMetrics)
                    .warnings(result.unscheduled())
                    .degraded(problem.isDegraded())
                    .timedOut(result.timedOut())
                    .snapshotVersion(baseVersion)
                    .build();
        }

        List<String> violations = scheduleValidator.validate(assignments, request.getJobs(),
                request.getTechnicians(), constraints);
        if (!violations.isEmpty()) {
            throw new SchedulingException(SchedulingException.INVALID_STATE,
                    "Optimized schedule violates invariants: " + violations);
        }

        Set<String> assigned = assignments.stream().map(Assignment::getJobId).collect(Collectors.toSet());
        ScheduleSnapshot committed = scheduleStore.commit(ScheduleSnapshot.builder()
                .tenantId(tenantId)
                .runId(runId)
                .horizon(request.getTimeWindow())
                .constraints(constraints)
                .jobs(request.getJobs().stream()
                        .map(j -> j.toBuilder()
                                .status(assigned.contains(j.getId()) ? JobStatus.SCHEDULED : JobStatus.UNSCHEDULED)
                                .build())
                        .toList())
                .technicians(request.getTechnicians())
                .assignments(assignments)
                .unscheduled(result.unscheduled())
                .degraded(problem.isDegraded())
                .build(), baseVersion);

        runStore.complete(runId, assignments, result.unscheduled(), runMetrics);
        metrics.recordRun(RunStatus.COMPLETED);
        metrics.recordUnscheduledJobs(result.unscheduled().size());
        if (problem.isDegraded()) {
            metrics.recordDegradedRun();
        }

        eventPublisher.committed(ScheduleCommittedEvent.builder()
                .tenantId(tenantId)
                .runId(runId)
                .snapshotVersion(committed.getVersion())
                .scheduledJobs(assignments.size())
                .unscheduledJobs(result.unscheduled().size())
                .degraded(problem.isDegraded())
                .timedOut(result.timedOut())
                .committedAt(committed.getCommittedAt())
                .build());
        if (options.isNotifyTechnicians()) {
            notifyTechnicians(tenantId, assignments);
        }

        log.info("Optimization run {} for tenant {}: {}/{} job(s) scheduled, cost {} -> {}, {} iteration(s), "
                        + "{} ms, degraded={}, timedOut={}", runId, tenantId, assignments.size(), problem.jobCount(),
                runMetrics.getInitialCost(), runMetrics.getFinalCost(), result.iterations(), elapsed,
                problem.isDegraded(), result.timedOut());

        return OptimizeResponse.builder()
                .runId(runId)
                .status(RunStatus.COMPLETED)
                .assignments(assignments)
                .metrics(runMetrics)
                .warnings(result.unscheduled())
                .degraded(problem.isDegraded())
                .timedOut(result.timedOut())
                .snapshotVersion(committed.getVersion())
                .build();
    }

    private void notifyTechnicians(String tenantId, List<Assignment> assignments) {
        Instant now = clock.instant();
        for (Assignment a : assignments) {
            notificationPublisher.publish(ScheduleNotificationEvent.builder()
                    .tenantId(tenantId)
                    .recipientType(ScheduleNotificationEvent.RecipientType.TECHNICIAN)
                    .recipientId(a.getTechnicianId())
                    .jobId(a.getJobId())
                    .title("Job scheduled")
                    .body("Job " + a.getJobId() + " starts at " + a.getScheduledStart())
                    .scheduledStart(a.getScheduledStart())
                    .createdAt(now)
                    .build());
        }
    }

    // --- adapt ---

    public AdaptResponse adapt(String tenantId, AdaptRequest request) {
        checkKillSwitch(tenantId);
        DisruptionEvent event = request.getDisruption();

        Optional<TenantLease> lease = leaseManager.tryAcquire(tenantId, Duration.ZERO);
        if (lease.isEmpty() && event != null && event.isHighPriority()) {
            activeRuns.cancelTenant(tenantId).ifPresent(runId ->
                    log.warn("{} disruption preempts optimization run {} of tenant {}",
                            event.getType(), runId, tenantId));
            lease = leaseManager.tryAcquire(tenantId, properties.getLease().getPreemptionWait());
        }
        if (lease.isEmpty()) {
            throw busy(tenantId);
        }

        try (TenantLease held = lease.get()) {
            AdaptationOutcome outcome = disruptionHandler.handle(tenantId, event, request.getPreferences());
            return AdaptResponse.from(outcome);
        }
    }

    // --- runs and schedule ---

    public RunCancellation cancelRun(String tenantId, String runId) {
        OptimizationRun run = getRun(tenantId, runId);
        if (activeRuns.cancel(tenantId, runId)) {
            return new RunCancellation(runId, true);
        }
        if (run.getStatus() == RunStatus.QUEUED || run.getStatus() == RunStatus.RUNNING) {
            throw new SchedulingException(SchedulingException.INVALID_STATE,
                    "Run " + runId + " is not executing on this instance");
        }
        throw new SchedulingException(SchedulingException.INVALID_STATE,
                "Run " + runId + " already finished as " + run.getStatus());
    }

    public OptimizationRun getRun(String tenantId, String runId) {
        return runStore.find(tenantId, runId)
                .orElseThrow(() -> new SchedulingException(SchedulingException.RUN_NOT_FOUND, "Run not found: " + runId));
    }

    public List<OptimizationRun> history(String tenantId, int days, int limit) {
        if (days < 1 || days > MAX_HISTORY_DAYS || limit < 1 || limit > MAX_HISTORY_LIMIT) {
            throw new SchedulingException(SchedulingException.INVALID_REQUEST,
                    "days must be 1.." + MAX_HISTORY_DAYS + " and limit 1.." + MAX_HISTORY_LIMIT);
        }
        return runStore.history(tenantId, days, limit);
    }

    public ScheduleSnapshot currentSchedule(String tenantId) {
        ScheduleSnapshot snapshot = scheduleStore.load(tenantId);
        if (snapshot.isEmpty()) {
            throw new SchedulingException(SchedulingException.NO_COMMITTED_SCHEDULE,
                    "Tenant " + tenantId + " has no committed schedule");
        }
        return snapshot;
    }

    // --- helpers ---

    private void checkKillSwitch(String tenantId) {
        if (featureFlagService.isEnabled(tenantId, FeatureFlagService.SCHEDULING_KILL_SWITCH, false)) {
            metrics.recordKillSwitchRejection();
            throw new SchedulingException(SchedulingException.SERVICE_UNAVAILABLE,
                    "Scheduling is temporarily disabled. Please try again shortly.");
        }
    }

    private ScheduleBusyException busy(String tenantId) {
        metrics.recordBusyRejection();
        log.warn("Rejected schedule mutation for tenant {}: lease is held", tenantId);
        return new ScheduleBusyException(tenantId);
    }

    /**
     * Runs the constraint and payload checks together so one rejection lists every violated field.
     */
    private NormalizedConstraints validate(OptimizeRequest request) {
        List<FieldViolation> violations = new ArrayList<>();
        NormalizedConstraints constraints = null;
        try {
            constraints = constraintValidator.validate(request.getConstraints());
        } catch (ConstraintValidationException e) {
            violations.addAll(e.getViolations());
        }
        violations.addAll(validateInput(request));
        if (!violations.isEmpty()) {
            throw new ConstraintValidationException(violations);
        }
        return constraints;
    }

    private List<FieldViolation> validateInput(OptimizeRequest request) {
        List<FieldViolation> violations = new ArrayList<>();
        TimeWindow horizon = request.getTimeWindow();
        if (horizon == null || horizon.getStart() == null || horizon.getEnd() == null) {
            violations.add(new FieldViolation("timeWindow", "start and end are required"));
        } else if (!horizon.getEnd().isAfter(horizon.getStart())) {
            violations.add(new FieldViolation("timeWindow", "end must be after start"));
        }

        List<Job> jobs = request.getJobs() != null ? request.getJobs() : List.of();
        Set<String> jobIds = new HashSet<>();
        for (int i = 0; i < jobs.size(); i++) {
            Job job = jobs.get(i);
            String field = "jobs[" + i + "]";
            if (job == null || job.getId() == null || job.getId().isBlank()) {
                violations.add(new FieldViolation(field + ".id", "is required"));
                continue;
            }
            if (!jobIds.add(job.getId())) {
                violations.add(new FieldViolation(field + ".id", "duplicate job id " + job.getId()));
            }
            if (job.getEstimatedDuration() == null || job.getEstimatedDuration().isZero()
                    || job.getEstimatedDuration().isNegative()) {
                violations.add(new FieldViolation(field + ".estimatedDuration", "must be positive"));
            }
            if (!isValid(job.getLocation())) {
                violations.add(new FieldViolation(field + ".location", "must be a valid coordinate"));
            }
            if (job.getWindow() != null && (job.getWindow().getStart() == null || job.getWindow().getEnd() == null
                    || !job.getWindow().getEnd().isAfter(job.getWindow().getStart()))) {
                violations.add(new FieldViolation(field + ".window", "end must be after start"));
            }
        }

        List<Technician> technicians = request.getTechnicians() != null ? request.getTechnicians() : List.of();
        if (technicians.isEmpty()) {
            violations.add(new FieldViolation("technicians", "must contain at least one technician"));
        }
        Set<String> technicianIds = new HashSet<>();
        for (int i = 0; i < technicians.size(); i++) {
            Technician technician = technicians.get(i);
            String field = "technicians[" + i + "]";
            if (technician == null || technician.getId() == null || technician.getId().isBlank()) {
                violations.add(new FieldViolation(field + ".id", "is required"));
                continue;
            }
            if (!technicianIds.add(technician.getId())) {
                violations.add(new FieldViolation(field + ".id", "duplicate technician id " + technician.getId()));
            }
            if (!isValid(technician.getHomeLocation())) {
                violations.add(new FieldViolation(field + ".homeLocation", "must be a valid coordinate"));
            }
            if (technician.getMaxJobsPerDay() < 0) {
                violations.add(new FieldViolation(field + ".maxJobsPerDay", "must not be negative"));
            }
        }
        return violations;
    }

    private static boolean isValid(GeoPoint point) {
        return point != null && GeoUtil.isValidCoordinate(point.getLatitude(), point.getLongitude());
    }
}
