package com.fieldops.scheduling.disruption;

import com.fieldops.scheduling.analytics.TechnicianPerformanceCache;
import com.fieldops.scheduling.constraint.ConstraintValidator;
import com.fieldops.scheduling.domain.AdaptationPreferences;
import com.fieldops.scheduling.domain.AdaptedJob;
import com.fieldops.scheduling.domain.Assignment;
import com.fieldops.scheduling.domain.DisruptionEvent;
import com.fieldops.scheduling.domain.DisruptionType;
import com.fieldops.scheduling.domain.GeoPoint;
import com.fieldops.scheduling.domain.ImpactSummary;
import com.fieldops.scheduling.domain.Job;
import com.fieldops.scheduling.domain.JobStatus;
import com.fieldops.scheduling.domain.OptimizationMetrics;
import com.fieldops.scheduling.domain.OptimizationRun;
import com.fieldops.scheduling.domain.RunType;
import com.fieldops.scheduling.domain.ScheduleSlot;
import com.fieldops.scheduling.domain.ScheduleSnapshot;
import com.fieldops.scheduling.domain.Technician;
import com.fieldops.scheduling.domain.UnscheduledJob;
import com.fieldops.scheduling.engine.OptimizerEngine;
import com.fieldops.scheduling.engine.ScheduleValidator;
import com.fieldops.scheduling.exception.SchedulingException;
import com.fieldops.scheduling.location.TechnicianLocationService;
import com.fieldops.scheduling.metrics.SchedulingMetrics;
import com.fieldops.scheduling.notification.NotificationPublisher;
import com.fieldops.scheduling.notification.ScheduleEventPublisher;
import com.fieldops.scheduling.scoring.ImpactScorer;
import com.fieldops.scheduling.store.CommittedScheduleStore;
import com.fieldops.scheduling.store.InputFingerprint;
import com.fieldops.scheduling.store.OptimizationRunStore;
import com.fieldops.scheduling.weather.WeatherSignalService;
import com.fieldops.shared.events.ScheduleAdaptedEvent;
import com.fieldops.shared.events.ScheduleNotificationEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

/**
 * Drives one disruption through RECEIVED -> SCOPED -> REOPTIMIZED -> APPLIED -> NOTIFIED.
 *
 * The caller holds the tenant lease. A rejection at any stage leaves the committed schedule
 * untouched and comes back with recommendations from dry runs of relaxed preferences.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DisruptionHandler {

    static final String REASON_NEIGHBOUR = "route_neighbour";

    private final CommittedScheduleStore scheduleStore;
    private final OptimizationRunStore runStore;
    private final ConstraintValidator constraintValidator;
    private final DisruptionScoper scoper;
    private final ScheduleRepairer repairer;
    private final ScheduleValidator scheduleValidator;
    private final RecommendationAdvisor advisor;
    private final WeatherSignalService weatherSignalService;
    private final TechnicianLocationService locationService;
    private final TechnicianPerformanceCache performanceCache;
    private final NotificationPublisher notificationPublisher;
    private final ScheduleEventPublisher eventPublisher;
    private final InputFingerprint fingerprint;
    private final SchedulingMetrics metrics;
    private final Clock clock;

    private record Attempt(DisruptionScope scope, RepairResult result) {
    }

    public AdaptationOutcome handle(String tenantId, DisruptionEvent event, AdaptationPreferences requested) {
        AdaptationPreferences preferences = constraintValidator.validate(requested);
        if (event == null || event.getType() == null) {
            throw new SchedulingException(SchedulingException.INVALID_REQUEST, "Disruption type is required");
        }
        ScheduleSnapshot snapshot = scheduleStore.load(tenantId);
        if (snapshot.isEmpty()) {
            throw new SchedulingException(SchedulingException.NO_COMMITTED_SCHEDULE,
                    "Tenant " + tenantId + " has no committed schedule to adapt");
        }

        String adaptationId = UUID.randomUUID().toString();
        String disruptionId = event.getId() != null ? event.getId() : adaptationId;
        DisruptionEvent disruption = event.toBuilder().id(disruptionId).build();
        List<DisruptionState> history = new ArrayList<>(List.of(DisruptionState.RECEIVED));

        OptimizationRun run = runStore.create(tenantId, RunType.ADAPTATION,
                fingerprint.of(disruption, preferences, snapshot.getVersion()), OptimizerEngine.ALGORITHM_VERSION);
        runStore.markRunning(run.getId());
        log.info("Adapting schedule v{} of tenant {} to {} disruption {} (severity {})", snapshot.getVersion(),
                tenantId, disruption.getType(), disruptionId, disruption.getSeverity());

        try {
            Instant now = clock.instant();
            Duration weather = weatherAdjustment(tenantId, snapshot, disruption, now);
            Map<String, GeoPoint> starts = locationService.startLocations(tenantId, snapshot.getTechnicians(), now);
            Map<String, Double> onTimeRates = performanceCache.onTimeRates(tenantId);
            Function<AdaptationPreferences, Attempt> attempt =
                    p -> attempt(snapshot, disruption, p, now, weather, starts, onTimeRates);

            DisruptionScope scope = scoper.scope(snapshot, disruption, preferences, now, weather);
            history.add(DisruptionState.SCOPED);
            if (scope.isRejected()) {
                return reject(run, adaptationId, disruption, snapshot, preferences, history, scope.getAffectedJobIds(),
                        scope.getRejectionReason(), attempt);
            }

            Attempt outcome = repairWithWidening(snapshot, scope, preferences, now, starts, onTimeRates);
            history.add(DisruptionState.REOPTIMIZED);
            RepairResult result = outcome.result();
            if (!result.isSuccess()) {
                List<String> failed = result.getFailures().stream().map(UnscheduledJob::getJobId).toList();
                return reject(run, adaptationId, disruption, snapshot, preferences, history, failed,
                        "Could not re-place job(s) " + failed + " within the adaptation preferences", attempt);
            }

            List<String> violations = validate(snapshot, outcome.scope(), result, preferences);
            if (!violations.isEmpty()) {
                log.warn("Adaptation {} of tenant {} failed validation: {}", adaptationId, tenantId, violations);
                return reject(run, adaptationId, disruption, snapshot, preferences, history,
                        List.copyOf(result.getTouchedJobIds()), String.join("; ", violations), attempt);
            }

            List<AdaptedJob> adaptedJobs = adaptedJobs(snapshot, outcome.scope(), result, preferences);
            ScheduleSnapshot committed = scheduleStore.commit(nextSnapshot(snapshot, outcome.scope(), result, run.getId()),
                    snapshot.getVersion());
            history.add(DisruptionState.APPLIED);

            int notificationsSent = notify(tenantId, committed, adaptedJobs, preferences);
            history.add(DisruptionState.NOTIFIED);

            ImpactSummary impact = impactSummary(snapshot, result, adaptedJobs, notificationsSent);
            runStore.complete(run.getId(), changedAssignments(result), List.of(), OptimizationMetrics.builder()
                    .totalJobs(committed.getJobs().size())
                    .scheduledJobs(committed.getAssignments().size())
                    .iterations(result.getIterations())
                    .degraded(result.isDegraded())
                    .averageImpactScore(impact.getAverageImpactScore())
                    .elapsedMillis(Duration.between(now, clock.instant()).toMillis())
                    .build());
            metrics.recordAdaptation(DisruptionState.NOTIFIED);
            List<String> affected = affectedJobIds(outcome.scope(), result);
            publish(tenantId, adaptationId, disruption, DisruptionState.NOTIFIED, affected,
                    impact.getReassignmentCount(), committed.getVersion());

            log.info("Adaptation {} of tenant {} applied: {} job(s) rescheduled, {} reassigned, schedule v{}",
                    adaptationId, tenantId, impact.getJobsRescheduled(), impact.getReassignmentCount(),
                    committed.getVersion());
            return AdaptationOutcome.builder()
                    .adaptationId(adaptationId)
                    .disruptionId(disruptionId)
                    .runId(run.getId())
                    .state(DisruptionState.NOTIFIED)
                    .stateHistory(List.copyOf(history))
                    .affectedJobIds(affected)
                    .adaptedJobs(adaptedJobs)
                    .impactSummary(impact)
                    .snapshotVersion(committed.getVersion())
                    .build();
        } catch (RuntimeException e) {
            log.error("Adaptation {} of tenant {} failed: {}", adaptationId, tenantId, e.getMessage(), e);
            runStore.fail(run.getId(), e.getMessage());
            throw e;
        }
    }

    private Attempt attempt(ScheduleSnapshot snapshot, DisruptionEvent event, AdaptationPreferences preferences,
                            Instant now, Duration weather, Map<String, GeoPoint> starts, Map<String, Double> rates) {
        DisruptionScope scope = scoper.scope(snapshot, event, preferences, now, weather);
        if (scope.isRejected()) {
            return new Attempt(scope, RepairResult.builder().success(false).build());
        }
        return repairWithWidening(snapshot, scope, preferences, now, starts, rates);
    }

    /**
     * Repairs the scope as is; an emergency job that fits nowhere is retried on each capable
     * technician in id order with that technician's open jobs made movable around it.
     */
    private Attempt repairWithWidening(ScheduleSnapshot snapshot, DisruptionScope scope, AdaptationPreferences preferences,
                                       Instant now, Map<String, GeoPoint> starts, Map<String, Double> rates) {
        RepairResult result = repairer.repair(snapshot, scope, preferences, starts, rates);
        if (result.isSuccess() || scope.getEmergencyJob() == null) {
            return new Attempt(scope, result);
        }
        Job emergency = scope.getEmergencyJob();
        boolean skillsRequired = snapshot.getConstraints().isSkillMatchRequired();
        List<Technician> technicians = snapshot.getTechnicians().stream()
                .sorted(Comparator.comparing(Technician::getId))
                .filter(t -> !skillsRequired || t.getSkills().containsAll(emergency.getRequiredSkills()))
                .toList();
        for (Technician technician : technicians) {
            DisruptionScope widened = scoper.widenAround(snapshot, scope, technician.getId(), preferences, now);
            RepairResult retry = repairer.repair(snapshot, widened, preferences, starts, rates);
            if (retry.isSuccess()) {
                log.debug("Emergency job {} placed after widening around technician {}", emergency.getId(),
                        technician.getId());
                return new Attempt(widened, retry);
            }
        }
        return new Attempt(scope, result);
    }

    private Duration weatherAdjustment(String tenantId, ScheduleSnapshot snapshot, DisruptionEvent event, Instant now) {
        if (event.getType() != DisruptionType.WEATHER) {
            return Duration.ZERO;
        }
        GeoPoint location = event.getLocation();
        if (location == null) {
            location = event.getAffectedJobIds().stream()
                    .map(snapshot::job)
                    .flatMap(Optional::stream)
                    .map(Job::getLocation)
                    .findFirst()
                    .orElse(null);
        }
        return weatherSignalService.impactAt(tenantId, location, now).getScheduleAdjustment();
    }

    List<String> validate(ScheduleSnapshot snapshot, DisruptionScope scope, RepairResult result,
                          AdaptationPreferences preferences) {
        List<Job> jobs = new ArrayList<>(snapshot.getJobs());
        if (scope.getEmergencyJob() != null) {
            jobs.add(scope.getEmergencyJob());
        }
        List<String> violations = new ArrayList<>(scheduleValidator.validate(result.getAssignments(), jobs,
                snapshot.getTechnicians(), snapshot.getConstraints()));

        for (Assignment after : result.getAssignments()) {
            Assignment before = snapshot.assignmentFor(after.getJobId()).orElse(null);
            if (before == null || before.getScheduledStart().equals(after.getScheduledStart())) {
                continue;
            }
            Duration shift = Duration.between(before.getScheduledStart(), after.getScheduledStart());
            Duration minimum = scope.getDelays().getOrDefault(after.getJobId(), Duration.ZERO);
            if (shift.compareTo(minimum) < 0) {
                violations.add("job " + after.getJobId() + " would start before its earliest allowed time");
            }
            if (shift.compareTo(preferences.getMaxScheduleDelay()) > 0) {
                violations.add("job " + after.getJobId() + " would be delayed by " + shift.toMinutes()
                        + " minutes, more than " + preferences.getMaxScheduleDelay().toMinutes());
            }
        }

        int reassigned = result.reassignmentCount(snapshot.getAssignments());
        if (reassigned > preferences.getMaxReassignments()) {
            violations.add(reassigned + " reassignment(s) exceed maxReassignments "
                    + preferences.getMaxReassignments());
        }
        return violations;
    }

    /**
     * Scoped jobs in scoping order, then every other stop the repair rebuilt or resequenced. Any
     * committed assignment not listed here is carried over unchanged.
     */
    static List<String> affectedJobIds(DisruptionScope scope, RepairResult result) {
        Set<String> affected = new LinkedHashSet<>(scope.getAffectedJobIds());
        affected.addAll(result.getTouchedJobIds());
        return List.copyOf(affected);
    }

    private List<AdaptedJob> adaptedJobs(ScheduleSnapshot snapshot, DisruptionScope scope, RepairResult result,
                                         AdaptationPreferences preferences) {
        Map<String, Assignment> after = new HashMap<>();
        result.getAssignments().forEach(a -> after.put(a.getJobId(), a));

        Set<String> ordered = new LinkedHashSet<>(scope.getAffectedJobIds());
        ordered.retainAll(result.getTouchedJobIds());
        ordered.addAll(result.getTouchedJobIds());
        double costShare = ordered.isEmpty() ? 0.0 : result.getCostDelta() / ordered.size();

        List<AdaptedJob> adapted = new ArrayList<>();
        for (String jobId : ordered) {
            Assignment now = after.get(jobId);
            if (now == null) {
                continue;
            }
            Assignment before = snapshot.assignmentFor(jobId).orElse(null);
            Duration shift = before != null
                    ? Duration.between(before.getScheduledStart(), now.getScheduledStart())
                    : Duration.ZERO;
            boolean reassigned = before != null && !before.getTechnicianId().equals(now.getTechnicianId());
            adapted.add(AdaptedJob.builder()
                    .jobId(jobId)
                    .originalSlot(before != null ? ScheduleSlot.of(before) : null)
                    .newSlot(ScheduleSlot.of(now))
                    .reason(scope.getReasons().getOrDefault(jobId, REASON_NEIGHBOUR))
                    .impactScore(ImpactScorer.score(shift, reassigned, costShare, preferences.getMaxScheduleDelay()))
                    .reassigned(reassigned)
                    .delayMinutes(Math.max(0, shift.toMinutes()))
                    .build());
        }
        return adapted;
    }

    private ScheduleSnapshot nextSnapshot(ScheduleSnapshot snapshot, DisruptionScope scope, RepairResult result,
                                          String runId) {
        List<Job> jobs = new ArrayList<>(snapshot.getJobs());
        if (scope.getEmergencyJob() != null) {
            jobs.add(scope.getEmergencyJob().toBuilder().status(JobStatus.SCHEDULED).build());
        }
        return snapshot.toBuilder()
                .runId(runId)
                .jobs(jobs)
                .assignments(result.getAssignments())
                .degraded(result.isDegraded())
                .build();
    }

    private int notify(String tenantId, ScheduleSnapshot committed, List<AdaptedJob> adaptedJobs,
                       AdaptationPreferences preferences) {
        Instant createdAt = clock.instant();
        int sent = 0;
        for (AdaptedJob adapted : adaptedJobs) {
            ScheduleSlot before = adapted.getOriginalSlot();
            ScheduleSlot after = adapted.getNewSlot();
            if (before != null && before.equals(after)) {
                continue;
            }
            if (preferences.isNotifyTechnicians()) {
                sent += send(ScheduleNotificationEvent.builder()
                        .tenantId(tenantId)
                        .recipientType(ScheduleNotificationEvent.RecipientType.TECHNICIAN)
                        .recipientId(after.getTechnicianId())
                        .jobId(adapted.getJobId())
                        .title(before == null ? "New job added" : "Job rescheduled")
                        .body("Job " + adapted.getJobId() + " now starts at " + after.getStart())
                        .scheduledStart(after.getStart())
                        .createdAt(createdAt)
                        .build());
                if (adapted.isReassigned()) {
                    sent += send(ScheduleNotificationEvent.builder()
                            .tenantId(tenantId)
                            .recipientType(ScheduleNotificationEvent.RecipientType.TECHNICIAN)
                            .recipientId(before.getTechnicianId())
                            .jobId(adapted.getJobId())
                            .title("Job reassigned")
                            .body("Job " + adapted.getJobId() + " was moved to another technician")
                            .scheduledStart(before.getStart())
                            .createdAt(createdAt)
                            .build());
                }
            }
            String customerId = committed.job(adapted.getJobId()).map(Job::getCustomerId).orElse(null);
            if (preferences.isNotifyCustomers() && customerId != null) {
                sent += send(ScheduleNotificationEvent.builder()
                        .tenantId(tenantId)
                        .recipientType(ScheduleNotificationEvent.RecipientType.CUSTOMER)
                        .recipientId(customerId)
                        .jobId(adapted.getJobId())
                        .title("Appointment update")
                        .body("Your appointment now starts at " + after.getStart())
                        .scheduledStart(after.getStart())
                        .createdAt(createdAt)
                        .build());
            }
        }
        return sent;
    }

    private int send(ScheduleNotificationEvent notification) {
        return notificationPublisher.publish(notification) ? 1 : 0;
    }

    private ImpactSummary impactSummary(ScheduleSnapshot snapshot, RepairResult result, List<AdaptedJob> adaptedJobs,
                                        int notificationsSent) {
        Set<String> technicians = new LinkedHashSet<>();
        long total = 0;
        long max = 0;
        int rescheduled = 0;
        for (AdaptedJob adapted : adaptedJobs) {
            technicians.add(adapted.getNewSlot().getTechnicianId());
            if (adapted.getOriginalSlot() != null) {
                technicians.add(adapted.getOriginalSlot().getTechnicianId());
            }
            if (adapted.getOriginalSlot() == null || !adapted.getOriginalSlot().equals(adapted.getNewSlot())) {
                rescheduled++;
            }
            total += adapted.getDelayMinutes();
            max = Math.max(max, adapted.getDelayMinutes());
        }
        double average = adaptedJobs.stream().mapToDouble(AdaptedJob::getImpactScore).average().orElse(0.0);
        return ImpactSummary.builder()
                .jobsRescheduled(rescheduled)
                .reassignmentCount(result.reassignmentCount(snapshot.getAssignments()))
                .techniciansAffected(technicians.size())
                .totalDelayMinutes(total)
                .maxDelayMinutes(max)
                .averageImpactScore(Math.round(average * 10_000.0) / 10_000.0)
                .notificationsSent(notificationsSent)
                .build();
    }

    private static List<Assignment> changedAssignments(RepairResult result) {
        return result.getAssignments().stream()
                .filter(a -> result.getTouchedJobIds().contains(a.getJobId()))
                .toList();
    }

    private AdaptationOutcome reject(OptimizationRun run, String adaptationId, DisruptionEvent event,
                                     ScheduleSnapshot snapshot, AdaptationPreferences preferences,
                                     List<DisruptionState> history, List<String> failedJobIds, String reason,
                                     Function<AdaptationPreferences, Attempt> attempt) {
        history.add(DisruptionState.REJECTED);
        List<Job> extraJobs = event.getEmergencyJob() != null ? List.of(event.getEmergencyJob()) : List.of();
        List<String> recommendations = advisor.recommend(snapshot, preferences,
                p -> attempt.apply(p).result(), failedJobIds, extraJobs);

        runStore.fail(run.getId(), "REJECTED: " + reason);
        metrics.recordAdaptation(DisruptionState.REJECTED);
        publish(snapshot.getTenantId(), adaptationId, event, DisruptionState.REJECTED, failedJobIds, 0,
                snapshot.getVersion());
        log.warn("Adaptation {} of tenant {} rejected: {}", adaptationId, snapshot.getTenantId(), reason);

        return AdaptationOutcome.builder()
                .adaptationId(adaptationId)
                .disruptionId(event.getId())
                .runId(run.getId())
                .state(DisruptionState.REJECTED)
                .stateHistory(List.copyOf(history))
                .affectedJobIds(failedJobIds)
                .recommendations(recommendations)
                .snapshotVersion(snapshot.getVersion())
                .rejectionReason(reason)
                .build();
    }

    private void publish(String tenantId, String adaptationId, DisruptionEvent event, DisruptionState state,
                         List<String> jobIds, int reassignments, long version) {
        eventPublisher.adapted(ScheduleAdaptedEvent.builder()
                .tenantId(tenantId)
                .adaptationId(adaptationId)
                .disruptionType(event.getType().name())
                .severity(event.getSeverity().name())
                .state(state.name())
                .affectedJobIds(List.copyOf(jobIds))
                .reassignmentCount(reassignments)
                .snapshotVersion(version)
                .adaptedAt(clock.instant())
                .build());
    }
}
