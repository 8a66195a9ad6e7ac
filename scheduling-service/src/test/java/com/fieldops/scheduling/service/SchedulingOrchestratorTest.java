package com.fieldops.scheduling.service;

import com.fieldops.scheduling.analytics.TechnicianPerformanceCache;
import com.fieldops.scheduling.config.SchedulingProperties;
import com.fieldops.scheduling.constraint.ConstraintValidator;
import com.fieldops.scheduling.constraint.FieldViolation;
import com.fieldops.scheduling.disruption.AdaptationOutcome;
import com.fieldops.scheduling.disruption.DisruptionHandler;
import com.fieldops.scheduling.disruption.DisruptionState;
import com.fieldops.scheduling.domain.ConstraintSet;
import com.fieldops.scheduling.domain.DisruptionEvent;
import com.fieldops.scheduling.domain.DisruptionType;
import com.fieldops.scheduling.domain.Job;
import com.fieldops.scheduling.domain.JobStatus;
import com.fieldops.scheduling.domain.OptimizationOptions;
import com.fieldops.scheduling.domain.OptimizationRun;
import com.fieldops.scheduling.domain.RunStatus;
import com.fieldops.scheduling.domain.RunType;
import com.fieldops.scheduling.domain.ScheduleSnapshot;
import com.fieldops.scheduling.domain.Severity;
import com.fieldops.scheduling.engine.CancellationToken;
import com.fieldops.scheduling.engine.OptimizerEngine;
import com.fieldops.scheduling.engine.ScheduleAssembler;
import com.fieldops.scheduling.engine.ScheduleValidator;
import com.fieldops.scheduling.exception.ConstraintValidationException;
import com.fieldops.scheduling.exception.ScheduleBusyException;
import com.fieldops.scheduling.exception.SchedulingException;
import com.fieldops.scheduling.lease.InMemoryTenantLeaseManager;
import com.fieldops.scheduling.lease.TenantLease;
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
import com.fieldops.scheduling.support.FixedTravelTimes;
import com.fieldops.shared.events.ScheduleCommittedEvent;
import com.fieldops.shared.featureflag.FeatureFlagService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static com.fieldops.scheduling.support.SchedulingFixtures.DEPOT;
import static com.fieldops.scheduling.support.SchedulingFixtures.TENANT;
import static com.fieldops.scheduling.support.SchedulingFixtures.at;
import static com.fieldops.scheduling.support.SchedulingFixtures.job;
import static com.fieldops.scheduling.support.SchedulingFixtures.problemBuilder;
import static com.fieldops.scheduling.support.SchedulingFixtures.technician;
import static com.fieldops.scheduling.support.SchedulingFixtures.window;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SchedulingOrchestratorTest {

    @Mock private OptimizationRunStore runStore;
    @Mock private CommittedScheduleStore scheduleStore;
    @Mock private DisruptionHandler disruptionHandler;
    @Mock private TechnicianLocationService locationService;
    @Mock private TechnicianPerformanceCache performanceCache;
    @Mock private NotificationPublisher notificationPublisher;
    @Mock private ScheduleEventPublisher eventPublisher;
    @Mock private FeatureFlagService featureFlagService;

    private InMemoryTenantLeaseManager leaseManager;
    private ActiveRunRegistry activeRuns;
    private SimpleMeterRegistry registry;
    private SchedulingProperties properties;
    private SchedulingOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        leaseManager = new InMemoryTenantLeaseManager();
        activeRuns = new ActiveRunRegistry();
        registry = new SimpleMeterRegistry();
        properties = new SchedulingProperties();
        orchestrator = new SchedulingOrchestrator(new ConstraintValidator(), leaseManager, activeRuns, runStore,
                scheduleStore, problemBuilder(new FixedTravelTimes()), new OptimizerEngine(), new ScheduleAssembler(),
                new ScheduleValidator(), disruptionHandler, locationService, performanceCache, notificationPublisher,
                eventPublisher, new InputFingerprint(), featureFlagService,
                new SchedulingMetrics(registry, activeRuns), properties, Clock.fixed(at("07:00"), ZoneOffset.UTC));

        lenient().when(runStore.create(eq(TENANT), eq(RunType.OPTIMIZATION), anyString(), anyString()))
                .thenReturn(OptimizationRun.builder().id("run-1").tenantId(TENANT).status(RunStatus.QUEUED).build());
        lenient().when(scheduleStore.currentVersion(TENANT)).thenReturn(2L);
        lenient().when(scheduleStore.commit(any(), anyLong())).thenAnswer(inv ->
                ((ScheduleSnapshot) inv.getArgument(0)).toBuilder()
                        .version((long) inv.getArgument(1) + 1)
                        .committedAt(at("07:00"))
                        .build());
        lenient().when(locationService.startLocations(eq(TENANT), any(), any())).thenReturn(Map.of());
        lenient().when(performanceCache.onTimeRates(TENANT)).thenReturn(Map.of());
    }

    private static OptimizeRequest request() {
        OptimizeRequest request = new OptimizeRequest();
        request.setJobs(List.of(
                job("job-1", DEPOT, window("09:00", "12:00"), 60),
                job("job-2", DEPOT, window("08:00", "17:00"), 90)));
        request.setTechnicians(List.of(technician("tech-1", DEPOT, window("08:00", "17:00"))));
        request.setTimeWindow(window("06:00", "22:00"));
        return request;
    }

    private static AdaptRequest adaptRequest(Severity severity) {
        AdaptRequest request = new AdaptRequest();
        request.setDisruption(DisruptionEvent.builder()
                .type(DisruptionType.TRAFFIC_DELAY)
                .severity(severity)
                .affectedJobIds(List.of("job-1"))
                .build());
        return request;
    }

    @Test
    @DisplayName("Optimize commits the new schedule on top of the current version and records the run")
    void optimizeCommitsSchedule() {
        OptimizeResponse response = orchestrator.optimize(TENANT, request());

        assertThat(response.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(response.getRunId()).isEqualTo("run-1");
        assertThat(response.getSnapshotVersion()).isEqualTo(3);
        assertThat(response.getAssignments()).extracting(a -> a.getJobId())
                .containsExactlyInAnyOrder("job-1", "job-2");
        assertThat(response.getWarnings()).isEmpty();

        ArgumentCaptor<ScheduleSnapshot> committed = ArgumentCaptor.forClass(ScheduleSnapshot.class);
        verify(scheduleStore).commit(committed.capture(), eq(2L));
        assertThat(committed.getValue().getJobs()).extracting(Job::getStatus).containsOnly(JobStatus.SCHEDULED);
        assertThat(committed.getValue().getRunId()).isEqualTo("run-1");

        verify(runStore).markRunning("run-1");
        verify(runStore).complete(eq("run-1"), eq(response.getAssignments()), eq(List.of()), any());
        ArgumentCaptor<ScheduleCommittedEvent> event = ArgumentCaptor.forClass(ScheduleCommittedEvent.class);
        verify(eventPublisher).committed(event.capture());
        assertThat(event.getValue().getSnapshotVersion()).isEqualTo(3);
        assertThat(event.getValue().getScheduledJobs()).isEqualTo(2);
        verify(notificationPublisher, never()).publish(any());

        assertThat(activeRuns.activeCount()).isZero();
        assertThat(registry.counter("scheduling.runs", "outcome", "completed").count()).isEqualTo(1.0);
        assertThat(leaseManager.tryAcquire(TENANT, Duration.ZERO)).isPresent();
    }

    @Test
    @DisplayName("Optimize is rejected as busy while another operation holds the tenant lease")
    void optimizeRejectedWhileLeaseHeld() {
        Optional<TenantLease> held = leaseManager.tryAcquire(TENANT, Duration.ZERO);
        assertThat(held).isPresent();

        assertThatThrownBy(() -> orchestrator.optimize(TENANT, request()))
                .isInstanceOf(ScheduleBusyException.class)
                .satisfies(e -> assertThat(((SchedulingException) e).isRetryable()).isTrue());

        verify(runStore, never()).create(any(), any(), any(), any());
        verify(scheduleStore, never()).commit(any(), anyLong());
        assertThat(registry.counter("scheduling.busy_rejections").count()).isEqualTo(1.0);

        held.get().close();
        assertThat(orchestrator.optimize(TENANT, request()).getStatus()).isEqualTo(RunStatus.COMPLETED);
    }

    @Test
    @DisplayName("Another tenant's lease does not block optimization")
    void leasesAreTenantScoped() {
        Optional<TenantLease> other = leaseManager.tryAcquire("globex", Duration.ZERO);
        assertThat(other).isPresent();

        assertThat(orchestrator.optimize(TENANT, request()).getStatus()).isEqualTo(RunStatus.COMPLETED);
    }

    @Test
    @DisplayName("The kill switch rejects optimize and adapt before any lease is taken")
    void killSwitchRejects() {
        when(featureFlagService.isEnabled(TENANT, FeatureFlagService.SCHEDULING_KILL_SWITCH, false)).thenReturn(true);

        assertThatThrownBy(() -> orchestrator.optimize(TENANT, request()))
                .isInstanceOf(SchedulingException.class)
                .extracting(e -> ((SchedulingException) e).getCode())
                .isEqualTo(SchedulingException.SERVICE_UNAVAILABLE);
        assertThatThrownBy(() -> orchestrator.adapt(TENANT, adaptRequest(Severity.LOW)))
                .isInstanceOf(SchedulingException.class)
                .extracting(e -> ((SchedulingException) e).getCode())
                .isEqualTo(SchedulingException.SERVICE_UNAVAILABLE);

        verify(runStore, never()).create(any(), any(), any(), any());
        verify(disruptionHandler, never()).handle(any(), any(), any());
        assertThat(registry.counter("scheduling.kill_switch_rejections").count()).isEqualTo(2.0);
        assertThat(leaseManager.tryAcquire(TENANT, Duration.ZERO)).isPresent();
    }

    @Test
    @DisplayName("Malformed jobs and technicians are reported together without starting a run")
    void inputViolationsCollected() {
        OptimizeRequest request = request();
        request.setJobs(List.of(
                job("job-1", DEPOT, window("09:00", "12:00"), 60),
                job("job-1", DEPOT, window("09:00", "12:00"), 0)));
        request.setTechnicians(List.of(
                technician("tech-1", DEPOT, window("08:00", "17:00")).toBuilder().maxJobsPerDay(-1).build()));

        assertThatThrownBy(() -> orchestrator.optimize(TENANT, request))
                .isInstanceOf(ConstraintValidationException.class)
                .satisfies(e -> assertThat(((ConstraintValidationException) e).getViolations())
                        .extracting(FieldViolation::getField)
                        .containsExactly("jobs[1].id", "jobs[1].estimatedDuration", "technicians[0].maxJobsPerDay"));

        verify(runStore, never()).create(any(), any(), any(), any());
    }

    @Test
    @DisplayName("Constraint and payload violations come back in a single rejection")
    void constraintAndInputViolationsCollectedTogether() {
        OptimizeRequest request = request();
        request.setConstraints(ConstraintSet.builder().maxTravelTime(Duration.ofMinutes(-5)).build());
        request.setJobs(List.of(job("job-1", DEPOT, window("09:00", "12:00"), 0)));

        assertThatThrownBy(() -> orchestrator.optimize(TENANT, request))
                .isInstanceOf(ConstraintValidationException.class)
                .satisfies(e -> assertThat(((ConstraintValidationException) e).getViolations())
                        .extracting(FieldViolation::getField)
                        .containsExactly("maxTravelTime", "jobs[0].estimatedDuration"));

        verify(runStore, never()).create(any(), any(), any(), any());
        assertThat(leaseManager.tryAcquire(TENANT, Duration.ZERO)).isPresent();
    }

    @Test
    @DisplayName("Invalid constraints are rejected before the lease is taken")
    void invalidConstraintsRejected() {
        OptimizeRequest request = request();
        request.setConstraints(ConstraintSet.builder().maxTravelTime(Duration.ofMinutes(-5)).build());

        assertThatThrownBy(() -> orchestrator.optimize(TENANT, request))
                .isInstanceOf(ConstraintValidationException.class)
                .hasMessageContaining("maxTravelTime");
        assertThat(leaseManager.tryAcquire(TENANT, Duration.ZERO)).isPresent();
    }

    @Test
    @DisplayName("A failing commit marks the run FAILED and releases the lease")
    void failedCommitMarksRunFailed() {
        doThrow(new SchedulingException(SchedulingException.INVALID_STATE, "version moved"))
                .when(scheduleStore).commit(any(), anyLong());

        assertThatThrownBy(() -> orchestrator.optimize(TENANT, request()))
                .isInstanceOf(SchedulingException.class)
                .hasMessage("version moved");

        verify(runStore).fail("run-1", "version moved");
        verify(runStore, never()).complete(any(), any(), any(), any());
        assertThat(activeRuns.activeCount()).isZero();
        assertThat(registry.counter("scheduling.runs", "outcome", "failed").count()).isEqualTo(1.0);
        assertThat(leaseManager.tryAcquire(TENANT, Duration.ZERO)).isPresent();
    }

    @Test
    @DisplayName("A run cancelled while it executes keeps the committed schedule")
    void cancelledRunDoesNotCommit() {
        lenient().when(featureFlagService.isEnabled(TENANT, FeatureFlagService.LOCAL_SEARCH_ENABLED, true)).thenReturn(true);
        when(locationService.startLocations(eq(TENANT), any(), any())).thenAnswer(inv -> {
            assertThat(orchestrator.cancelRun(TENANT, "run-1").cancellationRequested()).isTrue();
            return Map.of();
        });
        when(runStore.find(TENANT, "run-1")).thenReturn(Optional.of(
                OptimizationRun.builder().id("run-1").tenantId(TENANT).status(RunStatus.RUNNING).build()));

        OptimizeResponse response = orchestrator.optimize(TENANT, request());

        assertThat(response.getStatus()).isEqualTo(RunStatus.CANCELLED);
        assertThat(response.getAssignments()).isEmpty();
        assertThat(response.getSnapshotVersion()).isEqualTo(2);
        verify(runStore).cancel(eq("run-1"), any());
        verify(scheduleStore, never()).commit(any(), anyLong());
        verify(eventPublisher, never()).committed(any());
        assertThat(registry.counter("scheduling.runs", "outcome", "cancelled").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Cancelling a finished run fails with INVALID_STATE")
    void cancelFinishedRun() {
        when(runStore.find(TENANT, "run-old")).thenReturn(Optional.of(
                OptimizationRun.builder().id("run-old").tenantId(TENANT).status(RunStatus.COMPLETED).build()));

        assertThatThrownBy(() -> orchestrator.cancelRun(TENANT, "run-old"))
                .isInstanceOf(SchedulingException.class)
                .hasMessageContaining("already finished as COMPLETED")
                .extracting(e -> ((SchedulingException) e).getCode())
                .isEqualTo(SchedulingException.INVALID_STATE);
    }

    @Test
    @DisplayName("Cancelling a run that is not executing here fails with INVALID_STATE")
    void cancelRunOnAnotherInstance() {
        when(runStore.find(TENANT, "run-2")).thenReturn(Optional.of(
                OptimizationRun.builder().id("run-2").tenantId(TENANT).status(RunStatus.RUNNING).build()));

        assertThatThrownBy(() -> orchestrator.cancelRun(TENANT, "run-2"))
                .isInstanceOf(SchedulingException.class)
                .hasMessageContaining("not executing on this instance");
    }

    @Test
    @DisplayName("Unknown runs are reported as RUN_NOT_FOUND")
    void unknownRun() {
        when(runStore.find(TENANT, "nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> orchestrator.getRun(TENANT, "nope"))
                .isInstanceOf(SchedulingException.class)
                .extracting(e -> ((SchedulingException) e).getCode())
                .isEqualTo(SchedulingException.RUN_NOT_FOUND);
    }

    @Test
    @DisplayName("History rejects out-of-range windows and page sizes")
    void historyBounds() {
        assertThatThrownBy(() -> orchestrator.history(TENANT, 0, 10))
                .isInstanceOf(SchedulingException.class)
                .extracting(e -> ((SchedulingException) e).getCode())
                .isEqualTo(SchedulingException.INVALID_REQUEST);
        assertThatThrownBy(() -> orchestrator.history(TENANT, 91, 10)).isInstanceOf(SchedulingException.class);
        assertThatThrownBy(() -> orchestrator.history(TENANT, 30, 201)).isInstanceOf(SchedulingException.class);

        when(runStore.history(TENANT, 30, 50)).thenReturn(List.of());
        assertThat(orchestrator.history(TENANT, 30, 50)).isEmpty();
    }

    @Test
    @DisplayName("Reading the schedule of a tenant that never committed one fails with NO_COMMITTED_SCHEDULE")
    void currentScheduleMissing() {
        when(scheduleStore.load(TENANT)).thenReturn(ScheduleSnapshot.empty(TENANT));

        assertThatThrownBy(() -> orchestrator.currentSchedule(TENANT))
                .isInstanceOf(SchedulingException.class)
                .extracting(e -> ((SchedulingException) e).getCode())
                .isEqualTo(SchedulingException.NO_COMMITTED_SCHEDULE);
    }

    @Test
    @DisplayName("Adapt runs the disruption under the tenant lease and releases it afterwards")
    void adaptUnderLease() {
        AdaptRequest request = adaptRequest(Severity.LOW);
        when(disruptionHandler.handle(TENANT, request.getDisruption(), null)).thenAnswer(inv -> {
            assertThat(leaseManager.tryAcquire(TENANT, Duration.ZERO)).isEmpty();
            return AdaptationOutcome.builder().adaptationId("ad-1").state(DisruptionState.NOTIFIED)
                    .snapshotVersion(4).build();
        });

        AdaptResponse response = orchestrator.adapt(TENANT, request);

        assertThat(response.getState()).isEqualTo(DisruptionState.NOTIFIED);
        assertThat(response.getSnapshotVersion()).isEqualTo(4);
        assertThat(leaseManager.tryAcquire(TENANT, Duration.ZERO)).isPresent();
    }

    @Test
    @DisplayName("A low-priority disruption is rejected as busy without touching the running optimization")
    void lowPriorityAdaptRejectedWhileBusy() {
        Optional<TenantLease> held = leaseManager.tryAcquire(TENANT, Duration.ZERO);
        assertThat(held).isPresent();
        CancellationToken token = activeRuns.register(TENANT, "run-long");

        assertThatThrownBy(() -> orchestrator.adapt(TENANT, adaptRequest(Severity.MEDIUM)))
                .isInstanceOf(ScheduleBusyException.class);

        assertThat(token.isCancellationRequested()).isFalse();
        verify(disruptionHandler, never()).handle(any(), any(), any());
    }

    @Test
    @DisplayName("A disruption sent with a null severity counts as MEDIUM and is rejected as busy")
    void nullSeverityAdaptRejectedWhileBusy() {
        Optional<TenantLease> held = leaseManager.tryAcquire(TENANT, Duration.ZERO);
        assertThat(held).isPresent();
        CancellationToken token = activeRuns.register(TENANT, "run-long");

        assertThatThrownBy(() -> orchestrator.adapt(TENANT, adaptRequest(null)))
                .isInstanceOf(ScheduleBusyException.class);

        assertThat(token.isCancellationRequested()).isFalse();
        verify(disruptionHandler, never()).handle(any(), any(), any());
    }

    @Test
    @DisplayName("A high-severity disruption preempts the running optimization and adapts once the lease frees up")
    void highPriorityAdaptPreemptsOptimization() {
        Optional<TenantLease> held = leaseManager.tryAcquire(TENANT, Duration.ZERO);
        assertThat(held).isPresent();
        CancellationToken token = activeRuns.register(TENANT, "run-long");
        CompletableFuture<Void> runner = CompletableFuture.runAsync(() -> {
            long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
            while (!token.isCancellationRequested() && System.nanoTime() < deadline) {
                Thread.onSpinWait();
            }
            held.get().close();
        });
        AdaptRequest request = adaptRequest(Severity.HIGH);
        when(disruptionHandler.handle(TENANT, request.getDisruption(), null)).thenReturn(
                AdaptationOutcome.builder().adaptationId("ad-2").state(DisruptionState.NOTIFIED).build());

        AdaptResponse response = orchestrator.adapt(TENANT, request);

        runner.join();
        assertThat(token.isCancellationRequested()).isTrue();
        assertThat(response.getAdaptationId()).isEqualTo("ad-2");
    }
}
