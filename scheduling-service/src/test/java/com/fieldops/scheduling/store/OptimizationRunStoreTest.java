package com.fieldops.scheduling.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fieldops.scheduling.domain.OptimizationMetrics;
import com.fieldops.scheduling.domain.OptimizationRun;
import com.fieldops.scheduling.domain.RunStatus;
import com.fieldops.scheduling.domain.RunType;
import com.fieldops.scheduling.domain.UnscheduledJob;
import com.fieldops.scheduling.domain.UnscheduledReason;
import com.fieldops.scheduling.entity.OptimizationRunEntity;
import com.fieldops.scheduling.exception.SchedulingException;
import com.fieldops.scheduling.repository.OptimizationRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static com.fieldops.scheduling.support.SchedulingFixtures.TENANT;
import static com.fieldops.scheduling.support.SchedulingFixtures.assignment;
import static com.fieldops.scheduling.support.SchedulingFixtures.at;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OptimizationRunStoreTest {

    @Mock private OptimizationRunRepository repository;

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private OptimizationRunStore store;

    @BeforeEach
    void setUp() {
        store = new OptimizationRunStore(repository, objectMapper, Clock.fixed(at("07:00"), ZoneOffset.UTC));
        lenient().when(repository.save(any())).thenAnswer(inv -> inv.getArgument(0));
    }

    private static OptimizationRunEntity entity(String id, RunStatus status) {
        return OptimizationRunEntity.builder()
                .id(id)
                .tenantId(TENANT)
                .runType(RunType.OPTIMIZATION)
                .status(status)
                .startedAt(at("06:59"))
                .build();
    }

    @Test
    @DisplayName("A new run starts QUEUED with its fingerprint and algorithm version")
    void createQueued() {
        OptimizationRun run = store.create(TENANT, RunType.OPTIMIZATION, "abc123", "v1");

        assertThat(run.getId()).isNotBlank();
        assertThat(run.getStatus()).isEqualTo(RunStatus.QUEUED);
        assertThat(run.getInputHash()).isEqualTo("abc123");
        assertThat(run.getAlgorithmVersion()).isEqualTo("v1");
        assertThat(run.getStartedAt()).isEqualTo(at("07:00"));
        assertThat(run.getAssignments()).isEmpty();
        assertThat(run.getMetrics()).isNull();
    }

    @Test
    @DisplayName("Only a QUEUED run can move to RUNNING")
    void markRunningOnlyFromQueued() {
        OptimizationRunEntity queued = entity("run-1", RunStatus.QUEUED);
        when(repository.findById("run-1")).thenReturn(Optional.of(queued));
        when(repository.findById("run-2")).thenReturn(Optional.of(entity("run-2", RunStatus.COMPLETED)));

        store.markRunning("run-1");

        assertThat(queued.getStatus()).isEqualTo(RunStatus.RUNNING);
        assertThatThrownBy(() -> store.markRunning("run-2"))
                .isInstanceOf(SchedulingException.class)
                .extracting(e -> ((SchedulingException) e).getCode())
                .isEqualTo(SchedulingException.INVALID_STATE);
    }

    @Test
    @DisplayName("A completed run keeps its assignments, warnings and metrics")
    void completeStoresOutputs() {
        when(repository.findById("run-1")).thenReturn(Optional.of(entity("run-1", RunStatus.RUNNING)));

        OptimizationRun run = store.complete("run-1",
                List.of(assignment("job-a", "tech-1", 0, at("09:00"), 60)),
                List.of(UnscheduledJob.builder().jobId("job-b").reason(UnscheduledReason.NO_CANDIDATE).build()),
                OptimizationMetrics.builder().totalJobs(2).scheduledJobs(1).elapsedMillis(120).build());

        assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.getCompletedAt()).isEqualTo(at("07:00"));
        assertThat(run.getAssignments()).singleElement().satisfies(a -> {
            assertThat(a.getJobId()).isEqualTo("job-a");
            assertThat(a.getScheduledEnd()).isEqualTo(at("10:00"));
            assertThat(a.getTravelTimeFromPrevious()).isEqualTo(Duration.ZERO);
        });
        assertThat(run.getWarnings()).extracting(UnscheduledJob::getReason)
                .containsExactly(UnscheduledReason.NO_CANDIDATE);
        assertThat(run.getMetrics().getScheduledJobs()).isEqualTo(1);
    }

    @Test
    @DisplayName("Long failure reasons are truncated")
    void failTruncatesReason() {
        when(repository.findById("run-1")).thenReturn(Optional.of(entity("run-1", RunStatus.RUNNING)));

        OptimizationRun run = store.fail("run-1", "x".repeat(600));

        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(run.getFailureReason()).hasSize(512);
    }

    @Test
    @DisplayName("Updating an unknown run fails with RUN_NOT_FOUND")
    void unknownRun() {
        when(repository.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> store.cancel("missing", null))
                .isInstanceOf(SchedulingException.class)
                .extracting(e -> ((SchedulingException) e).getCode())
                .isEqualTo(SchedulingException.RUN_NOT_FOUND);
    }

    @Test
    @DisplayName("History reads the requested window newest first")
    void historyWindow() {
        when(repository.findByTenantIdAndStartedAtGreaterThanEqualOrderByStartedAtDesc(
                TENANT, at("07:00").minus(Duration.ofDays(7)), PageRequest.of(0, 20)))
                .thenReturn(List.of(entity("run-2", RunStatus.COMPLETED), entity("run-1", RunStatus.FAILED)));

        assertThat(store.history(TENANT, 7, 20)).extracting(OptimizationRun::getId).containsExactly("run-2", "run-1");
    }
}
