package com.fieldops.scheduling.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fieldops.scheduling.domain.Assignment;
import com.fieldops.scheduling.domain.Job;
import com.fieldops.scheduling.domain.ScheduleSnapshot;
import com.fieldops.scheduling.entity.TenantScheduleEntity;
import com.fieldops.scheduling.exception.SchedulingException;
import com.fieldops.scheduling.repository.JobOutcomeRepository;
import com.fieldops.scheduling.repository.TenantScheduleRepository;
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
import java.util.Optional;

import static com.fieldops.scheduling.support.SchedulingFixtures.DEPOT;
import static com.fieldops.scheduling.support.SchedulingFixtures.TENANT;
import static com.fieldops.scheduling.support.SchedulingFixtures.assignment;
import static com.fieldops.scheduling.support.SchedulingFixtures.at;
import static com.fieldops.scheduling.support.SchedulingFixtures.job;
import static com.fieldops.scheduling.support.SchedulingFixtures.snapshot;
import static com.fieldops.scheduling.support.SchedulingFixtures.technician;
import static com.fieldops.scheduling.support.SchedulingFixtures.window;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CommittedScheduleStoreTest {

    @Mock private TenantScheduleRepository scheduleRepository;
    @Mock private JobOutcomeRepository outcomeRepository;

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private CommittedScheduleStore store;

    @BeforeEach
    void setUp() {
        store = new CommittedScheduleStore(scheduleRepository, outcomeRepository, objectMapper,
                Clock.fixed(at("07:00"), ZoneOffset.UTC));
        lenient().when(scheduleRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(outcomeRepository.findJobIdsWithStatus(eq(TENANT), anyCollection(), anyCollection()))
                .thenReturn(List.of());
    }

    private static ScheduleSnapshot twoJobs() {
        return snapshot(
                List.of(job("job-a", DEPOT, window("08:00", "12:00"), 60, "hvac"),
                        job("job-b", DEPOT, window("08:00", "16:00"), 45)),
                List.of(technician("tech-1", DEPOT, window("08:00", "17:00"), "hvac")),
                List.of(assignment("job-a", "tech-1", 0, at("09:00"), 60),
                        assignment("job-b", "tech-1", 1, at("10:30"), 45)));
    }

    @Test
    @DisplayName("A tenant without a committed schedule reads as an empty version 0")
    void emptyWhenNeverCommitted() {
        when(scheduleRepository.findById(TENANT)).thenReturn(Optional.empty());

        ScheduleSnapshot snapshot = store.load(TENANT);

        assertThat(snapshot.isEmpty()).isTrue();
        assertThat(snapshot.getVersion()).isZero();
        assertThat(store.currentVersion(TENANT)).isZero();
    }

    @Test
    @DisplayName("The first commit becomes version 1 and reads back intact")
    void firstCommitReadsBack() {
        when(scheduleRepository.findById(TENANT)).thenReturn(Optional.empty());

        ScheduleSnapshot committed = store.commit(twoJobs(), 0);

        assertThat(committed.getVersion()).isEqualTo(1);
        assertThat(committed.getCommittedAt()).isEqualTo(at("07:00"));
        ArgumentCaptor<TenantScheduleEntity> saved = ArgumentCaptor.forClass(TenantScheduleEntity.class);
        verify(scheduleRepository).save(saved.capture());
        assertThat(saved.getValue().getSnapshotVersion()).isEqualTo(1);
        assertThat(saved.getValue().getRunId()).isEqualTo("run-committed");

        when(scheduleRepository.findById(TENANT)).thenReturn(Optional.of(saved.getValue()));
        ScheduleSnapshot loaded = store.load(TENANT);
        assertThat(loaded.getVersion()).isEqualTo(1);
        assertThat(loaded.getJobs()).extracting(Job::getId).containsExactly("job-a", "job-b");
        assertThat(loaded.job("job-a")).get().satisfies(j -> {
            assertThat(j.getRequiredSkills()).containsExactly("hvac");
            assertThat(j.getEstimatedDuration()).isEqualTo(Duration.ofMinutes(60));
        });
        assertThat(loaded.routeOf("tech-1")).extracting(Assignment::getScheduledStart)
                .containsExactly(at("09:00"), at("10:30"));
        assertThat(loaded.getConstraints()).isEqualTo(committed.getConstraints());
    }

    @Test
    @DisplayName("A commit based on an outdated version is refused")
    void staleVersionRefused() {
        when(scheduleRepository.findById(TENANT)).thenReturn(Optional.of(
                TenantScheduleEntity.builder().tenantId(TENANT).snapshotVersion(5).build()));

        assertThatThrownBy(() -> store.commit(twoJobs(), 4))
                .isInstanceOf(SchedulingException.class)
                .hasMessageContaining("moved to version 5")
                .extracting(e -> ((SchedulingException) e).getCode())
                .isEqualTo(SchedulingException.INVALID_STATE);
        verify(scheduleRepository, never()).save(any());
    }

    @Test
    @DisplayName("Jobs with a terminal outcome are archived at commit time")
    void terminalJobsArchived() {
        when(scheduleRepository.findById(TENANT)).thenReturn(Optional.empty());
        when(outcomeRepository.findJobIdsWithStatus(eq(TENANT), anyCollection(), anyCollection()))
                .thenReturn(List.of("job-a"));

        ScheduleSnapshot committed = store.commit(twoJobs(), 0);

        assertThat(committed.getJobs()).extracting(Job::getId).containsExactly("job-b");
        assertThat(committed.getAssignments()).extracting(Assignment::getJobId).containsExactly("job-b");
    }
}
