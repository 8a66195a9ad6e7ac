package com.fieldops.scheduling.analytics;

import com.fieldops.scheduling.domain.JobStatus;
import com.fieldops.scheduling.entity.JobOutcomeEntity;

import java.time.Duration;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

final class JobOutcomes {

    private JobOutcomes() {}

    /** Completed jobs with a known actual start count; on time means no later than scheduled start plus grace. */
    static boolean isRated(JobOutcomeEntity outcome) {
        return outcome.getStatus() == JobStatus.COMPLETED
                && outcome.getActualStart() != null
                && outcome.getScheduledStart() != null;
    }

    static boolean isOnTime(JobOutcomeEntity outcome, Duration grace) {
        return !outcome.getActualStart().isAfter(outcome.getScheduledStart().plus(grace));
    }

    static Set<String> skills(JobOutcomeEntity outcome) {
        if (outcome.getSkills() == null || outcome.getSkills().isBlank()) {
            return Set.of();
        }
        return Arrays.stream(outcome.getSkills().split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
    }
}
