package com.fieldops.scheduling.disruption;

import com.fieldops.scheduling.domain.Assignment;
import com.fieldops.scheduling.domain.UnscheduledJob;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

@Value
@Builder
public class RepairResult {

    boolean success;

    /** Full assignment set after the repair, ordered by technician id then sequence. */
    @Builder.Default
    List<Assignment> assignments = List.of();

    /** Affected jobs plus route neighbours whose record had to be rebuilt. */
    @Builder.Default
    Set<String> touchedJobIds = Set.of();

    /** Jobs that could not be placed again. */
    @Builder.Default
    List<UnscheduledJob> failures = List.of();

    /** Cost of the touched routes after minus before. */
    double costDelta;

    int iterations;
    boolean degraded;

    public int reassignmentCount(List<Assignment> before) {
        int count = 0;
        for (Assignment after : assignments) {
            for (Assignment original : before) {
                if (original.getJobId().equals(after.getJobId())
                        && !original.getTechnicianId().equals(after.getTechnicianId())) {
                    count++;
                }
            }
        }
        return count;
    }
}
