package com.fieldops.scheduling.model;

import com.fieldops.scheduling.domain.JobStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Instant;

@Data
public class JobOutcomeRequest {

    /** COMPLETED or CANCELLED. */
    @NotNull
    private JobStatus status;

    private Instant actualStart;

    private Instant actualEnd;
}
