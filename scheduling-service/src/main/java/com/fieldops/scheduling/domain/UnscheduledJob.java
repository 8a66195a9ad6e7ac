package com.fieldops.scheduling.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class UnscheduledJob {

    String jobId;
    UnscheduledReason reason;
    String detail;
}
