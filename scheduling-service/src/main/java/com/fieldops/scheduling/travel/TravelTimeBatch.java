package com.fieldops.scheduling.travel;

import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Durations for one batch of legs, flagged degraded when the fallback estimator answered
 * because the primary provider failed.
 */
@Value
public class TravelTimeBatch {

    List<Duration> durations;
    boolean degraded;
    String source;
}
