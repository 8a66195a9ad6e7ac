package com.fieldops.scheduling.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;

/**
 * Half-open instant interval [start, end).
 */
@Value
@Builder
@Jacksonized
public class TimeWindow {

    Instant start;
    Instant end;

    public static TimeWindow of(Instant start, Instant end) {
        return new TimeWindow(start, end);
    }

    @JsonIgnore
    public Duration length() {
        return Duration.between(start, end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    /**
     * True when the intersection of both windows is at least {@code minimum} long.
     */
    public boolean overlapsFor(TimeWindow other, Duration minimum) {
        Instant from = start.isAfter(other.start) ? start : other.start;
        Instant to = end.isBefore(other.end) ? end : other.end;
        return !Duration.between(from, to).minus(minimum).isNegative();
    }
}
