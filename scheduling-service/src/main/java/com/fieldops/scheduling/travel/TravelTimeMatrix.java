package com.fieldops.scheduling.travel;

import java.time.Duration;

/**
 * Dense node-to-node travel times in seconds for a single run. Self-legs are zero.
 */
public final class TravelTimeMatrix {

    private final long[][] seconds;
    private final boolean degraded;

    public TravelTimeMatrix(long[][] seconds, boolean degraded) {
        this.seconds = seconds;
        this.degraded = degraded;
    }

    public long seconds(int from, int to) {
        return seconds[from][to];
    }

    public Duration between(int from, int to) {
        return Duration.ofSeconds(seconds[from][to]);
    }

    public int size() {
        return seconds.length;
    }

    public boolean isDegraded() {
        return degraded;
    }
}
