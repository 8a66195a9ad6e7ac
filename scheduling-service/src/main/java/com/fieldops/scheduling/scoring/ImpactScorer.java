package com.fieldops.scheduling.scoring;

import java.time.Duration;

/**
 * Size of the change a disruption forced on one job, in [0, 1].
 *
 * Half of the score comes from the time shift relative to the allowed maximum delay, 0.3 from a
 * technician change and 0.2 from any cost increase of the touched routes. Stateless.
 */
public final class ImpactScorer {

    static final double W_TIME     = 0.5;
    static final double W_REASSIGN = 0.3;
    static final double W_COST     = 0.2;

    private ImpactScorer() {}

    public static double score(Duration timeDelta, boolean reassigned, double costDelta, Duration maxDelay) {
        double timeScore = 0.0;
        if (timeDelta != null && !timeDelta.isZero()) {
            long limit = maxDelay == null || maxDelay.isZero() ? 1 : maxDelay.getSeconds();
            timeScore = Math.min(1.0, (double) Math.abs(timeDelta.getSeconds()) / limit);
        }
        double costScore = Double.isNaN(costDelta) ? 0.0 : Math.min(1.0, Math.max(0.0, costDelta));

        return W_TIME * timeScore + (reassigned ? W_REASSIGN : 0.0) + W_COST * costScore;
    }
}
