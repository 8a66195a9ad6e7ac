package com.fieldops.scheduling.scoring;

import java.time.Duration;

/**
 * Reliability of one assignment holding as scheduled.
 *
 * <pre>
 *   0.35 * min(1, slack / 30 min)
 * + 0.15 * (degraded travel estimate ? 0.5 : 1.0)
 * + 0.25 * skill-match strength
 * + 0.25 * historical on-time rate
 * </pre>
 * clamped to [0, 1]. Stateless.
 */
public final class ConfidenceScorer {

    public static final double DEFAULT_ON_TIME_RATE = 0.9;

    static final double W_SLACK     = 0.35;
    static final double W_ESTIMATE  = 0.15;
    static final double W_SKILL     = 0.25;
    static final double W_ON_TIME   = 0.25;
    static final Duration FULL_SLACK = Duration.ofMinutes(30);

    private ConfidenceScorer() {}

    public static double score(Duration slack, boolean degraded, double skillMatchStrength, double onTimeRate) {
        double slackScore = slack == null || slack.isNegative()
                ? 0.0
                : Math.min(1.0, (double) slack.getSeconds() / FULL_SLACK.getSeconds());
        double estimate = degraded ? 0.5 : 1.0;
        double onTime = Double.isNaN(onTimeRate) ? DEFAULT_ON_TIME_RATE : unit(onTimeRate);

        double raw = W_SLACK * slackScore
                + W_ESTIMATE * estimate
                + W_SKILL * unit(skillMatchStrength)
                + W_ON_TIME * onTime;
        return unit(raw);
    }

    private static double unit(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
