package com.fieldops.scheduling.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds the {@code scheduling.*} block of application.yml.
 */
@Data
@ConfigurationProperties(prefix = "scheduling")
public class SchedulingProperties {

    private Optimizer optimizer = new Optimizer();
    private Travel travel = new Travel();
    private Weather weather = new Weather();
    private Location location = new Location();
    private Lease lease = new Lease();
    private Runs runs = new Runs();
    private Analytics analytics = new Analytics();

    @Data
    public static class Optimizer {
        /** Wall-clock budget for a full run, commit included. */
        private Duration timeBudget = Duration.ofSeconds(30);
        /** Share of the budget kept back for scoring and commit. */
        private Duration commitReserve = Duration.ofMillis(500);
        private int maxIterations = 500;
        private int repairMaxIterations = 50;
        /** How far past the working-hours end a route may run when overtime is allowed. */
        private Duration overtimeAllowance = Duration.ofMinutes(120);
    }

    @Data
    public static class Travel {
        /** Distance-matrix endpoint; blank means the great-circle estimator is the primary source. */
        private String providerUrl;
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(5);
        private double fallbackSpeedKmh = 30.0;
    }

    @Data
    public static class Weather {
        private String providerUrl;
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(2);
    }

    @Data
    public static class Location {
        /** Last-known positions older than this are ignored in favour of the home location. */
        private Duration staleness = Duration.ofMinutes(5);
        private Duration ttl = Duration.ofHours(24);
        private int writerThreads = 2;
    }

    @Data
    public static class Lease {
        public enum Mode { LOCAL, REDIS }

        private Mode mode = Mode.LOCAL;
        /** Upper bound on how long a crashed holder can keep a Redis lease. */
        private Duration leaseTime = Duration.ofSeconds(120);
        private Duration preemptionWait = Duration.ofSeconds(5);
    }

    @Data
    public static class Runs {
        private Duration retention = Duration.ofDays(90);
        private int historyLimit = 50;
    }

    @Data
    public static class Analytics {
        private Duration onTimeGrace = Duration.ofMinutes(10);
        private int forecastWindowDays = 14;
        private int forecastHorizonDays = 7;
        private double smoothingAlpha = 0.3;
        private Duration performanceCacheTtl = Duration.ofMinutes(10);
    }
}
