package com.fieldops.scheduling.metrics;

import com.fieldops.scheduling.disruption.DisruptionState;
import com.fieldops.scheduling.domain.RunStatus;
import com.fieldops.scheduling.run.ActiveRunRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Custom Micrometer metrics for the Scheduling Service.
 *
 * Metrics exposed at /actuator/prometheus:
 *
 *   scheduling_runs_total{outcome="completed|failed|cancelled"}
 *   scheduling_optimization_latency_seconds{quantile="0.5|0.95|0.99"}
 *   scheduling_adaptations_total{state="notified|rejected|..."}
 *   scheduling_busy_rejections_total
 *   scheduling_kill_switch_rejections_total
 *   scheduling_degraded_runs_total
 *   scheduling_unscheduled_jobs_total
 *   scheduling_active_runs
 */
@Component
public class SchedulingMetrics {

    private final Map<RunStatus, Counter> runCounters = new EnumMap<>(RunStatus.class);
    private final Map<DisruptionState, Counter> adaptationCounters = new EnumMap<>(DisruptionState.class);
    private final Counter busyRejectionCounter;
    private final Counter killSwitchCounter;
    private final Counter degradedRunCounter;
    private final Counter unscheduledJobCounter;
    private final Timer   optimizationLatencyTimer;

    public SchedulingMetrics(MeterRegistry registry, ActiveRunRegistry activeRuns) {
        for (RunStatus status : new RunStatus[]{RunStatus.COMPLETED, RunStatus.FAILED, RunStatus.CANCELLED}) {
            runCounters.put(status, Counter.builder("scheduling.runs")
                    .tag("outcome", status.name().toLowerCase())
                    .description("Optimization runs by final status")
                    .register(registry));
        }

        for (DisruptionState state : DisruptionState.values()) {
            adaptationCounters.put(state, Counter.builder("scheduling.adaptations")
                    .tag("state", state.name().toLowerCase())
                    .description("Disruption adaptations by final state")
                    .register(registry));
        }

        this.busyRejectionCounter = Counter.builder("scheduling.busy_rejections")
                .description("Requests rejected because another operation held the tenant lease")
                .register(registry);

        this.killSwitchCounter = Counter.builder("scheduling.kill_switch_rejections")
                .description("Requests rejected because the scheduling kill switch was active")
                .register(registry);

        this.degradedRunCounter = Counter.builder("scheduling.degraded_runs")
                .description("Runs that fell back to estimated travel times")
                .register(registry);

        this.unscheduledJobCounter = Counter.builder("scheduling.unscheduled_jobs")
                .description("Jobs left unscheduled by optimization runs")
                .register(registry);

        this.optimizationLatencyTimer = Timer.builder("scheduling.optimization.latency")
                .description("Wall-clock time of a full optimization run, commit included")
                .publishPercentiles(0.5, 0.95, 0.99)
                .publishPercentileHistogram(true)
                .minimumExpectedValue(Duration.ofMillis(10))
                .maximumExpectedValue(Duration.ofSeconds(60))
                .register(registry);

        Gauge.builder("scheduling.active_runs", activeRuns, ActiveRunRegistry::activeCount)
                .description("Optimizations currently running on this instance")
                .register(registry);
    }

    public void recordRun(RunStatus status) {
        Counter counter = runCounters.get(status);
        if (counter != null) {
            counter.increment();
        }
    }

    public void recordAdaptation(DisruptionState state)  { adaptationCounters.get(state).increment(); }
    public void recordBusyRejection()                     { busyRejectionCounter.increment(); }
    public void recordKillSwitchRejection()               { killSwitchCounter.increment(); }
    public void recordDegradedRun()                       { degradedRunCounter.increment(); }
    public void recordUnscheduledJobs(int count)          { unscheduledJobCounter.increment(count); }
    public Timer getOptimizationLatencyTimer()            { return optimizationLatencyTimer; }
}
